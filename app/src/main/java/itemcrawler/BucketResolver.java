package itemcrawler;

import java.nio.file.Path;

// Default routing: <output>/weapons/<Type bucket>.csv and <output>/equipment/<Slot bucket>.csv
public class BucketResolver implements DestinationResolver {

    static final String SLOT_FIELD = "Slot";

    private final Path outputDir;

    public BucketResolver(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path resolve(ItemRecord record) {
        return outputDir
                .resolve(record.archetype().directory())
                .resolve(bucketOf(record) + ".csv");
    }

    public static String bucketOf(ItemRecord record) {
        if (record.archetype() == Archetype.WEAPON) {
            return ItemCategories.weaponBucket(
                    ItemClassifier.lookupIgnoreCase(record.attributes(), ItemClassifier.TYPE_FIELD));
        }
        return ItemCategories.equipmentBucket(
                ItemClassifier.lookupIgnoreCase(record.attributes(), SLOT_FIELD));
    }
}
