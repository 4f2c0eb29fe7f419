package itemcrawler;

import java.nio.file.Path;

// Chooses the CSV file an item is exported to.
@FunctionalInterface
public interface DestinationResolver {

    Path resolve(ItemRecord record);
}
