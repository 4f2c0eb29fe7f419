package itemcrawler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BucketedExporterTest {

    private final ItemClassifier classifier = new ItemClassifier();

    private List<ItemRecord> batch() {
        return List.of(
                classifier.classify("Rusty Short Sword", Map.of("Type", "1H Slashing", "Damage", "7", "Delay", "28")),
                classifier.classify("Cap", Map.of("Slot", "Head", "AC", "5")),
                classifier.classify("Dagger", Map.of("Type", "Piercing", "Damage", "5")),
                classifier.classify("Long Sword", Map.of("Type", "1H Slashing", "Damage", "8")),
                classifier.classify("Odd Trinket", Map.of("Slot", "EAR, FINGERS")),
                classifier.classify("Cloak", Map.of("Slot", "BACK", "AC", "4", "Effect", "Fire, \"hot\"")));
    }

    @Test
    void rowCountsMatchRoutedRecords(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));

        Map<Path, Integer> written = exporter.export(batch());

        Path slashing = out.resolve("weapons").resolve("Slashing.csv");
        assertEquals(2, written.get(slashing));
        assertEquals(1, written.get(out.resolve("weapons").resolve("Piercing.csv")));
        assertEquals(1, written.get(out.resolve("equipment").resolve("Head.csv")));
        assertEquals(1, written.get(out.resolve("equipment").resolve("misc.csv")));
        assertEquals(1, written.get(out.resolve("equipment").resolve("Back.csv")));

        int rows = 0;
        for (Path file : written.keySet()) {
            List<List<String>> read = BucketedExporter.readRows(file);
            assertEquals(written.get(file), read.size() - 1);
            rows += read.size() - 1;
        }
        assertEquals(batch().size(), rows);
    }

    @Test
    void emptyBucketsProduceNoFile(@TempDir Path out) throws Exception {
        new BucketedExporter(new BucketResolver(out)).export(batch());

        assertFalse(Files.exists(out.resolve("weapons").resolve("Blunt.csv")));
        assertFalse(Files.exists(out.resolve("equipment").resolve("Chest.csv")));
    }

    @Test
    void writtenRowsReadBackToOriginalValues(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));
        List<ItemRecord> records = batch();
        exporter.export(records);

        List<List<String>> back = BucketedExporter.readRows(out.resolve("equipment").resolve("Back.csv"));

        assertEquals(Archetype.EQUIPMENT.fields(), back.get(0));
        List<String> row = back.get(1);
        ItemRecord cloak = records.get(5);
        for (int i = 1; i < Archetype.EQUIPMENT.fields().size(); i++) {
            assertEquals(cloak.attribute(Archetype.EQUIPMENT.fields().get(i)), row.get(i));
        }
        assertEquals("Cloak", row.get(0));
        assertEquals("Fire, \"hot\"", row.get(Archetype.EQUIPMENT.fields().indexOf("Effect")));
        assertEquals("", row.get(Archetype.EQUIPMENT.fields().indexOf("Stats")));
    }

    @Test
    void reExportReplacesInsteadOfAppending(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));
        exporter.export(batch());
        exporter.export(batch());

        List<List<String>> rows = BucketedExporter.readRows(out.resolve("weapons").resolve("Slashing.csv"));

        assertEquals(3, rows.size());
        assertEquals("Rusty Short Sword", rows.get(1).get(0));
        assertEquals("Long Sword", rows.get(2).get(0));
    }

    @Test
    void filteredExportOnlyTouchesAcceptedFiles(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));
        Path head = out.resolve("equipment").resolve("Head.csv");

        Map<Path, Integer> written = exporter.export(batch(), head::equals);

        assertEquals(Map.of(head, 1), written);
        assertFalse(Files.exists(out.resolve("weapons").resolve("Slashing.csv")));
    }

    @Test
    void appendWritesHeaderOnlyOnce(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));
        Path file = out.resolve("incremental.csv");
        ItemRecord cap = classifier.classify("Cap", Map.of("Slot", "Head", "AC", "5"));
        ItemRecord hood = classifier.classify("Hood", Map.of("Slot", "Head", "AC", "2"));

        exporter.append(cap, file);
        exporter.append(hood, file);

        List<List<String>> rows = BucketedExporter.readRows(file);
        assertEquals(3, rows.size());
        assertEquals(Archetype.EQUIPMENT.fields(), rows.get(0));
        assertEquals(hood.toRow(), rows.get(2));
    }

    @Test
    void appendUsesResolverDestination(@TempDir Path out) throws Exception {
        BucketedExporter exporter = new BucketedExporter(new BucketResolver(out));

        exporter.append(classifier.classify("Bow", Map.of("Type", "Archery")));

        assertTrue(Files.exists(out.resolve("equipment").resolve("misc.csv")));
    }

    @Test
    void csvQuotesOnlyWhenNeeded() {
        assertEquals("a,\"b,c\",\"d \"\"e\"\"\",", CsvFormat.line(List.of("a", "b,c", "d \"e\"", "")));
        assertEquals(List.of(List.of("a", "b,c", "d \"e\"", "")),
                CsvFormat.parse("a,\"b,c\",\"d \"\"e\"\"\",\n"));
    }
}
