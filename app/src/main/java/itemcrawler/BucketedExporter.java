package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

// Writes classified items to their bucket CSV files.
// export() rewrites each destination from scratch, so a re-run never keeps rows from an earlier one.
// append() adds a single row and must not run on a file a batch export is writing at the same time.
public class BucketedExporter {

    private static final Logger log = LoggerFactory.getLogger(BucketedExporter.class);

    private final DestinationResolver resolver;

    public BucketedExporter(DestinationResolver resolver) {
        this.resolver = resolver;
    }

    // Returns the number of rows written per file, in first-seen order.
    public Map<Path, Integer> export(List<ItemRecord> records) throws IOException {
        return export(records, path -> true);
    }

    // Same as export(records) but only rewrites the destinations accepted by the filter.
    public Map<Path, Integer> export(List<ItemRecord> records, Predicate<Path> include) throws IOException {
        Map<Path, List<ItemRecord>> grouped = group(records);

        Map<Path, Integer> written = new LinkedHashMap<>();
        for (Map.Entry<Path, List<ItemRecord>> e : grouped.entrySet()) {
            if (!include.test(e.getKey())) continue;
            writeFile(e.getKey(), e.getValue());
            written.put(e.getKey(), e.getValue().size());
            log.info("Exported {} items to {}", e.getValue().size(), e.getKey());
        }
        return written;
    }

    public Set<Path> destinationsOf(Collection<ItemRecord> records) {
        Set<Path> paths = new LinkedHashSet<>();
        for (ItemRecord record : records) paths.add(resolver.resolve(record));
        return paths;
    }

    Map<Path, List<ItemRecord>> group(List<ItemRecord> records) {
        Map<Path, List<ItemRecord>> grouped = new LinkedHashMap<>();
        for (ItemRecord record : records) {
            grouped.computeIfAbsent(resolver.resolve(record), k -> new ArrayList<>()).add(record);
        }
        return grouped;
    }

    // One file holds one archetype, so the first record's schema is the file's header.
    private void writeFile(Path file, List<ItemRecord> records) throws IOException {
        createParent(file);
        Archetype archetype = records.get(0).archetype();

        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            out.write(CsvFormat.line(archetype.fields()));
            out.newLine();
            for (ItemRecord record : records) {
                if (record.archetype() != archetype) {
                    throw new IllegalStateException("Mixed archetypes routed to " + file);
                }
                out.write(CsvFormat.line(record.toRow()));
                out.newLine();
            }
        }
    }

    // Open-or-create; the header goes in only when the file is empty.
    public void append(ItemRecord record, Path file) throws IOException {
        createParent(file);
        boolean empty = !Files.exists(file) || Files.size(file) == 0;

        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            if (empty) {
                out.write(CsvFormat.line(record.archetype().fields()));
                out.newLine();
            }
            out.write(CsvFormat.line(record.toRow()));
            out.newLine();
        }
    }

    public void append(ItemRecord record) throws IOException {
        append(record, resolver.resolve(record));
    }

    // Header first, then one list per data row.
    public static List<List<String>> readRows(Path file) throws IOException {
        return CsvFormat.parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
