package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

public class OutputManager {

    private static final Logger log = LoggerFactory.getLogger(OutputManager.class);

    static final String FAILURES_FILE = "failures.csv";

    // Root of the export: <output>/weapons, <output>/equipment, <output>/failures.csv
    private final Path outputDir;

    private final FailureLogger failureLogger;

    public OutputManager(Path outputDir, FailureLogger failureLogger) {
        this.outputDir = outputDir;
        this.failureLogger = failureLogger;
    }

    // Create the archetype folders up front so a bad output path fails before any fetching.
    public void prepareDirectories() throws IOException {
        for (Archetype archetype : Archetype.values()) {
            Files.createDirectories(outputDir.resolve(archetype.directory()));
        }
    }

    public Path failuresFile() {
        return outputDir.resolve(FAILURES_FILE);
    }

    // Rewrites failures.csv for this run; a clean run removes a stale one.
    public void writeFailuresFile() {
        Path out = failuresFile();
        try {
            if (failureLogger.isEmpty()) {
                Files.deleteIfExists(out);
                return;
            }

            // Very simple CSV: category,url,type,message
            List<String> lines = new ArrayList<>();
            lines.add("category,url,type,message");

            for (FailureRecord f : failureLogger.snapshot()) {
                lines.add(csv(f.category()) + "," + csv(f.url()) + "," + csv(f.type()) + "," + csv(f.message()));
            }

            Files.createDirectories(outputDir);
            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

            log.info("Wrote failures file: {}", out);
        } catch (IOException e) {
            log.error("Could not write failures file {}: {}", out, e.getMessage());
        }
    }

    // Quote CSV fields safely (minimal)
    private static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
