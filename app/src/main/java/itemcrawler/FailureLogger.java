package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

// Collects every failure of a run for the summary and failures.csv, logging each as it happens.
public class FailureLogger {

    private static final Logger log = LoggerFactory.getLogger(FailureLogger.class);

    // Single crawl thread; a parallel crawl would need one logger per category or a concurrent list.
    private final List<FailureRecord> failures = new ArrayList<>();

    public void add(String category, String url, String type, String message) {
        add(new FailureRecord(category, url, type, message));
    }

    public void add(FailureRecord record) {
        if (record == null) return;
        log.warn("[{}] {} {}: {}", record.category(), record.type(), record.url(), record.message());
        failures.add(record);
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public List<FailureRecord> snapshot() {
        return new ArrayList<>(failures);
    }
}
