package itemcrawler;

// Lightweight failure detail for failures.csv.
public record FailureRecord(String category, String url, String type, String message) { }
