package itemcrawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Outcome of a run.
// scrapedPerCategory counts items scraped per category, so an item listed in two categories counts
// in both, and a category whose export failed still shows what it scraped (see failures).
// distinctItems counts each item page once across the run.
public record CrawlReport(Map<String, Integer> scrapedPerCategory, int distinctItems, List<FailureRecord> failures) {

    public CrawlReport {
        scrapedPerCategory = Collections.unmodifiableMap(new LinkedHashMap<>(scrapedPerCategory));
        failures = List.copyOf(failures);
    }

    public List<String> failedUrls() {
        List<String> urls = new ArrayList<>(failures.size());
        for (FailureRecord f : failures) urls.add(f.url());
        return urls;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
