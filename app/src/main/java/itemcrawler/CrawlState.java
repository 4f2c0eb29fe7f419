package itemcrawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Mutable bookkeeping for one category's pagination.
public class CrawlState {

    private final String categoryUrl;
    private final Set<String> visited = new LinkedHashSet<>();
    private final List<String> failedUrls = new ArrayList<>();
    private String cursor;
    private int pagesFetched;

    public CrawlState(String categoryUrl) {
        this.categoryUrl = categoryUrl;
    }

    public String categoryUrl() {
        return categoryUrl;
    }

    // True when the URL was not seen before in this category.
    boolean markVisited(String url) {
        return visited.add(url);
    }

    void setCursor(String cursor) {
        this.cursor = cursor;
    }

    void recordFetch() {
        pagesFetched++;
    }

    void recordFailure(String url) {
        failedUrls.add(url);
    }

    public Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }

    public String cursor() {
        return cursor;
    }

    public List<String> failedUrls() {
        return Collections.unmodifiableList(failedUrls);
    }

    public int pagesFetched() {
        return pagesFetched;
    }
}
