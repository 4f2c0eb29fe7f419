package itemcrawler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

// Parsed CLI parameters for a crawl run, plus the fixed politeness and cache settings.
public record CrawlerConfig(
        String baseUrl,
        Path outputDir,
        List<String> categories,   // subset of ItemCategories.CRAWL_CATEGORIES, in crawl order
        Path cacheDir,
        Duration cacheExpiry,
        Duration minDelay,
        Duration maxDelay,
        Duration requestTimeout,
        String userAgent
) {
    public static final String DEFAULT_BASE_URL = "https://wiki.project1999.com";
    public static final String DEFAULT_OUTPUT_DIR = "output";
    public static final String DEFAULT_USER_AGENT = "EverQuest Item Scraper (Educational)";

    public CrawlerConfig {
        categories = List.copyOf(categories);
    }

    public static CrawlerConfig defaults() {
        return of(DEFAULT_BASE_URL, Path.of(DEFAULT_OUTPUT_DIR), ItemCategories.CRAWL_CATEGORIES);
    }

    public static CrawlerConfig of(String baseUrl, Path outputDir, List<String> categories) {
        return new CrawlerConfig(
                UrlUtil.stripTrailingSlash(baseUrl),
                outputDir,
                categories,
                Path.of("item_cache"),
                Duration.ofHours(1),
                Duration.ofMillis(500),
                Duration.ofMillis(1000),
                Duration.ofSeconds(15),
                DEFAULT_USER_AGENT);
    }
}
