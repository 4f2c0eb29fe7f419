package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// Runs the category list through pagination, item scraping and export, one category at a time.
public class CrawlOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

    static final String AD_HOC = "adhoc";

    private final String baseUrl;
    private final List<String> categories;
    private final CategoryPaginator paginator;
    private final ItemPageScraper scraper;
    private final BucketedExporter exporter;
    private final OutputManager outputManager;
    private final FailureLogger failureLogger;

    // Every item exported so far in this run, keyed by page URL.
    // Categories overlap (Primary/Secondary share weapon buckets), so each category export
    // rewrites its files from the whole run rather than from the category alone.
    private final Map<String, ItemRecord> runItems = new LinkedHashMap<>();

    public CrawlOrchestrator(String baseUrl,
                             List<String> categories,
                             CategoryPaginator paginator,
                             ItemPageScraper scraper,
                             BucketedExporter exporter,
                             OutputManager outputManager,
                             FailureLogger failureLogger) {
        this.baseUrl = UrlUtil.stripTrailingSlash(baseUrl);
        this.categories = List.copyOf(categories);
        this.paginator = paginator;
        this.scraper = scraper;
        this.exporter = exporter;
        this.outputManager = outputManager;
        this.failureLogger = failureLogger;
    }

    // Wire the live stack for a run: cached jsoup transport, random politeness delay, bucket files.
    public static CrawlOrchestrator fromConfig(CrawlerConfig config) {
        PageTransport transport = new CachingTransport(
                new JsoupTransport(config.userAgent(), config.requestTimeout()),
                config.cacheDir(),
                config.cacheExpiry());
        return create(config, transport, PolitenessDelay.uniform(config.minDelay(), config.maxDelay()));
    }

    static CrawlOrchestrator create(CrawlerConfig config, PageTransport transport, PolitenessDelay delay) {
        FailureLogger failureLogger = new FailureLogger();
        return new CrawlOrchestrator(
                config.baseUrl(),
                config.categories(),
                new CategoryPaginator(transport, config.baseUrl(), delay),
                new ItemPageScraper(transport, new AttributeParser(), new ItemClassifier()),
                new BucketedExporter(new BucketResolver(config.outputDir())),
                new OutputManager(config.outputDir(), failureLogger),
                failureLogger);
    }

    // Crawl every configured category. Only an unusable output directory aborts the run.
    public CrawlReport crawlCategories() throws IOException {
        outputManager.prepareDirectories();

        Map<String, Integer> perCategory = new LinkedHashMap<>();
        for (String category : categories) {
            List<ItemRecord> items = scrapeCategory(category);
            perCategory.put(category, items.size());
        }

        outputManager.writeFailuresFile();
        if (perCategory.values().stream().allMatch(n -> n == 0)) {
            log.warn("No items found!");
        }
        return new CrawlReport(perCategory, runItems.size(), failureLogger.snapshot());
    }

    public List<ItemRecord> scrapeCategory(String category) {
        String categoryUrl = ItemCategories.categoryUrl(baseUrl, category);
        log.info("Processing category: {}", category);

        CrawlState state = paginator.crawl(categoryUrl);
        for (String failed : state.failedUrls()) {
            failureLogger.add(category, failed, "LISTING", "listing page could not be fetched");
        }
        if (state.visited().isEmpty()) {
            log.warn("No items found in category {}", category);
            return List.of();
        }

        Map<String, ItemRecord> scraped = scrapeBatch(category, state.visited());
        List<ItemRecord> items = new ArrayList<>(scraped.values());
        if (items.isEmpty()) {
            log.warn("No valid items found in category {}", category);
            return items;
        }

        runItems.putAll(scraped);
        Set<Path> touched = exporter.destinationsOf(items);
        try {
            exporter.export(new ArrayList<>(runItems.values()), touched::contains);
        } catch (IOException e) {
            failureLogger.add(category, categoryUrl, "SAVE_FAILED", e.getMessage());
        }
        return items;
    }

    // Scrape an explicit URL list and export it as one batch.
    public List<ItemRecord> scrapeUrls(Collection<String> urls) {
        List<ItemRecord> items = new ArrayList<>(scrapeBatch(AD_HOC, urls).values());
        if (items.isEmpty()) {
            log.warn("No valid items found to process");
        } else {
            try {
                exporter.export(items);
            } catch (IOException e) {
                failureLogger.add(AD_HOC, "", "SAVE_FAILED", e.getMessage());
            }
        }
        outputManager.writeFailuresFile();
        return items;
    }

    // Items keyed by page URL, in crawl order. Failures go to the failure logger.
    private Map<String, ItemRecord> scrapeBatch(String label, Collection<String> urls) {
        Map<String, ItemRecord> items = new LinkedHashMap<>();
        for (String url : urls) {
            // Listing pages are never item pages
            if (url.contains("Category:")) continue;

            try {
                Optional<ItemRecord> item = scraper.scrape(url);
                item.ifPresent(record -> items.put(url, record));
            } catch (FetchFailedException e) {
                failureLogger.add(label, e.url(), e.type(), e.getMessage());
            } catch (RuntimeException e) {
                log.debug("Unexpected error scraping {}", url, e);
                failureLogger.add(label, url, "ERROR", String.valueOf(e));
            }
        }
        log.info("Found {} items in {}", items.size(), label);
        return items;
    }
}
