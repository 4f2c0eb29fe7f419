package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// CLI entry point that parses args and launches the crawl.
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = """
            Usage: [<baseUrl> <outputDir> [<category>...]]
            Example: https://wiki.project1999.com output Head Primary
            Without arguments every category of https://wiki.project1999.com is written to ./output
            """;

    public static void main(String[] args) {
        CrawlerConfig config = parseArgs(args);
        if (config == null) {
            System.err.println(USAGE);
            System.exit(1);
        }
        System.exit(run(config));
    }

    // Runs the crawl and logs the summary; returns the process exit status.
    static int run(CrawlerConfig config) {
        log.info("Starting item crawler");
        log.info("Base URL: {}", config.baseUrl());
        log.info("Output directory: {}", config.outputDir().toAbsolutePath());

        try {
            CrawlReport report = CrawlOrchestrator.fromConfig(config).crawlCategories();
            printFinalSummary(report);
            return 0;
        } catch (Exception e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            return 1;
        }
    }

    // Null when the arguments are unusable; the reason is printed to stderr.
    static CrawlerConfig parseArgs(String[] args) {
        if (args.length == 0) return CrawlerConfig.defaults();
        if (args.length == 1) {
            System.err.println("Missing output directory");
            return null;
        }

        String baseUrl = args[0].trim();
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            System.err.println("Invalid base URL: " + args[0] + " (must start with http:// or https://)");
            return null;
        }

        Path outputDir = Path.of(args[1]);

        List<String> categories = new ArrayList<>();
        for (int i = 2; i < args.length; i++) {
            String category = args[i].trim();
            if (!ItemCategories.isKnownCategory(category)) {
                System.err.println("Unknown category: " + category + " (known: " + ItemCategories.CRAWL_CATEGORIES + ")");
                return null;
            }
            if (!categories.contains(category)) categories.add(category);
        }
        if (categories.isEmpty()) categories.addAll(ItemCategories.CRAWL_CATEGORIES);

        return CrawlerConfig.of(baseUrl, outputDir, categories);
    }

    // Operator-facing end-of-run report.
    private static void printFinalSummary(CrawlReport report) {
        log.info("==== Run summary ====");
        report.scrapedPerCategory().forEach((category, count) -> log.info("{}: {} items scraped", category, count));
        log.info("Successfully processed {} distinct items", report.distinctItems());
        if (report.hasFailures()) {
            log.warn("{} failures, details in failures.csv:", report.failures().size());
            for (String url : report.failedUrls()) {
                log.warn("  {}", url);
            }
        }
    }
}
