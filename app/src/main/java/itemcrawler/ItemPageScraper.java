package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

// Fetch, parse and classify one item page.
public class ItemPageScraper {

    private static final Logger log = LoggerFactory.getLogger(ItemPageScraper.class);

    private final PageTransport transport;
    private final AttributeParser parser;
    private final ItemClassifier classifier;

    public ItemPageScraper(PageTransport transport, AttributeParser parser, ItemClassifier classifier) {
        this.transport = transport;
        this.parser = parser;
        this.classifier = classifier;
    }

    // Empty when the page is not an item page (no infobox, or an infobox without rows).
    public Optional<ItemRecord> scrape(String url) throws FetchFailedException {
        FetchResponse response;
        try {
            response = transport.get(url);
        } catch (IOException e) {
            throw FetchFailedException.ofTransport(url, e);
        }
        if (!response.isSuccess()) {
            throw FetchFailedException.ofStatus(url, response.statusCode());
        }

        Optional<Map<String, String>> attributes = parser.parse(response.body(), url);
        if (attributes.isEmpty() || attributes.get().isEmpty()) {
            log.debug("No item data on {}, skipping", url);
            return Optional.empty();
        }

        String name = UrlUtil.itemNameFromUrl(url);
        if (name.isEmpty()) {
            log.debug("No item name in {}, skipping", url);
            return Optional.empty();
        }

        ItemRecord item = classifier.classify(name, attributes.get());
        log.debug("Scraped {} ({})", item.name(), item.archetype());
        return Optional.of(item);
    }
}
