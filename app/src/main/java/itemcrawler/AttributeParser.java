package itemcrawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

// Reads the label/value rows of an item page's infobox.
public class AttributeParser {

    static final String CONTAINER = "div.infobox";

    // Empty when the page has no infobox (redirects, disambiguation pages and the like).
    public Optional<Map<String, String>> parse(String html, String pageUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl);
        return parse(doc);
    }

    public Optional<Map<String, String>> parse(Document doc) {
        Element infobox = doc.selectFirst(CONTAINER);
        if (infobox == null) return Optional.empty();

        Map<String, String> data = new LinkedHashMap<>();
        for (Element row : infobox.select("tr")) {
            Elements cols = row.select("td");
            if (cols.size() != 2) continue;

            // Later rows overwrite earlier ones with the same label
            data.put(cols.get(0).text().trim(), cols.get(1).text().trim());
        }
        return Optional.of(data);
    }
}
