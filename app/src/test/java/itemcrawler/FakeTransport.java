package itemcrawler;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// In-memory transport: canned pages by URL, 404 for anything else.
class FakeTransport implements PageTransport {

    private final Map<String, FetchResponse> pages = new HashMap<>();
    private final Map<String, IOException> errors = new HashMap<>();
    final List<String> requested = new ArrayList<>();

    FakeTransport page(String url, String html) {
        pages.put(url, new FetchResponse(url, 200, html));
        return this;
    }

    FakeTransport status(String url, int status) {
        pages.put(url, new FetchResponse(url, status, ""));
        return this;
    }

    FakeTransport timeout(String url) {
        errors.put(url, new SocketTimeoutException("Read timed out"));
        return this;
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        requested.add(url);
        IOException error = errors.get(url);
        if (error != null) throw error;
        return pages.getOrDefault(url, new FetchResponse(url, 404, "Not Found"));
    }

    int count(String url) {
        int n = 0;
        for (String r : requested) if (r.equals(url)) n++;
        return n;
    }

    // Listing page markup as the wiki renders it: links inside #mw-content-text.
    static String listing(String... hrefAndTitle) {
        StringBuilder sb = new StringBuilder("<html><body><div id=\"mw-head\"><a href=\"/Main_Page\">Main</a></div>");
        sb.append("<div id=\"mw-content-text\"><ul>");
        for (int i = 0; i < hrefAndTitle.length; i += 2) {
            sb.append("<li><a href=\"").append(hrefAndTitle[i]).append("\">")
                    .append(hrefAndTitle[i + 1]).append("</a></li>");
        }
        sb.append("</ul></div></body></html>");
        return sb.toString();
    }

    // Item page markup with an infobox of label/value rows.
    static String itemPage(String... labelAndValue) {
        StringBuilder sb = new StringBuilder("<html><body><div class=\"infobox\"><table>");
        sb.append("<tr><th colspan=\"2\">Item</th></tr>");
        for (int i = 0; i < labelAndValue.length; i += 2) {
            sb.append("<tr><td>").append(labelAndValue[i]).append("</td><td>")
                    .append(labelAndValue[i + 1]).append("</td></tr>");
        }
        sb.append("</table></div></body></html>");
        return sb.toString();
    }
}
