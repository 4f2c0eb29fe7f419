package itemcrawler;

import java.io.IOException;

// HTTP GET capability shared by the paginator and the item scraper.
// Non-2xx statuses are returned, not thrown; IOException means the request never completed.
@FunctionalInterface
public interface PageTransport {

    FetchResponse get(String url) throws IOException;
}
