package itemcrawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// Walks a wiki category listing page by page and collects every item link it shows.
// Each page is requested with ?pagefrom= set to the title of the last new link of the previous page.
// The walk ends when a page adds nothing new, when that title is blank, or when a listing request fails.
public class CategoryPaginator {

    private static final Logger log = LoggerFactory.getLogger(CategoryPaginator.class);

    static final String CONTENT_REGION = "#mw-content-text";

    enum Step { FETCH, EXTRACT, DECIDE, DONE }

    private final PageTransport transport;
    private final String baseUrl;
    private final PolitenessDelay delay;

    public CategoryPaginator(PageTransport transport, String baseUrl, PolitenessDelay delay) {
        this.transport = transport;
        this.baseUrl = UrlUtil.stripTrailingSlash(baseUrl);
        this.delay = delay;
    }

    public Set<String> paginate(String categoryUrl) {
        return crawl(categoryUrl).visited();
    }

    // Runs the state machine to completion and returns the final state.
    public CrawlState crawl(String categoryUrl) {
        CrawlState state = new CrawlState(categoryUrl);
        Step step = Step.FETCH;
        Document page = null;
        List<ListingLink> fresh = List.of();

        while (step != Step.DONE) {
            switch (step) {
                case FETCH -> {
                    page = fetchListing(UrlUtil.withPageFrom(categoryUrl, state.cursor()), state);
                    step = page == null ? Step.DONE : Step.EXTRACT;
                }
                case EXTRACT -> {
                    fresh = extractNewLinks(page, state);
                    step = fresh == null ? Step.DONE : Step.DECIDE;
                }
                case DECIDE -> step = decide(fresh, state);
                default -> throw new IllegalStateException("Unexpected step " + step);
            }
        }

        log.info("Category {}: {} links over {} page(s)", categoryUrl, state.visited().size(), state.pagesFetched());
        return state;
    }

    // Null on a non-200 status or transport error; already discovered links stay in the state.
    private Document fetchListing(String pageUrl, CrawlState state) {
        FetchResponse response;
        try {
            response = transport.get(pageUrl);
        } catch (IOException e) {
            log.warn("Listing fetch failed for {}: {}", pageUrl, e.getMessage());
            state.recordFailure(pageUrl);
            return null;
        }
        state.recordFetch();

        if (!response.isSuccess()) {
            log.warn("Listing {} returned HTTP {}", pageUrl, response.statusCode());
            state.recordFailure(pageUrl);
            return null;
        }
        return Jsoup.parse(response.body() == null ? "" : response.body(), pageUrl);
    }

    // Links on this page not seen before, in document order. Null when the content region is missing.
    List<ListingLink> extractNewLinks(Document page, CrawlState state) {
        Element content = page.selectFirst(CONTENT_REGION);
        if (content == null) {
            log.debug("No content region on {}", page.location());
            return null;
        }

        List<ListingLink> fresh = new ArrayList<>();
        for (Element a : content.select("a[href]")) {
            String href = UrlUtil.cleanHref(a.attr("href"));
            if (href == null || UrlUtil.isNamespaced(href)) continue;
            if (!UrlUtil.isSiteRelative(href)) continue;

            String url = UrlUtil.resolveAgainst(baseUrl, href);
            if (url == null) continue;

            if (state.markVisited(url)) {
                ListingLink link = new ListingLink(url, a.text());
                fresh.add(link);
                log.debug("Found new item: {}", link.title());
            }
        }
        return fresh;
    }

    // Blank cursor ends the walk even when the page did add links.
    private Step decide(List<ListingLink> fresh, CrawlState state) {
        if (fresh.isEmpty()) return Step.DONE;

        String cursor = fresh.get(fresh.size() - 1).title();
        if (cursor == null || cursor.isBlank()) {
            log.debug("Last link on page has no text, stopping at {} links", state.visited().size());
            return Step.DONE;
        }
        state.setCursor(cursor);

        try {
            delay.pause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while paginating {}", state.categoryUrl());
            return Step.DONE;
        }
        return Step.FETCH;
    }
}
