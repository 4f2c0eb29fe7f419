package itemcrawler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CategoryPaginatorTest {

    private static final String BASE = "https://w.test";
    private static final String HEAD = BASE + "/Category:Head";

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void followsCursorUntilAPageAddsNothing() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, FakeTransport.listing(
                        "/Cap_A", "Cap A",
                        "/Category:Hats", "Hats",
                        "/Special:Random", "Random",
                        "/File:Cap.png", "image",
                        "https://elsewhere.test/Cap_Z", "Cap Z",
                        "/Cap_B", "Cap B"))
                .page(HEAD + "?pagefrom=Cap+B", FakeTransport.listing(
                        "/Cap_B", "Cap B",
                        "/Cap_C", "Cap C"))
                .page(HEAD + "?pagefrom=Cap+C", FakeTransport.listing(
                        "/Cap_C", "Cap C"));
        AtomicInteger pauses = new AtomicInteger();

        CrawlState state = new CategoryPaginator(transport, BASE, pauses::incrementAndGet).crawl(HEAD);

        assertEquals(List.of(BASE + "/Cap_A", BASE + "/Cap_B", BASE + "/Cap_C"), new ArrayList<>(state.visited()));
        assertEquals(3, state.pagesFetched());
        assertEquals(2, pauses.get());
        assertEquals("Cap C", state.cursor());
        assertTrue(state.failedUrls().isEmpty());
    }

    @Test
    void linkOnTwoPagesIsReturnedOnce() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, FakeTransport.listing("/Cap_A", "Cap A", "/Cap_B", "Cap B"))
                .page(HEAD + "?pagefrom=Cap+B", FakeTransport.listing("/Cap_A", "Cap A", "/Cap_D", "Cap D"))
                .page(HEAD + "?pagefrom=Cap+D", FakeTransport.listing("/Cap_D", "Cap D"));

        Set<String> urls = new CategoryPaginator(transport, BASE, PolitenessDelay.none()).paginate(HEAD);

        assertEquals(Set.of(BASE + "/Cap_A", BASE + "/Cap_B", BASE + "/Cap_D"), urls);
    }

    @Test
    void stopsWhenServerRepeatsTheSamePage() {
        String same = FakeTransport.listing("/Cap_A", "Cap A", "/Cap_B", "Cap B");
        List<String> requested = new ArrayList<>();
        PageTransport repeating = url -> {
            requested.add(url);
            return new FetchResponse(url, 200, same);
        };

        Set<String> urls = new CategoryPaginator(repeating, BASE, PolitenessDelay.none()).paginate(HEAD);

        assertEquals(2, urls.size());
        assertEquals(2, requested.size());
    }

    @Test
    void listingFailureKeepsWhatWasFound() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, FakeTransport.listing("/Cap_A", "Cap A"))
                .status(HEAD + "?pagefrom=Cap+A", 503);

        CrawlState state = new CategoryPaginator(transport, BASE, PolitenessDelay.none()).crawl(HEAD);

        assertEquals(Set.of(BASE + "/Cap_A"), state.visited());
        assertEquals(List.of(HEAD + "?pagefrom=Cap+A"), state.failedUrls());
    }

    @Test
    void transportErrorEndsPagination() {
        FakeTransport transport = new FakeTransport().timeout(HEAD);

        CrawlState state = new CategoryPaginator(transport, BASE, PolitenessDelay.none()).crawl(HEAD);

        assertTrue(state.visited().isEmpty());
        assertEquals(List.of(HEAD), state.failedUrls());
        assertEquals(0, state.pagesFetched());
    }

    @Test
    void blankLastTitleStopsEvenWithNewLinks() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, FakeTransport.listing("/Cap_A", "Cap A", "/Cap_B", " "));

        CrawlState state = new CategoryPaginator(transport, BASE, PolitenessDelay.none()).crawl(HEAD);

        assertEquals(2, state.visited().size());
        assertEquals(List.of(HEAD), transport.requested);
    }

    @Test
    void pageWithoutContentRegionEndsCrawl() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, "<html><body><a href=\"/Cap_A\">Cap A</a></body></html>");

        Set<String> urls = new CategoryPaginator(transport, BASE, PolitenessDelay.none()).paginate(HEAD);

        assertTrue(urls.isEmpty());
        assertEquals(1, transport.requested.size());
    }

    @Test
    void interruptedDelayStopsAfterCurrentPage() {
        FakeTransport transport = new FakeTransport()
                .page(HEAD, FakeTransport.listing("/Cap_A", "Cap A"))
                .page(HEAD + "?pagefrom=Cap+A", FakeTransport.listing("/Cap_B", "Cap B"));
        PolitenessDelay interrupted = () -> {
            throw new InterruptedException("stop");
        };

        Set<String> urls = new CategoryPaginator(transport, BASE, interrupted).paginate(HEAD);

        assertEquals(Set.of(BASE + "/Cap_A"), urls);
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void uniformDelayRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> PolitenessDelay.uniform(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}
