package itemcrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

// Serves successful responses from disk while they are younger than the expiry window.
// One file per URL under the cache directory.
public class CachingTransport implements PageTransport {

    private static final Logger log = LoggerFactory.getLogger(CachingTransport.class);

    private final PageTransport delegate;
    private final Path cacheDir;
    private final Duration expireAfter;
    private final Clock clock;

    public CachingTransport(PageTransport delegate, Path cacheDir, Duration expireAfter) {
        this(delegate, cacheDir, expireAfter, Clock.systemUTC());
    }

    CachingTransport(PageTransport delegate, Path cacheDir, Duration expireAfter, Clock clock) {
        this.delegate = delegate;
        this.cacheDir = cacheDir;
        this.expireAfter = expireAfter;
        this.clock = clock;
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        Path entry = cacheDir.resolve(UrlUtil.toSafeFilenameWithHash(url));

        if (isFresh(entry)) {
            log.debug("Cache hit: {}", url);
            return new FetchResponse(url, 200, Files.readString(entry, StandardCharsets.UTF_8));
        }

        FetchResponse response = delegate.get(url);
        if (response.isSuccess()) {
            store(entry, response);
        }
        return response;
    }

    private boolean isFresh(Path entry) {
        if (!Files.isRegularFile(entry)) return false;
        try {
            Instant written = Files.getLastModifiedTime(entry).toInstant();
            return written.plus(expireAfter).isAfter(clock.instant());
        } catch (IOException e) {
            log.debug("Unreadable cache entry {}: {}", entry, e.getMessage());
            return false;
        }
    }

    // A cache that cannot be written only costs a refetch next time.
    private void store(Path entry, FetchResponse response) {
        try {
            Files.createDirectories(cacheDir);
            Files.writeString(entry, response.body() == null ? "" : response.body(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            log.warn("Could not cache {}: {}", response.url(), e.getMessage());
        }
    }
}
