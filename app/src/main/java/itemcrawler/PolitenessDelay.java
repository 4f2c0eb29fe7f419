package itemcrawler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

// Pause between successive listing requests.
@FunctionalInterface
public interface PolitenessDelay {

    void pause() throws InterruptedException;

    // Sleeps a uniformly random time in [min, max].
    static PolitenessDelay uniform(Duration min, Duration max) {
        long lo = min.toMillis();
        long hi = max.toMillis();
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid delay bounds: " + min + " .. " + max);
        }
        return () -> Thread.sleep(lo == hi ? lo : ThreadLocalRandom.current().nextLong(lo, hi + 1));
    }

    static PolitenessDelay none() {
        return () -> { };
    }
}
