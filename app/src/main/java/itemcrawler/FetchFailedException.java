package itemcrawler;

import java.io.IOException;
import java.net.SocketTimeoutException;

// A detail page that could not be fetched; type is the failures.csv category.
public class FetchFailedException extends IOException {

    private final String url;
    private final String type;

    public FetchFailedException(String url, String type, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.type = type;
    }

    static FetchFailedException ofStatus(String url, int statusCode) {
        return new FetchFailedException(url, "HTTP_" + statusCode, "HTTP status " + statusCode, null);
    }

    static FetchFailedException ofTransport(String url, IOException cause) {
        String type = cause instanceof SocketTimeoutException ? "TIMEOUT" : "FAILED";
        return new FetchFailedException(url, type, cause.getMessage(), cause);
    }

    public String url() {
        return url;
    }

    public String type() {
        return type;
    }
}
