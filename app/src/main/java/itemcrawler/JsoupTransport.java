package itemcrawler;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

// Live transport on top of jsoup's connection.
// Certificate validation is switched off: the wiki has served broken chains in the past.
public class JsoupTransport implements PageTransport {

    private final String userAgent;
    private final Duration timeout;
    private final SSLSocketFactory sslSocketFactory;

    public JsoupTransport(String userAgent, Duration timeout) {
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.sslSocketFactory = trustAllSocketFactory();
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                .ignoreHttpErrors(true)   // status goes back to the caller
                .sslSocketFactory(sslSocketFactory)
                .execute();

        return new FetchResponse(url, response.statusCode(), response.body());
    }

    private static SSLSocketFactory trustAllSocketFactory() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS not available", e);
        }
    }
}
