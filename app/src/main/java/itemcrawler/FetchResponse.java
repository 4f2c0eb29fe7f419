package itemcrawler;

// Raw result of one GET: final status code and body text.
public record FetchResponse(String url, int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode == 200;
    }
}
