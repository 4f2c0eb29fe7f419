package itemcrawler;

// A detail-page link found on a listing page, with the text the wiki displays for it.
public record ListingLink(String url, String title) { }
