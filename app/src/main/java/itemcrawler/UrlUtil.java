package itemcrawler;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

public class UrlUtil {

    // Wiki namespaces that never hold item pages.
    static final List<String> NAMESPACE_MARKERS = List.of(
            "Category:", "Special:", "File:", "Discussion:",
            "Help:", "User:", "Template:", "Project:");

    private static final int MAX_FILENAME_BASE = 160;

    // Filesystem-safe filename for a URL, always with a hash suffix so similar URLs never collide.
    public static String toSafeFilenameWithHash(String url) {
        String safe = url.replaceAll("[^a-zA-Z0-9]+", "_");
        if (safe.length() > MAX_FILENAME_BASE) {
            safe = safe.substring(0, MAX_FILENAME_BASE);
        }
        return safe + "__" + shortHash(url) + ".html";
    }

    // Short hash for filenames to avoid collisions.
    private static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            // 12 hex chars is plenty for collisions to be extremely unlikely here
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isNamespaced(String href) {
        for (String marker : NAMESPACE_MARKERS) {
            if (href.contains(marker)) return true;
        }
        return false;
    }

    // "/Cloak_of_Flames" but not "//cdn.example.com/x" (protocol-relative).
    public static boolean isSiteRelative(String href) {
        return href.startsWith("/") && !href.startsWith("//");
    }

    // Trim and sanitize raw href strings from HTML.
    public static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        return s.isEmpty() ? null : s;
    }

    // Resolve relative hrefs against a base URL, null when either side does not parse.
    public static String resolveAgainst(String baseUrl, String href) {
        try {
            URI base = new URI(baseUrl);
            URI rel = new URI(href);
            return base.resolve(rel).toString();
        } catch (Exception e) {
            // Bad hrefs exist in the wild; just skip them
            return null;
        }
    }

    public static String stripTrailingSlash(String url) {
        String s = url;
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }

    // Next listing page: the category URL with the cursor as ?pagefrom=
    public static String withPageFrom(String categoryUrl, String cursor) {
        if (cursor == null || cursor.isBlank()) return categoryUrl;
        String sep = categoryUrl.contains("?") ? "&" : "?";
        return categoryUrl + sep + "pagefrom=" + URLEncoder.encode(cursor, StandardCharsets.UTF_8);
    }

    // Display name from the last path segment: "/Cloak_of_Flames" -> "Cloak of Flames".
    public static String itemNameFromUrl(String url) {
        String path;
        try {
            path = new URI(url).getPath();   // decodes %27 and friends
        } catch (Exception e) {
            path = url;
        }
        if (path == null) path = url;

        path = stripTrailingSlash(path);
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.replace('_', ' ').trim();
    }
}
