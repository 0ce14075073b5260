package webpilot.session;

import java.util.regex.Pattern;

/**
 * Adds {@code https://} to addresses typed without a scheme.
 */
public final class UrlNormalizer {

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");
    private static final Pattern OPAQUE_SCHEME = Pattern.compile("^(?i)(about|data|javascript|mailto|file):.*");

    private UrlNormalizer() {}

    public static String normalize(String url) {
        String trimmed = url == null ? "" : url.trim();
        if (trimmed.isEmpty()) return trimmed;
        if (HAS_SCHEME.matcher(trimmed).matches() || OPAQUE_SCHEME.matcher(trimmed).matches()) {
            return trimmed;
        }
        return "https://" + trimmed;
    }
}
