package webpilot.resolver;

/**
 * Builds an XPath matching the innermost elements whose normalised text
 * contains a phrase, ignoring case.
 *
 * <p>XPath 1.0 can only fold case through {@code translate}, so both sides
 * fold A-Z alone; other letters must match exactly.
 */
final class VisibleTextXPath {

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

    private VisibleTextXPath() {}

    static String containing(String text) {
        String needle = literal(foldAscii(normalize(text)));
        String haystack = "translate(normalize-space(string(.)),'" + UPPER + "','" + LOWER + "')";
        String match = "contains(" + haystack + "," + needle + ")";
        return "//body//*[not(self::script or self::style)][" + match + "][not(*[" + match + "])]";
    }

    /** Lower-cases A-Z only, the same mapping the expression applies to page text. */
    static String foldAscii(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c);
        }
        return sb.toString();
    }

    static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    /** Quotes a string as an XPath 1.0 literal; mixed quotes need concat(). */
    static String literal(String s) {
        if (!s.contains("'")) return "'" + s + "'";
        if (!s.contains("\"")) return "\"" + s + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(",\"'\",");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }
}
