package webpilot.resolver;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * CSS identifier escaping, following the serialisation rules of {@code CSS.escape}.
 */
final class CssSelectors {

    private CssSelectors() {}

    /** {@code "btn primary"} becomes {@code ".btn.primary"}. */
    static String compoundClass(String classAttribute) {
        return Arrays.stream(classAttribute.trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .map(c -> "." + escape(c))
                .collect(Collectors.joining());
    }

    static String escape(String ident) {
        StringBuilder sb = new StringBuilder(ident.length() + 8);
        for (int i = 0; i < ident.length(); i++) {
            char c = ident.charAt(i);
            if (c == 0) {
                sb.append('\uFFFD');
            } else if ((c >= 0x1 && c <= 0x1F) || c == 0x7F
                    || (i == 0 && Character.isDigit(c))
                    || (i == 1 && Character.isDigit(c) && ident.charAt(0) == '-')) {
                sb.append('\\').append(Integer.toHexString(c)).append(' ');
            } else if (i == 0 && c == '-' && ident.length() == 1) {
                sb.append("\\-");
            } else if (c >= 0x80 || c == '-' || c == '_' || Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append('\\').append(c);
            }
        }
        return sb.toString();
    }
}
