package webpilot.session;

/**
 * Parsers for the string payloads of index-based actions.
 */
public final class ActionPayloads {

    static final String FILL_SEPARATOR = "||";

    private ActionPayloads() {}

    /** Value of a {@code "<index>||<text>"} fill payload. */
    public record Fill(int highlightIndex, String text) {}

    /**
     * @throws PayloadParseException when the payload is not an integer
     */
    public static int parseIndex(String payload) {
        String raw = payload == null ? "" : payload.trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new PayloadParseException("Could not parse highlightIndex from \"" + raw + "\". Must be a number.");
        }
    }

    /**
     * Splits on the first {@code ||}; the text keeps any later separators.
     *
     * @throws PayloadParseException on a non-numeric index or missing text
     */
    public static Fill parseFill(String payload) {
        String raw = payload == null ? "" : payload;
        int sep = raw.indexOf(FILL_SEPARATOR);
        String indexPart = sep < 0 ? raw : raw.substring(0, sep);
        String textPart = sep < 0 ? "" : raw.substring(sep + FILL_SEPARATOR.length());

        int index;
        try {
            index = Integer.parseInt(indexPart.trim());
        } catch (NumberFormatException e) {
            throw new PayloadParseException("Could not parse highlightIndex from \"" + indexPart.trim()
                    + "\". Use \"5||Hello world\" syntax.");
        }
        String text = textPart.trim();
        if (text.isEmpty()) {
            throw new PayloadParseException("No text provided. Use \"5||Hello world.\"");
        }
        return new Fill(index, text);
    }
}
