package bio.treeio.parse;

import java.util.Objects;

/**
 * Read position over an immutable piece of text. A cursor belongs to a single parse call.
 */
public final class TextCursor {

    private final String text;
    private int offset;

    public TextCursor(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public int offset() {
        return offset;
    }

    public String remaining() {
        return text.substring(offset);
    }

    public boolean isExhausted() {
        return offset >= text.length();
    }

    void skipWhitespace() {
        while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
            offset++;
        }
    }

    /**
     * Returns the distance from the current offset to the nearest occurrence of any of the given characters,
     * or -1 when none of them occurs.
     */
    int distanceToAny(String delimiters) {
        for (int i = offset; i < text.length(); i++) {
            if (delimiters.indexOf(text.charAt(i)) >= 0) {
                return i - offset;
            }
        }
        return -1;
    }

    String take(int length) {
        String taken = text.substring(offset, offset + length);
        offset += length;
        return taken;
    }
}
