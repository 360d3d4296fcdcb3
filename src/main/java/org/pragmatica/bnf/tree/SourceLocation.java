package org.pragmatica.bnf.tree;

/**
 * A position in source text: line and column are 1-based, offset is the 0-based UTF-16 index.
 * Columns count code points, not chars.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    /**
     * Location reached after consuming one code point at this location.
     */
    public SourceLocation advance(int codePoint) {
        if (codePoint == '\n') {
            return new SourceLocation(line + 1, 1, offset + 1);
        }
        return new SourceLocation(line, column + 1, offset + Character.charCount(codePoint));
    }

    /**
     * Location reached after consuming {@code text[offset, end)}, where {@code text} is the whole source.
     */
    public SourceLocation advanceTo(CharSequence text, int end) {
        return advance(text, offset, end);
    }

    /**
     * Location reached after consuming {@code text[from, to)}.
     */
    public SourceLocation advance(CharSequence text, int from, int to) {
        var location = this;
        var index = from;
        while (index < to) {
            int cp = Character.codePointAt(text, index);
            location = location.advance(cp);
            index += Character.charCount(cp);
        }
        return location;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
