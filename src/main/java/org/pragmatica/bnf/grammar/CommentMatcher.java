package org.pragmatica.bnf.grammar;

import java.util.Optional;

/**
 * Bounds <code>/* ... *&#47;</code> comments and <code>/** ... *&#47;</code> docstrings.
 *
 * <p>The body is consumed one non-{@code *} character at a time, or as a run of {@code *} that is not followed
 * by {@code /}. The first {@code *} run followed by {@code /} closes the comment; all but its last star belong
 * to the body. A comment never extends into the next one.
 */
public final class CommentMatcher {
    private CommentMatcher() {}

    /**
     * A matched comment.
     *
     * @param start offset of the opening {@code /}
     * @param end   offset just past the closing {@code /}
     * @param body  raw text between the opener and the closing star
     * @param doc   whether the comment is a docstring (<code>/**</code> but not <code>/**&#47;</code>)
     */
    public record Comment(int start, int end, String body, boolean doc) {
        /**
         * Docstring text with leading stars and surrounding blanks removed from every line.
         */
        public String docText() {
            var sb = new StringBuilder();
            for (var line : body.split("\n", -1)) {
                var trimmed = line.strip();
                while (trimmed.startsWith("*")) {
                    trimmed = trimmed.substring(1);
                }
                trimmed = trimmed.strip();
                if (!sb.isEmpty() || !trimmed.isEmpty()) {
                    sb.append(trimmed)
                      .append('\n');
                }
            }
            return sb.toString()
                     .strip();
        }
    }

    /**
     * Whether a comment opener {@code /*} starts at {@code start}.
     */
    public static boolean startsAt(CharSequence input, int start) {
        return start + 1 < input.length() && input.charAt(start) == '/' && input.charAt(start + 1) == '*';
    }

    /**
     * Match a comment starting at {@code start}. Empty if there is no opener or the comment is unterminated.
     */
    public static Optional<Comment> match(CharSequence input, int start) {
        if (!startsAt(input, start)) {
            return Optional.empty();
        }
        int length = input.length();
        int opener = start + 2;
        boolean doc = opener + 1 < length && input.charAt(opener) == '*' && input.charAt(opener + 1) != '/';
        int bodyStart = doc
                        ? opener + 1
                        : opener;
        int pos = bodyStart;
        while (pos < length) {
            if (input.charAt(pos) != '*') {
                pos++;
                continue;
            }
            int runEnd = pos;
            while (runEnd < length && input.charAt(runEnd) == '*') {
                runEnd++;
            }
            if (runEnd < length && input.charAt(runEnd) == '/') {
                var body = input.subSequence(bodyStart, runEnd - 1)
                                .toString();
                return Optional.of(new Comment(start, runEnd + 1, body, doc));
            }
            pos = runEnd;
        }
        return Optional.empty();
    }
}
