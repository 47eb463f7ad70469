package com.sqltag.core;

/**
 * Removes SQL block comment delimiters from comment content so it cannot close the wrapping comment
 * early or open a nested one. Openers ({@code /*}, optionally followed by an optimizer-hint {@code +}
 * and whitespace) and closers ({@code *&#47;}, optionally preceded by whitespace) are deleted.
 * <p>
 * Content is scanned once, left to right, into a buffer that never holds a delimiter: whenever the
 * last two buffered characters form one, they are dropped at once, so sequences joined by an earlier
 * deletion ({@code /*&#47;**&#47;*&#47;}) are caught as they appear.
 */
public final class SqlCommentEscaper {

    private SqlCommentEscaper() {
    }

    /**
     * @param content raw comment content
     * @return content containing neither {@code /*} nor {@code *&#47;}; empty for null input
     */
    public static String escape(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(content.length());
        boolean skipHint = false;
        boolean skipSpace = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (skipHint) {
                skipHint = false;
                if (c == '+') {
                    continue;
                }
            }
            if (skipSpace) {
                if (Character.isWhitespace(c)) {
                    continue;
                }
                skipSpace = false;
            }
            out.append(c);
            int len = out.length();
            if (len < 2) {
                continue;
            }
            char prev = out.charAt(len - 2);
            if (prev == '/' && c == '*') {
                out.setLength(len - 2);
                skipHint = true;
                skipSpace = true;
            } else if (prev == '*' && c == '/') {
                out.setLength(len - 2);
                trimTrailingWhitespace(out);
            }
        }
        return out.toString();
    }

    private static void trimTrailingWhitespace(StringBuilder out) {
        int len = out.length();
        while (len > 0 && Character.isWhitespace(out.charAt(len - 1))) {
            len--;
        }
        out.setLength(len);
    }
}
