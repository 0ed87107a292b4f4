package org.alani.compiler.ast;

/**
 * Turns the source text of raw and quoted tokens into atom text.
 */
public final class TextUnescaper {
    /**
     * Characters that are escaped with a backslash in quoted text.
     */
    static final String RESERVED = "[](){}*+?|^$.-\\";

    private static final char RAW_DELIMITER = '`';

    private TextUnescaper() {}

    /**
     * Strip the backticks and unescape embedded ones: {@code `a\`b`} becomes {@code a`b}.
     */
    public static String unescapeRaw(String text) {
        requireDelimited(text);
        return text.substring(1, text.length() - 1)
                   .replace("\\" + RAW_DELIMITER, String.valueOf(RAW_DELIMITER));
    }

    /**
     * Escape reserved characters, strip the quotes and unescape the embedded quote:
     * {@code "a.b"} becomes {@code a\.b} and {@code "a\"b"} becomes {@code a"b}.
     */
    public static String unescapeLiteral(String text) {
        requireDelimited(text);
        var escaped = new StringBuilder(text.length() * 2);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (RESERVED.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        var quote = String.valueOf(text.charAt(0));
        // An escaped quote \" has become \\" by now
        return escaped.substring(1, escaped.length() - 1)
                      .replace("\\\\" + quote, quote);
    }

    private static void requireDelimited(String text) {
        if (text.length() < 2) {
            throw new IllegalArgumentException("Expected delimited text, got '" + text + "'");
        }
    }
}
