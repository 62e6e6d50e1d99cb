package com.hcltech.textres.resources.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parser for {@code key=value} resource text.
 * - Lines split on LF or CRLF; a leading BOM is dropped.
 * - Blank lines, lines starting with {@code ;}, {@code #} or {@code '}, and lines without {@code =} are skipped.
 * - Key and value are split on the first {@code =} and trimmed.
 * - One matching pair of surrounding {@code "} or {@code '} is stripped from the value.
 * - The literal escape {@code \r\n} inside a value becomes {@code lineBreak}.
 */
public record PropertyTextParser(String lineBreak) {
    public static final String DEFAULT_LINE_BREAK = "\n";
    static final String LINE_BREAK_ESCAPE = "\\r\\n";

    private static final Pattern LINES = Pattern.compile("\r?\n");

    public PropertyTextParser {
        Objects.requireNonNull(lineBreak, "lineBreak");
    }

    public PropertyTextParser() {
        this(DEFAULT_LINE_BREAK);
    }

    public ResourceMapping parse(String text) {
        return parse(text, "<text>");
    }

    /**
     * @param source names the text in error messages, usually the file name
     * @throws DuplicateKeyException if a key occurs twice
     */
    public ResourceMapping parse(String text, String source) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");

        Map<String, String> out = new LinkedHashMap<>();
        String[] lines = LINES.split(stripBom(text), -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || isComment(line)) continue;

            int eq = line.indexOf('=');
            if (eq < 0) continue;

            String key = line.substring(0, eq).trim();
            String value = unescape(unquote(line.substring(eq + 1).trim()));
            if (out.putIfAbsent(key, value) != null) {
                throw new DuplicateKeyException(key, source, i + 1);
            }
        }
        return new ResourceMapping(out);
    }

    private static boolean isComment(String line) {
        char first = line.charAt(0);
        return first == ';' || first == '#' || first == '\'';
    }

    private static String unquote(String value) {
        if (value.length() < 2) return value;
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private String unescape(String value) {
        return value.contains(LINE_BREAK_ESCAPE) ? value.replace(LINE_BREAK_ESCAPE, lineBreak) : value;
    }

    private static String stripBom(String s) {
        return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }
}
