package com.playgrounds.apptool.syntax;

/**
 * Conversions between Swift string literal source text and the string it denotes.
 */
public final class StringLiterals {

    private StringLiterals() {
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Decodes a literal as it appears in source, including raw ({@code #"..."#}) and multi-line
     * forms. Interpolations are kept verbatim. Text that is not a well-formed literal is
     * returned with whatever quotes could be stripped.
     */
    public static String decode(String literal) {
        int hashes = 0;
        while (hashes < literal.length() && literal.charAt(hashes) == '#') {
            hashes++;
        }
        String delimiter = "#".repeat(hashes);
        String body = literal.substring(hashes);
        if (hashes > 0 && body.endsWith(delimiter)) {
            body = body.substring(0, body.length() - hashes);
        }
        boolean multiLine = body.startsWith("\"\"\"");
        String quotes = multiLine ? "\"\"\"" : "\"";
        if (body.startsWith(quotes)) {
            body = body.substring(quotes.length());
        }
        if (body.endsWith(quotes) && body.length() >= quotes.length()) {
            body = body.substring(0, body.length() - quotes.length());
        }
        if (multiLine) {
            body = stripMultiLine(body);
        }
        return unescape(body, "\\" + delimiter);
    }

    private static String stripMultiLine(String body) {
        int firstBreak = body.indexOf('\n');
        if (firstBreak < 0) {
            return body;
        }
        String content = body.substring(firstBreak + 1);
        int lastBreak = content.lastIndexOf('\n');
        String indentation = lastBreak < 0 ? content : content.substring(lastBreak + 1);
        if (!indentation.isBlank()) {
            return content;
        }
        content = lastBreak < 0 ? "" : content.substring(0, lastBreak);
        StringBuilder sb = new StringBuilder();
        for (String line : content.split("\n", -1)) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.startsWith(indentation) ? line.substring(indentation.length()) : line.stripLeading());
        }
        return sb.toString();
    }

    private static String unescape(String body, String escape) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            if (!body.startsWith(escape, i) || i + escape.length() >= body.length()) {
                sb.append(body.charAt(i++));
                continue;
            }
            int next = i + escape.length();
            char c = body.charAt(next);
            switch (c) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '0' -> sb.append('\0');
                case '"', '\'', '\\' -> sb.append(c);
                case 'u' -> {
                    int close = body.indexOf('}', next);
                    if (next + 1 < body.length() && body.charAt(next + 1) == '{' && close > 0) {
                        try {
                            sb.appendCodePoint(Integer.parseInt(body.substring(next + 2, close), 16));
                            i = close + 1;
                            continue;
                        } catch (IllegalArgumentException e) {
                            sb.append(body, i, next + 1);
                        }
                    } else {
                        sb.append(body, i, next + 1);
                    }
                }
                default -> sb.append(body, i, next + 1);
            }
            i = next + 1;
        }
        return sb.toString();
    }
}
