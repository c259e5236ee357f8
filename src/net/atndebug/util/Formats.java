package net.atndebug.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Formats {

    public static final Pattern WORD_LIST_ITEM = Pattern.compile(
        "\\s*(-?[0-9]+)\\s*(,|$)");

    private static final Pattern ESCAPE = Pattern.compile(
        "[^\\x20-\\x7e]|[\\\\']");

    // Prevent construction.
    private Formats() {}

    /**
     * Escape control characters the way token texts are displayed in
     * diagnostics: newline, carriage return and tab become their backslash
     * escapes while everything else is passed through.
     */
    public static String escapeWhitespace(String s) {
        if (s == null) return null;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(ch); break;
            }
        }
        return sb.toString();
    }

    public static String formatString(String s) {
        if (s == null) return "null";
        Matcher m = ESCAPE.matcher(s);
        StringBuffer sb = new StringBuffer("'");
        while (m.find()) {
            char ch = m.group().charAt(0);
            String repl;
            switch (ch) {
                case '\n': repl = "\\n"; break;
                case '\r': repl = "\\r"; break;
                case '\t': repl = "\\t"; break;
                case '\\': repl = "\\\\"; break;
                case '\'': repl = "\\'"; break;
                default:
                    repl = String.format((ch < 256) ? "\\x%02x" : "\\u%04x",
                                         (int) ch);
                    break;
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(repl));
        }
        m.appendTail(sb);
        return sb.append('\'').toString();
    }

    public static String formatCodePoint(int cp) {
        if (cp < 0) return "<EOF>";
        return formatString(new String(Character.toChars(cp)));
    }

    /**
     * Parse a comma-separated list of (possibly negative) decimal integers.
     * Returns null if the list is malformed.
     */
    public static List<Integer> parseIntList(String list) {
        List<Integer> ret = new ArrayList<Integer>();
        if (list.trim().isEmpty()) return ret;
        Matcher m = WORD_LIST_ITEM.matcher(list);
        int lastIndex = 0;
        while (lastIndex != list.length()) {
            if (! m.find() || m.start() != lastIndex) return null;
            try {
                ret.add(Integer.parseInt(m.group(1)));
            } catch (NumberFormatException exc) {
                return null;
            }
            lastIndex = m.end();
            if (m.group(2).isEmpty()) break;
        }
        if (lastIndex != list.length()) return null;
        return ret;
    }

}
