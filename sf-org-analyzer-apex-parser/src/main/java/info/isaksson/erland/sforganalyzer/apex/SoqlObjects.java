package info.isaksson.erland.sforganalyzer.apex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts referenced object names from SOQL text: the outermost FROM object first, then the relationship
 * names of sub-queries in textual order.
 */
public final class SoqlObjects {
    private static final Pattern FROM = Pattern.compile("\\bFROM\\s+([A-Za-z_][\\w.]*)", Pattern.CASE_INSENSITIVE);

    private SoqlObjects() {}

    public static List<String> referencedObjects(String query) {
        if (query == null || query.isBlank()) return List.of();
        String q = blankQuoted(query);
        String main = null;
        List<String> related = new ArrayList<>();
        Matcher m = FROM.matcher(q);
        while (m.find()) {
            String obj = m.group(1);
            if (depthAt(q, m.start()) == 0) {
                if (main == null) main = obj;
            } else if (!related.contains(obj)) {
                related.add(obj);
            }
        }
        List<String> out = new ArrayList<>();
        if (main != null) out.add(main);
        for (String r : related) if (!r.equalsIgnoreCase(main)) out.add(r);
        return List.copyOf(out);
    }

    private static int depthAt(String s, int index) {
        int depth = 0;
        for (int i = 0; i < index; i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
        }
        return depth;
    }

    /** Replace quoted literal content with spaces so keywords inside strings are ignored. */
    private static String blankQuoted(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quoted && c == '\\' && i + 1 < s.length()) {
                sb.append("  ");
                i++;
                continue;
            }
            if (c == '\'') {
                quoted = !quoted;
                sb.append(c);
                continue;
            }
            sb.append(quoted ? ' ' : c);
        }
        return sb.toString();
    }
}
