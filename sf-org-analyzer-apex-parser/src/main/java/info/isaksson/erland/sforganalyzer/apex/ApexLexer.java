package info.isaksson.erland.sforganalyzer.apex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single-pass tokenizer for Apex source.
 *
 * <p>Ordinary comments are dropped. Documentation comments ({@code /**}) become {@link TokenKind#DOC_COMMENT}
 * tokens so the parser can attach them to the next declaration. A {@code [} followed by {@code SELECT} is read
 * as one {@link TokenKind#SOQL} token up to its balancing {@code ]}.</p>
 */
final class ApexLexer {

    private final String src;
    private int pos;
    private int line = 1;

    private ApexLexer(String src) {
        this.src = src == null ? "" : src;
    }

    static List<Token> tokenize(String source) {
        return new ApexLexer(source).run();
    }

    private List<Token> run() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) break;
            char c = src.charAt(pos);
            int startLine = line;
            int startColumn = columnAt(pos);

            if (c == '/' && peek(1) == '/') {
                while (pos < src.length() && src.charAt(pos) != '\n') pos++;
                continue;
            }
            if (c == '/' && peek(1) == '*') {
                boolean doc = peek(2) == '*' && peek(3) != '/';
                String body = readBlockComment();
                if (doc) out.add(new Token(TokenKind.DOC_COMMENT, cleanDoc(body), startLine, startColumn));
                continue;
            }
            if (c == '\'') {
                out.add(new Token(TokenKind.STRING, readString(), startLine, startColumn));
                continue;
            }
            if (c == '[' && startsSoql()) {
                out.add(new Token(TokenKind.SOQL, readSoql(), startLine, startColumn));
                continue;
            }
            if (Character.isJavaIdentifierStart(c)) {
                int s = pos;
                while (pos < src.length() && Character.isJavaIdentifierPart(src.charAt(pos))) pos++;
                out.add(new Token(TokenKind.IDENTIFIER, src.substring(s, pos), startLine, startColumn));
                continue;
            }
            if (Character.isDigit(c)) {
                int s = pos;
                while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '.')) pos++;
                out.add(new Token(TokenKind.NUMBER, src.substring(s, pos), startLine, startColumn));
                continue;
            }
            pos++;
            out.add(new Token(TokenKind.SYMBOL, String.valueOf(c), startLine, startColumn));
        }
        out.add(new Token(TokenKind.EOF, "", line, columnAt(pos)));
        return out;
    }

    private void skipWhitespace() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') line++;
            else if (!Character.isWhitespace(c)) return;
            pos++;
        }
    }

    private int columnAt(int offset) {
        return offset - (src.lastIndexOf('\n', offset - 1) + 1) + 1;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private String readBlockComment() {
        int startLine = line;
        int s = pos + 2;
        int end = src.indexOf("*/", s);
        if (end < 0) throw new ApexSyntaxException("Unterminated comment", startLine);
        String body = src.substring(s, end);
        line += count(body, '\n');
        pos = end + 2;
        return body;
    }

    private String readString() {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\\' && pos + 1 < src.length()) {
                sb.append(src.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '\'') {
                pos++;
                return sb.toString();
            }
            if (c == '\n') throw new ApexSyntaxException("Unterminated string literal", startLine);
            sb.append(c);
            pos++;
        }
        throw new ApexSyntaxException("Unterminated string literal", startLine);
    }

    private boolean startsSoql() {
        int i = pos + 1;
        while (i < src.length() && Character.isWhitespace(src.charAt(i))) i++;
        if (i + 6 > src.length()) return false;
        String word = src.substring(i, i + 6).toUpperCase(Locale.ROOT);
        return word.equals("SELECT") && (i + 6 == src.length() || !Character.isJavaIdentifierPart(src.charAt(i + 6)));
    }

    private String readSoql() {
        int startLine = line;
        int depth = 0;
        boolean quoted = false;
        int s = pos + 1;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') line++;
            if (quoted) {
                if (c == '\\') pos++;
                else if (c == '\'') quoted = false;
            } else if (c == '\'') {
                quoted = true;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    String text = src.substring(s, pos);
                    pos++;
                    return text.trim().replaceAll("\\s+", " ");
                }
            }
            pos++;
        }
        throw new ApexSyntaxException("Unterminated SOQL query", startLine);
    }

    private static String cleanDoc(String body) {
        String b = body.startsWith("*") ? body.substring(1) : body;
        StringBuilder sb = new StringBuilder();
        for (String raw : b.split("\\r?\\n")) {
            String l = raw.strip();
            if (l.startsWith("*")) l = l.substring(1).strip();
            if (sb.length() > 0 && !l.isEmpty()) sb.append('\n');
            sb.append(l);
        }
        return sb.toString().strip();
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == c) n++;
        return n;
    }
}
