package info.isaksson.erland.sforganalyzer.apex;

import java.util.ArrayList;
import java.util.List;

/**
 * Balanced-delimiter scanning shared by annotation parameters, parameter lists, call argument lists and
 * generic type arguments.
 */
final class BalancedScanner {

    private BalancedScanner() {}

    /**
     * Index of the token closing the delimiter at {@code openIndex}. Nested delimiters of the same family are
     * skipped. Reaching the end of input is a syntax error reported at the opener's line.
     */
    static int matchingClose(List<Token> tokens, int openIndex) {
        Token open = tokens.get(openIndex);
        char o = open.text.charAt(0);
        char c = closerOf(o);
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind == TokenKind.EOF) break;
            if (t.isSymbol(o)) depth++;
            else if (t.isSymbol(c)) {
                depth--;
                if (depth == 0) return i;
            }
        }
        throw new ApexSyntaxException("Unbalanced '" + o + "': missing '" + c + "'", open.line);
    }

    /**
     * Split {@code [from, to)} at top-level occurrences of {@code separator}. Parentheses, braces and brackets
     * always nest; angle brackets nest only when {@code angleBrackets} is true (type lists), since in
     * expressions they are comparison operators. Empty segments are dropped.
     *
     * @return half-open index ranges {@code {start, end}}
     */
    static List<int[]> splitTopLevel(List<Token> tokens, int from, int to, char separator, boolean angleBrackets) {
        List<int[]> out = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.kind != TokenKind.SYMBOL) continue;
            char ch = t.text.charAt(0);
            if (ch == '(' || ch == '{' || ch == '[' || (angleBrackets && ch == '<')) depth++;
            else if (ch == ')' || ch == '}' || ch == ']' || (angleBrackets && ch == '>')) depth--;
            else if (ch == separator && depth == 0) {
                if (i > start) out.add(new int[] {start, i});
                start = i + 1;
            }
        }
        if (to > start) out.add(new int[] {start, to});
        return out;
    }

    /** Source-like text for {@code [from, to)}; identifiers are separated by single spaces. */
    static String text(List<Token> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.kind == TokenKind.DOC_COMMENT || t.kind == TokenKind.EOF) continue;
            if (prev != null && needsSpace(prev, t)) sb.append(' ');
            switch (t.kind) {
                case STRING -> sb.append('\'').append(t.text).append('\'');
                case SOQL -> sb.append('[').append(t.text).append(']');
                default -> sb.append(t.text);
            }
            prev = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(Token prev, Token next) {
        boolean prevWord = prev.kind != TokenKind.SYMBOL;
        boolean nextWord = next.kind != TokenKind.SYMBOL;
        if (prevWord && nextWord) return true;
        if (prev.isSymbol(',')) return true;
        return prev.isSymbol('=') || next.isSymbol('=');
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '{' -> '}';
            case '[' -> ']';
            case '<' -> '>';
            default -> throw new IllegalArgumentException("Not an opening delimiter: " + open);
        };
    }
}
