package info.isaksson.erland.sforganalyzer.apex;

import java.util.List;

/** Recognizes type references: {@code Name(.Name)*(<args>)?([])*}. */
final class TypeSyntax {

    private TypeSyntax() {}

    /**
     * @return index just past the type starting at {@code start}, or -1 when no type starts there.
     *         Never throws; a {@code <} without a closing {@code >} is simply not a type.
     */
    static int typeEnd(List<Token> tokens, int start, int end) {
        if (start >= end || !tokens.get(start).isIdentifier()) return -1;
        if (ApexBuiltins.isKeyword(tokens.get(start).text)) return -1;
        int i = start + 1;
        while (i + 1 < end && tokens.get(i).isSymbol('.') && tokens.get(i + 1).isIdentifier()) i += 2;
        if (i < end && tokens.get(i).isSymbol('<')) {
            int close = genericClose(tokens, i, end);
            if (close < 0) return -1;
            i = close + 1;
        }
        while (i + 1 < end && tokens.get(i).isSymbol('[') && tokens.get(i + 1).isSymbol(']')) i += 2;
        return i;
    }

    private static int genericClose(List<Token> tokens, int open, int end) {
        int depth = 0;
        for (int i = open; i < end; i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('<')) depth++;
            else if (t.isSymbol('>')) {
                depth--;
                if (depth == 0) return i;
            } else if (t.kind == TokenKind.IDENTIFIER || t.isSymbol(',') || t.isSymbol('.')
                    || t.isSymbol('[') || t.isSymbol(']')) {
                continue;
            } else {
                return -1;
            }
        }
        return -1;
    }

    /** Compact type text: {@code Map<Id,List<Account>>}. */
    static String text(List<Token> tokens, int start, int end) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            Token t = tokens.get(i);
            sb.append(t.text);
            if (t.isSymbol(',')) sb.append(' ');
        }
        return sb.toString();
    }
}
