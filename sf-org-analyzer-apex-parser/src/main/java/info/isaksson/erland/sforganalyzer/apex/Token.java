package info.isaksson.erland.sforganalyzer.apex;

import java.util.Locale;

/** Package-private lexical token with its 1-based source line and column. */
final class Token {
    final TokenKind kind;
    final String text;
    final int line;
    final int column;

    Token(TokenKind kind, String text, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    /** Apex identifiers and keywords are case-insensitive. */
    boolean is(String word) {
        return kind == TokenKind.IDENTIFIER && text.equalsIgnoreCase(word);
    }

    boolean isSymbol(char c) {
        return kind == TokenKind.SYMBOL && text.length() == 1 && text.charAt(0) == c;
    }

    String lower() {
        return text.toLowerCase(Locale.ROOT);
    }

    @Override public String toString() {
        return kind + "(" + text + ")@" + line + ":" + column;
    }
}
