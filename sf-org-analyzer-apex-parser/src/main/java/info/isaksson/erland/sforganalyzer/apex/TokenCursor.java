package info.isaksson.erland.sforganalyzer.apex;

import java.util.List;

/** Forward cursor over a token list, bounded by an exclusive end index. */
final class TokenCursor {
    final List<Token> tokens;
    int pos;
    final int end;

    TokenCursor(List<Token> tokens, int pos, int end) {
        this.tokens = tokens;
        this.pos = pos;
        this.end = end;
    }

    boolean atEnd() {
        return pos >= end || tokens.get(pos).kind == TokenKind.EOF;
    }

    Token peek() {
        return peek(0);
    }

    Token peek(int ahead) {
        int i = pos + ahead;
        if (i >= end || i >= tokens.size()) return tokens.get(Math.min(end, tokens.size() - 1));
        return tokens.get(i);
    }

    Token next() {
        Token t = peek();
        if (!atEnd()) pos++;
        return t;
    }

    boolean accept(String word) {
        if (peek().is(word)) {
            pos++;
            return true;
        }
        return false;
    }

    boolean acceptSymbol(char c) {
        if (peek().isSymbol(c)) {
            pos++;
            return true;
        }
        return false;
    }

    Token expectIdentifier(String what) {
        Token t = peek();
        if (!t.isIdentifier()) throw new ApexSyntaxException("Expected " + what + " but found '" + t.text + "'", t.line);
        pos++;
        return t;
    }

    void expectSymbol(char c) {
        Token t = peek();
        if (!t.isSymbol(c)) throw new ApexSyntaxException("Expected '" + c + "' but found '" + t.text + "'", t.line);
        pos++;
    }

    /** Index of the balancing delimiter for the opener at the cursor; the cursor does not move. */
    int matchingClose() {
        return BalancedScanner.matchingClose(tokens, pos);
    }

    int line() {
        return peek().line;
    }
}
