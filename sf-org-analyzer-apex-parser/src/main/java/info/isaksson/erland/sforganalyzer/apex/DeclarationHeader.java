package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.model.AnnotationParameter;
import info.isaksson.erland.sforganalyzer.model.ApexAnnotation;
import info.isaksson.erland.sforganalyzer.model.SharingMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Everything that may precede a declaration: documentation comment, annotations, modifiers and a sharing
 * keyword. Annotations attach to the declaration that follows them.
 */
final class DeclarationHeader {

    static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "global", "static", "final", "abstract", "virtual", "override",
            "transient", "testmethod", "webservice");

    String docComment;
    final List<ApexAnnotation> annotations = new ArrayList<>();
    final List<String> modifiers = new ArrayList<>();
    SharingMode sharing = SharingMode.NONE;

    static DeclarationHeader read(TokenCursor c) {
        DeclarationHeader h = new DeclarationHeader();
        while (!c.atEnd()) {
            Token t = c.peek();
            if (t.kind == TokenKind.DOC_COMMENT) {
                h.docComment = t.text;
                c.next();
            } else if (t.isSymbol('@') && c.peek(1).isIdentifier()) {
                c.next();
                h.annotations.add(readAnnotation(c));
            } else if (t.isIdentifier() && MODIFIERS.contains(t.lower())) {
                h.modifiers.add(t.lower());
                c.next();
            } else if ((t.is("with") || t.is("without") || t.is("inherited")) && c.peek(1).is("sharing")) {
                h.sharing = SharingMode.fromPrefix(t.text);
                c.next();
                c.next();
            } else {
                break;
            }
        }
        return h;
    }

    boolean hasModifier(String m) {
        return modifiers.contains(m.toLowerCase(Locale.ROOT));
    }

    boolean hasAnnotation(String name) {
        return annotations.stream().anyMatch(a -> a.isNamed(name));
    }

    private static ApexAnnotation readAnnotation(TokenCursor c) {
        String name = c.expectIdentifier("annotation name").text;
        if (!c.peek().isSymbol('(')) return ApexAnnotation.marker(name);
        int open = c.pos;
        int close = c.matchingClose();
        List<AnnotationParameter> params = readParameters(c.tokens, open + 1, close);
        c.pos = close + 1;
        return new ApexAnnotation(name, params);
    }

    /**
     * Parameters are {@code key=value} pairs separated by commas or whitespace, or a single positional value.
     * Values may contain nested parentheses.
     */
    static List<AnnotationParameter> readParameters(List<Token> tokens, int from, int to) {
        List<AnnotationParameter> out = new ArrayList<>();
        for (int[] seg : BalancedScanner.splitTopLevel(tokens, from, to, ',', false)) {
            int s = seg[0];
            int e = seg[1];
            if (!isPairStart(tokens, s, e)) {
                out.add(new AnnotationParameter("value", valueText(tokens, s, e)));
                continue;
            }
            int k = s;
            while (k < e) {
                String key = tokens.get(k).text;
                int v = k + 2;
                int next = v;
                int depth = 0;
                while (next < e) {
                    Token t = tokens.get(next);
                    if (t.isSymbol('(')) depth++;
                    else if (t.isSymbol(')')) depth--;
                    else if (depth == 0 && next > v && isPairStart(tokens, next, e)) break;
                    next++;
                }
                out.add(new AnnotationParameter(key, valueText(tokens, v, next)));
                k = next;
            }
        }
        return out;
    }

    private static boolean isPairStart(List<Token> tokens, int i, int end) {
        return i + 1 < end && tokens.get(i).isIdentifier() && tokens.get(i + 1).isSymbol('=');
    }

    private static String valueText(List<Token> tokens, int from, int to) {
        if (to - from == 1 && tokens.get(from).kind == TokenKind.STRING) return tokens.get(from).text;
        return BalancedScanner.text(tokens, from, to);
    }
}
