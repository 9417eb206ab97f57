package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.model.CallSite;
import info.isaksson.erland.sforganalyzer.model.CollectionTypes;
import info.isaksson.erland.sforganalyzer.model.DmlKind;
import info.isaksson.erland.sforganalyzer.model.DmlOperation;
import info.isaksson.erland.sforganalyzer.model.SoqlQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Statement-level scan of a body. No expression tree is built; the scanner recognizes
 * <ul>
 *   <li>local declarations, to learn variable types,</li>
 *   <li>keyword-led DML and {@code Database.<verb>(...)} calls,</li>
 *   <li>inline {@code [SELECT ...]} queries and string literals that start with {@code SELECT},</li>
 *   <li>call sites: an identifier followed by an argument list, excluding keywords and platform APIs.</li>
 * </ul>
 *
 * <p>Bulk detection follows the declared type of the operand and, when no declaration is visible, the
 * collection-suffix naming heuristic of {@link CollectionTypes#hasCollectionName}.</p>
 */
final class MethodBodyScanner {

    private final List<Token> tokens;
    private final ApexParserOptions options;
    private final String enclosingClass;
    private final String superclass;
    private final String triggerObject;

    /**
     * @param enclosingClass qualified name of the class owning the body, or {@code null} for trigger bodies
     * @param triggerObject  object of the enclosing trigger, used for {@code Trigger.new} operands
     */
    MethodBodyScanner(List<Token> tokens, ApexParserOptions options, String enclosingClass, String superclass,
                      String triggerObject) {
        this.tokens = tokens;
        this.options = options;
        this.enclosingClass = enclosingClass;
        this.superclass = superclass;
        this.triggerObject = triggerObject;
    }

    /** Scan tokens {@code [from, to)}, normally the inside of a body's braces. */
    BodyFacts scan(int from, int to, TypeScope scope) {
        BodyFacts facts = new BodyFacts();
        TypeScope locals = scope.child();

        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            switch (t.kind) {
                case SOQL -> {
                    if (options.trackSoql) {
                        facts.soql.add(new SoqlQuery(t.text, SoqlObjects.referencedObjects(t.text), false,
                                t.line, t.column));
                    }
                }
                case STRING -> {
                    if (options.trackSoql && looksLikeQuery(t.text)) {
                        String q = t.text.trim().replaceAll("\\s+", " ");
                        facts.soql.add(new SoqlQuery(q, SoqlObjects.referencedObjects(q), true, t.line, t.column));
                    }
                }
                case IDENTIFIER -> scanIdentifier(i, from, to, locals, facts);
                default -> {
                }
            }
        }
        return facts;
    }

    private void scanIdentifier(int i, int from, int to, TypeScope locals, BodyFacts facts) {
        Token t = tokens.get(i);

        recordDeclaration(i, to, locals);

        DmlKind dml = DmlKind.fromKeyword(t.text);
        if (dml != null && isStatementStart(i, from) && isOperandStart(i + 1, to)) {
            if (options.trackDml) {
                int semi = statementEnd(i + 1, to);
                facts.dml.add(inferDml(dml, i + 1, semi, locals, t, false));
            }
            return;
        }

        if (i + 1 >= to || !tokens.get(i + 1).isSymbol('(')) return;

        List<String> chain = qualifierChain(i, from);
        if (chain.size() == 1 && chain.get(0).equalsIgnoreCase("Database")) {
            DmlKind verb = DmlKind.fromKeyword(t.text);
            if (verb != null && options.trackDml) {
                int close = safeClose(i + 1, to);
                List<int[]> args = BalancedScanner.splitTopLevel(tokens, i + 2, close, ',', false);
                if (!args.isEmpty()) {
                    facts.dml.add(inferDml(verb, args.get(0)[0], args.get(0)[1], locals, tokens.get(i - 2), true));
                }
            }
            return;
        }

        CallSite call = callSite(i, from, chain, locals);
        if (call != null) facts.calls.add(call);
    }

    // ---- declarations ----

    private void recordDeclaration(int i, int to, TypeScope locals) {
        int typeEnd = TypeSyntax.typeEnd(tokens, i, to);
        if (typeEnd < 0 || typeEnd + 1 >= to) return;
        if (i > 0 && tokens.get(i - 1).isSymbol('.')) return;
        Token name = tokens.get(typeEnd);
        Token after = tokens.get(typeEnd + 1);
        if (!name.isIdentifier() || ApexBuiltins.isKeyword(name.text)) return;
        if (after.isSymbol('=') || after.isSymbol(';') || after.isSymbol(':') || after.isSymbol(',') || after.isSymbol(')')) {
            locals.declare(name.text, TypeSyntax.text(tokens, i, typeEnd));
        }
    }

    // ---- DML ----

    private boolean isStatementStart(int i, int from) {
        if (i == from) return true;
        Token prev = tokens.get(i - 1);
        return prev.isSymbol(';') || prev.isSymbol('{') || prev.isSymbol('}') || prev.isSymbol(')')
                || prev.is("else") || prev.is("do");
    }

    private boolean isOperandStart(int i, int to) {
        if (i >= to) return false;
        Token t = tokens.get(i);
        return t.isIdentifier() || t.kind == TokenKind.SOQL || t.isSymbol('(');
    }

    private int statementEnd(int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('(') || t.isSymbol('{') || t.isSymbol('[')) depth++;
            else if (t.isSymbol(')') || t.isSymbol('}') || t.isSymbol(']')) depth--;
            else if (t.isSymbol(';') && depth == 0) return i;
        }
        return to;
    }

    /** @param at the DML keyword, or {@code Database} for {@code Database.<verb>(...)} */
    private DmlOperation inferDml(DmlKind kind, int from, int to, TypeScope scope, Token at, boolean viaDatabase) {
        int line = at.line;
        int column = at.column;
        String operand = BalancedScanner.text(tokens, from, to);
        int i = from;
        while (i < to && tokens.get(i).isSymbol('(')) i++;
        if (i >= to) return new DmlOperation(kind, null, operand, false, viaDatabase, line, column);

        Token first = tokens.get(i);
        if (first.kind == TokenKind.SOQL) {
            List<String> objs = SoqlObjects.referencedObjects(first.text);
            return new DmlOperation(kind, objs.isEmpty() ? null : objs.get(0), operand, true, viaDatabase, line, column);
        }
        if (first.is("new")) {
            int typeEnd = TypeSyntax.typeEnd(tokens, i + 1, to);
            if (typeEnd > 0) {
                String type = TypeSyntax.text(tokens, i + 1, typeEnd);
                boolean bulk = CollectionTypes.isCollection(type);
                String object = CollectionTypes.rawName(bulk ? CollectionTypes.elementType(type) : type);
                return new DmlOperation(kind, object, operand, bulk, viaDatabase, line, column);
            }
            return new DmlOperation(kind, null, operand, false, viaDatabase, line, column);
        }
        if (!first.isIdentifier()) return new DmlOperation(kind, null, operand, false, viaDatabase, line, column);

        int j = i;
        if (first.is("this") && j + 2 < to && tokens.get(j + 1).isSymbol('.')) j += 2;
        Token var = tokens.get(j);
        boolean indexed = j + 1 < to && tokens.get(j + 1).isSymbol('[');

        if (var.is("Trigger")) {
            return new DmlOperation(kind, triggerObject, operand, true, viaDatabase, line, column);
        }

        String type = scope.typeOf(var.text);
        if (type == null) {
            boolean bulk = !indexed && (CollectionTypes.hasCollectionName(var.text)
                    || operand.contains("[]") || operand.contains("<"));
            return new DmlOperation(kind, null, operand, bulk, viaDatabase, line, column);
        }
        boolean collection = CollectionTypes.isCollection(type);
        boolean mapValues = operand.toLowerCase(Locale.ROOT).endsWith(".values()");
        boolean bulk = collection && !indexed || mapValues;
        String object = CollectionTypes.rawName(collection ? CollectionTypes.elementType(type) : type);
        return new DmlOperation(kind, object, operand, bulk, viaDatabase, line, column);
    }

    // ---- SOQL ----

    private static boolean looksLikeQuery(String literal) {
        String s = literal.stripLeading();
        return s.length() > 7 && s.substring(0, 7).equalsIgnoreCase("SELECT ");
    }

    // ---- calls ----

    /**
     * Dotted names before the identifier at {@code i}: {@code a.b.run(} gives {@code [a, b]}. An expression
     * qualifier such as {@code foo().run(} or {@code new X().run(} gives a single element starting with "(".
     */
    private List<String> qualifierChain(int i, int from) {
        List<String> chain = new ArrayList<>();
        int j = i - 1;
        while (j > from && tokens.get(j).isSymbol('.')) {
            int k = j - 1;
            if (k >= from && tokens.get(k).isSymbol('?')) k--;
            if (k < from) break;
            Token q = tokens.get(k);
            if (q.isIdentifier()) {
                chain.add(0, q.text);
                j = k - 1;
                continue;
            }
            if (q.isSymbol(')')) {
                int open = matchingOpenBackward(k, from);
                String newType = open > from + 1 && tokens.get(open - 1).isIdentifier() && tokens.get(open - 2).is("new")
                        ? tokens.get(open - 1).text : null;
                chain.add(0, newType != null ? "(new " + newType + ")" : "(expr)");
            } else {
                chain.add(0, "(expr)");
            }
            break;
        }
        return chain;
    }

    private CallSite callSite(int i, int from, List<String> chain, TypeScope scope) {
        Token t = tokens.get(i);
        if (ApexBuiltins.isKeyword(t.text)) return null;
        if (i > from && tokens.get(i - 1).is("new")) return null;
        if (i - 1 >= from && chain.isEmpty() && tokens.get(i - 1).isIdentifier()
                && !ApexBuiltins.isKeyword(tokens.get(i - 1).text)) {
            // "Type name(" is a declaration, not a call.
            return null;
        }

        String qualifier = String.join(".", chain);
        if (chain.isEmpty()) {
            return new CallSite(t.text, "", enclosingClass, t.line, t.column);
        }

        String head = chain.get(0);
        if (head.startsWith("(new ")) {
            String type = head.substring(5, head.length() - 1);
            if (ApexBuiltins.isPlatformType(type)) return null;
            return new CallSite(t.text, qualifier, type, t.line, t.column);
        }
        if (head.startsWith("(")) {
            return new CallSite(t.text, qualifier, null, t.line, t.column);
        }
        if (head.equalsIgnoreCase("this")) {
            if (chain.size() == 1) return new CallSite(t.text, qualifier, enclosingClass, t.line, t.column);
            return resolveVariable(t, qualifier, chain.get(1), chain.size() == 2, scope);
        }
        if (head.equalsIgnoreCase("super")) {
            return new CallSite(t.text, qualifier, superclass, t.line, t.column);
        }
        if (scope.typeOf(head) != null) {
            return resolveVariable(t, qualifier, head, chain.size() == 1, scope);
        }
        if (ApexBuiltins.isPlatformType(head)) return null;
        return new CallSite(t.text, qualifier, qualifier, t.line, t.column);
    }

    private CallSite resolveVariable(Token callee, String qualifier, String variable, boolean direct, TypeScope scope) {
        String type = scope.typeOf(variable);
        if (type == null) return new CallSite(callee.text, qualifier, null, callee.line, callee.column);
        if (ApexBuiltins.isPlatformType(type)) return null;
        return new CallSite(callee.text, qualifier, direct ? CollectionTypes.rawName(type) : null, callee.line, callee.column);
    }

    private int matchingOpenBackward(int closeIndex, int from) {
        int depth = 0;
        for (int k = closeIndex; k >= from; k--) {
            Token t = tokens.get(k);
            if (t.isSymbol(')')) depth++;
            else if (t.isSymbol('(')) {
                depth--;
                if (depth == 0) return k;
            }
        }
        return from;
    }

    private int safeClose(int open, int to) {
        int depth = 0;
        for (int k = open; k < to; k++) {
            Token t = tokens.get(k);
            if (t.isSymbol('(')) depth++;
            else if (t.isSymbol(')')) {
                depth--;
                if (depth == 0) return k;
            }
        }
        return to;
    }
}
