package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.model.ApexAnnotation;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexMethod;
import info.isaksson.erland.sforganalyzer.model.ApexParameter;
import info.isaksson.erland.sforganalyzer.model.ApexProperty;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import info.isaksson.erland.sforganalyzer.model.ApexTypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent recognizer for one Apex compilation unit ({@code .cls} or {@code .trigger}).
 *
 * <p>Parsing never throws. Malformed input becomes diagnostics:</p>
 * <ul>
 *   <li>a lexical error or a broken top-level declaration stops the file; declarations completed before it
 *       are kept,</li>
 *   <li>a broken member is skipped up to the next {@code ;} or balanced block and parsing continues.</li>
 * </ul>
 *
 * <p>Instances are stateless apart from their options and may be shared between threads.</p>
 */
public final class ApexParser {
    private static final Logger logger = LoggerFactory.getLogger(ApexParser.class);

    private final ApexParserOptions options;

    public ApexParser() {
        this(ApexParserOptions.defaults());
    }

    public ApexParser(ApexParserOptions options) {
        this.options = options == null ? ApexParserOptions.defaults() : options;
    }

    public ApexParseResult parse(String file, String source) {
        Diagnostics diagnostics = new Diagnostics();
        List<ApexClass> classes = new ArrayList<>();
        List<ApexTrigger> triggers = new ArrayList<>();

        List<Token> tokens;
        try {
            tokens = ApexLexer.tokenize(source);
        } catch (ApexSyntaxException e) {
            diagnostics.parseError(file, e.getLine(), e.getMessage());
            logger.warn("{}:{}: {}", file, e.getLine(), e.getMessage());
            return new ApexParseResult(file, classes, triggers, diagnostics.sorted());
        }

        FileContext ctx = new FileContext(file, tokens, diagnostics);
        TokenCursor c = new TokenCursor(tokens, 0, tokens.size());
        Set<String> topLevelNames = new HashSet<>();
        while (!c.atEnd()) {
            try {
                DeclarationHeader header = DeclarationHeader.read(c);
                if (c.atEnd()) break;
                Token t = c.peek();
                if (t.is("trigger")) {
                    triggers.add(new ApexTriggerParser(options).parse(c, header, file, diagnostics));
                } else if (isTypeKeyword(t)) {
                    ApexClass cls = parseType(ctx, c, header, null, null, TypeScope.root());
                    if (topLevelNames.add(cls.name.toLowerCase(Locale.ROOT))) {
                        classes.add(cls);
                    } else {
                        diagnostics.duplicate(file, cls.line, "Duplicate class '" + cls.name + "' in file");
                    }
                } else {
                    throw new ApexSyntaxException(
                            "Expected class, interface, enum or trigger declaration but found '" + t.text + "'", t.line);
                }
            } catch (ApexSyntaxException e) {
                diagnostics.parseError(file, e.getLine(), e.getMessage());
                logger.warn("{}:{}: {}", file, e.getLine(), e.getMessage());
                break;
            }
        }

        logger.debug("Parsed {}: {} classes, {} triggers, {} diagnostics",
                file, classes.size(), triggers.size(), diagnostics.size());
        return new ApexParseResult(file, classes, triggers, diagnostics.sorted());
    }

    // ---- types ----

    private ApexClass parseType(FileContext ctx, TokenCursor c, DeclarationHeader header, String outerQualified,
                                String outerSuperclass, TypeScope outerScope) {
        Token kw = c.next();
        ApexTypeKind kind = kw.is("interface") ? ApexTypeKind.INTERFACE
                : kw.is("enum") ? ApexTypeKind.ENUM : ApexTypeKind.CLASS;
        Token nameTok = c.expectIdentifier("type name");
        String name = nameTok.text;
        String qualified = outerQualified == null ? name : outerQualified + "." + name;

        String superclass = null;
        List<String> interfaces = new ArrayList<>();
        while (true) {
            if (c.accept("extends")) {
                List<String> types = typeList(c);
                if (kind == ApexTypeKind.INTERFACE) interfaces.addAll(types);
                else if (!types.isEmpty()) superclass = types.get(0);
            } else if (c.accept("implements")) {
                interfaces.addAll(typeList(c));
            } else {
                break;
            }
        }

        if (!c.peek().isSymbol('{')) {
            throw new ApexSyntaxException("Expected '{' after declaration of " + qualified + " but found '" + c.peek().text + "'",
                    c.line());
        }
        int open = c.pos;
        int close = c.matchingClose();
        c.pos = close + 1;

        TypeBody body = new TypeBody();
        TypeScope scope = outerScope.child();
        if (kind == ApexTypeKind.ENUM) {
            readEnumConstants(ctx, open + 1, close, name, body);
        } else {
            TokenCursor mc = new TokenCursor(ctx.tokens, open + 1, close);
            while (!mc.atEnd()) {
                int start = mc.pos;
                try {
                    parseMember(ctx, mc, name, qualified, superclass, scope, body, kind);
                } catch (ApexSyntaxException e) {
                    ctx.diagnostics.parseError(ctx.file, e.getLine(), e.getMessage());
                    logger.warn("{}:{}: {}", ctx.file, e.getLine(), e.getMessage());
                    recover(mc, start);
                }
            }
        }

        List<ApexMethod> methods = new ArrayList<>();
        for (PendingMethod pm : body.methods) {
            methods.add(pm.finish(ctx.tokens, options, qualified, superclass != null ? superclass : outerSuperclass, scope));
        }

        return new ApexClass(
                name,
                qualified,
                kind,
                header.modifiers,
                header.sharing,
                superclass,
                interfaces,
                options.parseAnnotations ? header.annotations : List.of(),
                body.properties,
                methods,
                body.innerClasses,
                options.parseDocComments ? header.docComment : null,
                ctx.file,
                nameTok.line
        );
    }

    private List<String> typeList(TokenCursor c) {
        List<String> out = new ArrayList<>();
        do {
            int end = TypeSyntax.typeEnd(c.tokens, c.pos, c.end);
            if (end < 0) throw new ApexSyntaxException("Expected type name but found '" + c.peek().text + "'", c.line());
            out.add(TypeSyntax.text(c.tokens, c.pos, end));
            c.pos = end;
        } while (c.acceptSymbol(','));
        return out;
    }

    private void readEnumConstants(FileContext ctx, int from, int to, String enumName, TypeBody body) {
        for (int[] seg : BalancedScanner.splitTopLevel(ctx.tokens, from, to, ',', false)) {
            for (int i = seg[0]; i < seg[1]; i++) {
                Token t = ctx.tokens.get(i);
                if (t.isIdentifier()) {
                    body.properties.add(new ApexProperty(t.text, enumName, List.of("public", "static", "final"),
                            List.of(), false, false, false, t.line));
                    break;
                }
            }
        }
    }

    // ---- members ----

    private void parseMember(FileContext ctx, TokenCursor mc, String simpleName, String qualified, String superclass,
                             TypeScope scope, TypeBody body, ApexTypeKind ownerKind) {
        DeclarationHeader h = DeclarationHeader.read(mc);
        if (mc.atEnd()) return;
        Token t = mc.peek();

        if (t.isSymbol(';')) {
            mc.next();
            return;
        }
        if (t.isSymbol('{')) {
            // Initializer block.
            mc.pos = mc.matchingClose() + 1;
            return;
        }
        if (isTypeKeyword(t)) {
            ApexClass inner = parseType(ctx, mc, h, qualified, superclass, scope);
            if (!options.includeInnerClasses) return;
            if (body.innerNames.add(inner.name.toLowerCase(Locale.ROOT))) {
                body.innerClasses.add(inner);
            } else {
                ctx.diagnostics.duplicate(ctx.file, inner.line,
                        "Duplicate inner class '" + inner.name + "' in " + qualified);
            }
            return;
        }

        int typeEnd = TypeSyntax.typeEnd(mc.tokens, mc.pos, mc.end);
        if (typeEnd < 0) {
            throw new ApexSyntaxException("Expected member declaration but found '" + t.text + "'", t.line);
        }
        String type = TypeSyntax.text(mc.tokens, mc.pos, typeEnd);
        Token nameTok;
        String returnType;
        boolean constructor = false;
        if (typeEnd < mc.end && mc.tokens.get(typeEnd).isSymbol('(') && type.equalsIgnoreCase(simpleName)) {
            nameTok = mc.tokens.get(mc.pos);
            returnType = "";
            constructor = true;
            mc.pos = typeEnd;
        } else {
            mc.pos = typeEnd;
            nameTok = mc.expectIdentifier("member name");
            returnType = type;
        }

        Token after = mc.peek();
        if (after.isSymbol('(')) {
            parseMethod(mc, h, nameTok, returnType, constructor, ownerKind, body);
        } else if (after.isSymbol('{')) {
            parseAccessorProperty(mc, h, nameTok, type, scope, body);
        } else if (after.isSymbol('=') || after.isSymbol(';') || after.isSymbol(',')) {
            parseFields(mc, h, nameTok, type, scope, body);
        } else {
            throw new ApexSyntaxException("Unexpected '" + after.text + "' after member '" + nameTok.text + "'", after.line);
        }
    }

    private void parseMethod(TokenCursor mc, DeclarationHeader h, Token nameTok, String returnType, boolean constructor,
                             ApexTypeKind ownerKind, TypeBody body) {
        int open = mc.pos;
        int close = mc.matchingClose();
        List<ApexParameter> params = parseParameters(mc.tokens, open + 1, close);
        mc.pos = close + 1;

        PendingMethod pm = new PendingMethod();
        pm.name = nameTok.text;
        pm.line = nameTok.line;
        pm.returnType = returnType;
        pm.constructor = constructor;
        pm.header = h;
        pm.parameters = params;

        if (mc.peek().isSymbol('{')) {
            int bodyOpen = mc.pos;
            int bodyClose = mc.matchingClose();
            pm.bodyFrom = bodyOpen + 1;
            pm.bodyTo = bodyClose;
            mc.pos = bodyClose + 1;
        } else if (mc.acceptSymbol(';')) {
            pm.abstractMethod = true;
        } else {
            throw new ApexSyntaxException("Expected method body for '" + nameTok.text + "' but found '" + mc.peek().text + "'",
                    mc.line());
        }
        if (ownerKind == ApexTypeKind.INTERFACE) pm.abstractMethod = true;
        body.methods.add(pm);
    }

    private List<ApexParameter> parseParameters(List<Token> tokens, int from, int to) {
        List<ApexParameter> out = new ArrayList<>();
        for (int[] seg : BalancedScanner.splitTopLevel(tokens, from, to, ',', true)) {
            int i = seg[0];
            while (i < seg[1] && (tokens.get(i).is("final") || tokens.get(i).isSymbol('@'))) {
                i += tokens.get(i).isSymbol('@') ? 2 : 1;
            }
            int typeEnd = TypeSyntax.typeEnd(tokens, i, seg[1]);
            if (typeEnd < 0 || typeEnd >= seg[1] || !tokens.get(typeEnd).isIdentifier()) {
                Token bad = tokens.get(Math.min(i, seg[1] - 1));
                throw new ApexSyntaxException("Malformed parameter '" + BalancedScanner.text(tokens, seg[0], seg[1]) + "'", bad.line);
            }
            out.add(ApexParameter.of(tokens.get(typeEnd).text, TypeSyntax.text(tokens, i, typeEnd)));
        }
        return out;
    }

    private void parseAccessorProperty(TokenCursor mc, DeclarationHeader h, Token nameTok, String type, TypeScope scope,
                                       TypeBody body) {
        int open = mc.pos;
        int close = mc.matchingClose();
        boolean getter = false;
        boolean setter = false;
        int depth = 0;
        for (int i = open; i <= close; i++) {
            Token t = mc.tokens.get(i);
            if (t.isSymbol('{')) depth++;
            else if (t.isSymbol('}')) depth--;
            else if (depth == 1 && t.is("get")) getter = true;
            else if (depth == 1 && t.is("set")) setter = true;
        }
        mc.pos = close + 1;
        scope.declare(nameTok.text, type);
        body.properties.add(new ApexProperty(nameTok.text, type, h.modifiers,
                options.parseAnnotations ? h.annotations : List.of(), true, getter, setter, nameTok.line));
    }

    private void parseFields(TokenCursor mc, DeclarationHeader h, Token nameTok, String type, TypeScope scope,
                             TypeBody body) {
        int nameIndex = mc.pos - 1;
        int end = nameIndex;
        int depth = 0;
        while (end < mc.end) {
            Token t = mc.tokens.get(end);
            if (t.isSymbol('(') || t.isSymbol('{') || t.isSymbol('[')) depth++;
            else if (t.isSymbol(')') || t.isSymbol('}') || t.isSymbol(']')) depth--;
            else if (t.isSymbol(';') && depth == 0) break;
            end++;
        }
        if (end >= mc.end) throw new ApexSyntaxException("Missing ';' after field '" + nameTok.text + "'", nameTok.line);

        for (int[] seg : BalancedScanner.splitTopLevel(mc.tokens, nameIndex, end, ',', false)) {
            Token n = mc.tokens.get(seg[0]);
            if (!n.isIdentifier()) continue;
            scope.declare(n.text, type);
            body.properties.add(new ApexProperty(n.text, type, h.modifiers,
                    options.parseAnnotations ? h.annotations : List.of(), false, false, false, n.line));
        }
        mc.pos = end + 1;
    }

    /** Skip past the next top-level {@code ;} or balanced block, whichever comes first. */
    private static void recover(TokenCursor mc, int start) {
        int i = start;
        int depth = 0;
        while (i < mc.end) {
            Token t = mc.tokens.get(i);
            if (t.isSymbol('{')) depth++;
            else if (t.isSymbol('}')) {
                depth--;
                if (depth <= 0) {
                    i++;
                    break;
                }
            } else if (t.isSymbol(';') && depth == 0) {
                i++;
                break;
            }
            i++;
        }
        mc.pos = Math.max(i, start + 1);
    }

    private static boolean isTypeKeyword(Token t) {
        return t.is("class") || t.is("interface") || t.is("enum");
    }

    // ---- per-file and per-type state ----

    private static final class FileContext {
        final String file;
        final List<Token> tokens;
        final Diagnostics diagnostics;

        FileContext(String file, List<Token> tokens, Diagnostics diagnostics) {
            this.file = file;
            this.tokens = tokens;
            this.diagnostics = diagnostics;
        }
    }

    private static final class TypeBody {
        final List<ApexProperty> properties = new ArrayList<>();
        final List<PendingMethod> methods = new ArrayList<>();
        final List<ApexClass> innerClasses = new ArrayList<>();
        final Set<String> innerNames = new HashSet<>();
    }

    /**
     * A method whose body is scanned only after all members of its class are known, so fields declared
     * below the method still inform type inference.
     */
    private static final class PendingMethod {
        String name;
        int line;
        String returnType;
        boolean constructor;
        boolean abstractMethod;
        DeclarationHeader header;
        List<ApexParameter> parameters;
        int bodyFrom = -1;
        int bodyTo = -1;

        ApexMethod finish(List<Token> tokens, ApexParserOptions options, String qualified, String superclass,
                          TypeScope classScope) {
            BodyFacts facts = new BodyFacts();
            if (bodyFrom >= 0) {
                TypeScope scope = classScope.child();
                for (ApexParameter p : parameters) scope.declare(p.name, p.type);
                facts = new MethodBodyScanner(tokens, options, qualified, superclass, null).scan(bodyFrom, bodyTo, scope);
            }
            boolean test = header.hasModifier("testmethod") || header.hasAnnotation("IsTest");
            List<ApexAnnotation> annotations = options.parseAnnotations ? header.annotations : List.of();
            return new ApexMethod(
                    name,
                    returnType,
                    parameters,
                    header.modifiers,
                    annotations,
                    constructor,
                    abstractMethod,
                    test,
                    facts.dml,
                    facts.soql,
                    facts.calls,
                    options.parseDocComments ? header.docComment : null,
                    line
            );
        }
    }
}
