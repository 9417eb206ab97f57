package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Parses {@code trigger Name on Object (before insert, after update) { ... }}. */
final class ApexTriggerParser {

    private final ApexParserOptions options;

    ApexTriggerParser(ApexParserOptions options) {
        this.options = options;
    }

    ApexTrigger parse(TokenCursor c, DeclarationHeader header, String file, Diagnostics diagnostics) {
        c.next();
        Token name = c.expectIdentifier("trigger name");
        if (!c.accept("on")) {
            throw new ApexSyntaxException("Expected 'on' after trigger " + name.text + " but found '" + c.peek().text + "'",
                    c.line());
        }
        Token object = c.expectIdentifier("trigger object");
        if (!c.peek().isSymbol('(')) {
            throw new ApexSyntaxException("Expected trigger events for " + name.text, c.line());
        }
        int evOpen = c.pos;
        int evClose = c.matchingClose();
        List<TriggerContext> contexts = new ArrayList<>();
        for (int[] seg : BalancedScanner.splitTopLevel(c.tokens, evOpen + 1, evClose, ',', false)) {
            String text = BalancedScanner.text(c.tokens, seg[0], seg[1]);
            Optional<TriggerContext> ctx = TriggerContext.parse(text);
            if (ctx.isPresent()) {
                if (!contexts.contains(ctx.get())) contexts.add(ctx.get());
            } else {
                diagnostics.parseError(file, c.tokens.get(seg[0]).line, "Unknown trigger event '" + text + "' on " + name.text);
            }
        }
        c.pos = evClose + 1;

        if (!c.peek().isSymbol('{')) {
            throw new ApexSyntaxException("Expected trigger body for " + name.text, c.line());
        }
        int bodyOpen = c.pos;
        int bodyClose = c.matchingClose();
        BodyFacts facts = new MethodBodyScanner(c.tokens, options, null, null, object.text)
                .scan(bodyOpen + 1, bodyClose, TypeScope.root());
        c.pos = bodyClose + 1;

        return new ApexTrigger(
                name.text,
                object.text,
                contexts,
                facts.calls,
                facts.dml,
                facts.soql,
                options.parseDocComments ? header.docComment : null,
                file,
                name.line
        );
    }
}
