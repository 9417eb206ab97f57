package info.isaksson.erland.sforganalyzer.doc;

import java.util.ArrayList;
import java.util.List;

/** Documentation derived only from counts and findings, used when no text generator is configured. */
public final class FallbackDocumentationGenerator implements DocumentationGenerator {

    public static final String NAME = "fallback";

    @Override
    public GeneratedDocumentation generate(DocumentationSnapshot s) {
        long truncated = s.paths.stream().filter(p -> p.truncated).count();
        long methods = s.classes.stream().mapToLong(c -> c.methods.size()).sum();

        String technical = "Found " + s.entryPointCount + " entry points and " + s.paths.size() + " execution paths. "
                + "The code base has " + s.classes.size() + " Apex classes with " + methods + " methods and "
                + s.triggers.size() + " triggers.";
        if (truncated > 0) technical += " " + truncated + " paths were truncated by the analysis bounds.";

        List<String> recommendations = new ArrayList<>();
        recommendations.add("Review automation manually");
        if (!s.recursionRisks.isEmpty()) {
            recommendations.add("Add recursion guards: " + s.recursionRisks.size() + " recursion risks were found");
        }
        if (!s.sharingNotices.isEmpty()) {
            recommendations.add("Check sharing: " + s.sharingNotices.size() + " paths reach Apex that does not enforce sharing");
        }
        if (truncated > 0) {
            recommendations.add("Raise execution.max_depth or execution.max_iterations to see truncated paths in full");
        }

        return new GeneratedDocumentation(NAME, "Analysis of " + s.subject, technical,
                "Unable to determine business impact", recommendations);
    }
}
