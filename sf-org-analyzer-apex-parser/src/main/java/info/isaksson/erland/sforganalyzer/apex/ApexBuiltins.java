package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.model.CollectionTypes;

import java.util.Locale;
import java.util.Set;

/** Language keywords and platform namespaces that never name user code. */
final class ApexBuiltins {

    static final Set<String> KEYWORDS = Set.of(
            "if", "else", "for", "while", "do", "switch", "when", "on", "catch", "try", "finally", "return",
            "throw", "new", "this", "super", "instanceof", "break", "continue", "null", "true", "false",
            "insert", "update", "upsert", "delete", "undelete", "merge", "class", "interface", "enum",
            "trigger", "final", "static", "transient", "public", "private", "protected", "global");

    private static final Set<String> NAMESPACES = Set.of(
            "system", "database", "schema", "trigger", "test", "limits", "userinfo", "math", "json",
            "jsonparser", "jsongenerator", "string", "integer", "long", "double", "decimal", "boolean", "id",
            "blob", "date", "datetime", "time", "object", "sobject", "list", "set", "map", "apexpages",
            "messaging", "approval", "encodingutil", "crypto", "http", "httprequest", "httpresponse", "url",
            "label", "type", "pattern", "matcher", "search", "site", "auth", "eventbus", "network", "cache",
            "assert", "exception", "savepoint", "querylocator", "sobjecttype", "sobjectfield");

    private ApexBuiltins() {}

    static boolean isKeyword(String word) {
        return word != null && KEYWORDS.contains(word.toLowerCase(Locale.ROOT));
    }

    /** True for platform namespaces and for declared types whose methods are platform methods. */
    static boolean isPlatformType(String typeOrNamespace) {
        if (typeOrNamespace == null || typeOrNamespace.isBlank()) return false;
        if (typeOrNamespace.trim().endsWith("[]")) return true;
        String raw = CollectionTypes.rawName(typeOrNamespace);
        String first = raw.contains(".") ? raw.substring(0, raw.indexOf('.')) : raw;
        String lower = first.toLowerCase(Locale.ROOT);
        return NAMESPACES.contains(lower) || lower.endsWith("exception");
    }
}
