package info.isaksson.erland.sforganalyzer.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Collection facts of declared Apex type names, and the naming heuristic used when no declaration is visible.
 *
 * <p>No generic-type algebra is modeled. A declared type is a collection only when it is a {@code List},
 * {@code Set} or {@code Map} or an array; {@code Asset} and {@code Checklist__c} are single records.</p>
 */
public final class CollectionTypes {

    private static final Pattern COLLECTION_NAME = Pattern.compile("[A-Za-z0-9_]*[a-z0-9](List|Set|Map)");

    private CollectionTypes() {}

    public static CollectionKind kindOf(String declaredType) {
        String t = compact(declaredType);
        if (t.isEmpty()) return CollectionKind.NONE;
        if (t.endsWith("[]")) return CollectionKind.ARRAY;

        switch (simpleName(rawName(t)).toLowerCase(Locale.ROOT)) {
            case "list":
                return CollectionKind.LIST;
            case "set":
                return CollectionKind.SET;
            case "map":
                return CollectionKind.MAP;
            default:
                return CollectionKind.NONE;
        }
    }

    public static boolean isCollection(String declaredType) {
        return kindOf(declaredType).isCollection();
    }

    /**
     * Naming heuristic for an undeclared operand: a capitalized {@code List}, {@code Set} or {@code Map} suffix
     * after a lowercase letter or digit, as in {@code accountList} or {@code OpportunitySet}. Case-sensitive,
     * so {@code Asset} and {@code offset} do not match.
     */
    public static boolean hasCollectionName(String identifier) {
        return identifier != null && COLLECTION_NAME.matcher(identifier).matches();
    }

    /**
     * Element type of a collection: {@code List<Account>} gives {@code Account}, {@code Account[]} gives
     * {@code Account}, {@code Map<Id, Contact>} gives the value type {@code Contact}.
     * Non-collections are returned compacted but otherwise unchanged.
     */
    public static String elementType(String declaredType) {
        String t = compact(declaredType);
        if (t.isEmpty()) return t;
        if (t.endsWith("[]")) return t.substring(0, t.length() - 2);

        int lt = t.indexOf('<');
        int gt = t.lastIndexOf('>');
        if (lt < 0 || gt < lt) return t;

        String args = t.substring(lt + 1, gt);
        if (kindOf(t) == CollectionKind.MAP) {
            int comma = topLevelComma(args);
            if (comma >= 0) return args.substring(comma + 1);
        }
        return args;
    }

    /** Strip generic arguments and array brackets: {@code List<Account>} gives {@code List}. */
    public static String rawName(String declaredType) {
        String t = compact(declaredType);
        int lt = t.indexOf('<');
        if (lt >= 0) t = t.substring(0, lt);
        while (t.endsWith("[]")) t = t.substring(0, t.length() - 2);
        return t;
    }

    public static String simpleName(String name) {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private static int topLevelComma(String s) {
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<') depth++;
            else if (c == '>') depth--;
            else if (c == ',' && depth == 0) return i;
        }
        return -1;
    }

    private static String compact(String s) {
        if (s == null) return "";
        return s.replaceAll("\\s+", "");
    }
}
