package info.isaksson.erland.sforganalyzer.model;

import java.util.List;
import java.util.Locale;

/** Access level of an Apex member. Apex defaults to private when nothing is declared. */
public enum ApexVisibility {
    PRIVATE,
    PROTECTED,
    PUBLIC,
    GLOBAL;

    public static ApexVisibility fromModifiers(List<String> modifiers) {
        if (modifiers != null) {
            for (String m : modifiers) {
                if (m == null) continue;
                switch (m.toLowerCase(Locale.ROOT)) {
                    case "global":
                        return GLOBAL;
                    case "public":
                        return PUBLIC;
                    case "protected":
                        return PROTECTED;
                    case "private":
                        return PRIVATE;
                    default:
                        break;
                }
            }
        }
        return PRIVATE;
    }
}
