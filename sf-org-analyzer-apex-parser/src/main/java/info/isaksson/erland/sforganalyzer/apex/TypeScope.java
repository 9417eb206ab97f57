package info.isaksson.erland.sforganalyzer.apex;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Declared types of variables visible in a body: locals, then parameters, then fields of the enclosing
 * classes. Names are case-insensitive.
 */
final class TypeScope {
    private final TypeScope parent;
    private final Map<String, String> types = new HashMap<>();

    TypeScope(TypeScope parent) {
        this.parent = parent;
    }

    static TypeScope root() {
        return new TypeScope(null);
    }

    TypeScope child() {
        return new TypeScope(this);
    }

    void declare(String name, String type) {
        if (name == null || type == null) return;
        types.put(name.toLowerCase(Locale.ROOT), type);
    }

    /** @return the declared type, or {@code null} when the name is not a known variable */
    String typeOf(String name) {
        if (name == null) return null;
        String t = types.get(name.toLowerCase(Locale.ROOT));
        if (t != null) return t;
        return parent == null ? null : parent.typeOf(name);
    }
}
