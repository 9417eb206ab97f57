package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The merged class table and trigger list of one analysis run.
 *
 * <p>Top-level classes and triggers are sorted by name. Lookups are case-insensitive and accept
 * {@code Outer.Inner} for nested classes.</p>
 */
@JsonPropertyOrder({"classes","triggers"})
public final class ApexCodebase {
    public final List<ApexClass> classes;
    public final List<ApexTrigger> triggers;

    @JsonIgnore
    private final Map<String, ApexClass> byQualifiedName;

    @JsonCreator
    public ApexCodebase(
            @JsonProperty("classes") List<ApexClass> classes,
            @JsonProperty("triggers") List<ApexTrigger> triggers
    ) {
        List<ApexClass> cs = new ArrayList<>(classes == null ? List.of() : classes);
        cs.sort(Comparator.comparing((ApexClass c) -> c.name.toLowerCase(Locale.ROOT)).thenComparing(c -> c.file));
        List<ApexTrigger> ts = new ArrayList<>(triggers == null ? List.of() : triggers);
        ts.sort(Comparator.comparing((ApexTrigger t) -> t.name.toLowerCase(Locale.ROOT)).thenComparing(t -> t.file));
        this.classes = List.copyOf(cs);
        this.triggers = List.copyOf(ts);

        Map<String, ApexClass> index = new LinkedHashMap<>();
        for (ApexClass top : this.classes) {
            for (ApexClass c : top.flatten()) {
                index.putIfAbsent(c.qualifiedName.toLowerCase(Locale.ROOT), c);
            }
        }
        this.byQualifiedName = index;
    }

    public static ApexCodebase empty() {
        return new ApexCodebase(List.of(), List.of());
    }

    /**
     * Find a class by simple or qualified name. When {@code fromClass} is given, an unqualified name is
     * first tried as an inner class of that class's outermost type.
     */
    public Optional<ApexClass> findClass(String name, String fromClass) {
        if (name == null || name.isBlank()) return Optional.empty();
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (fromClass != null && !fromClass.isBlank() && !key.contains(".")) {
            String outer = fromClass.contains(".") ? fromClass.substring(0, fromClass.indexOf('.')) : fromClass;
            ApexClass nested = byQualifiedName.get(outer.toLowerCase(Locale.ROOT) + "." + key);
            if (nested != null) return Optional.of(nested);
        }
        return Optional.ofNullable(byQualifiedName.get(key));
    }

    public Optional<ApexClass> findClass(String name) {
        return findClass(name, null);
    }

    /** All classes including nested ones, in table order. */
    @JsonIgnore
    public List<ApexClass> allClasses() {
        return List.copyOf(byQualifiedName.values());
    }
}
