package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A class, interface or enum declared in Apex source.
 *
 * <p>Inner classes are owned exclusively by their enclosing class; the tree is built bottom-up by the
 * parser so no class can be its own ancestor. {@code qualifiedName} is {@code Outer.Inner} for inner
 * classes and equals {@code name} otherwise.</p>
 */
@JsonPropertyOrder({"name","qualifiedName","kind","modifiers","sharing","superclass","interfaces","annotations",
        "properties","methods","innerClasses","docComment","file","line"})
public final class ApexClass {
    public final String name;
    public final String qualifiedName;
    public final ApexTypeKind kind;
    public final List<String> modifiers;
    public final SharingMode sharing;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String superclass;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> interfaces;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ApexAnnotation> annotations;

    public final List<ApexProperty> properties;
    public final List<ApexMethod> methods;
    public final List<ApexClass> innerClasses;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String docComment;

    public final String file;
    public final int line;

    @JsonCreator
    public ApexClass(
            @JsonProperty("name") String name,
            @JsonProperty("qualifiedName") String qualifiedName,
            @JsonProperty("kind") ApexTypeKind kind,
            @JsonProperty("modifiers") List<String> modifiers,
            @JsonProperty("sharing") SharingMode sharing,
            @JsonProperty("superclass") String superclass,
            @JsonProperty("interfaces") List<String> interfaces,
            @JsonProperty("annotations") List<ApexAnnotation> annotations,
            @JsonProperty("properties") List<ApexProperty> properties,
            @JsonProperty("methods") List<ApexMethod> methods,
            @JsonProperty("innerClasses") List<ApexClass> innerClasses,
            @JsonProperty("docComment") String docComment,
            @JsonProperty("file") String file,
            @JsonProperty("line") int line
    ) {
        this.name = name == null ? "" : name;
        this.qualifiedName = qualifiedName == null || qualifiedName.isBlank() ? this.name : qualifiedName;
        this.kind = kind == null ? ApexTypeKind.CLASS : kind;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.sharing = sharing == null ? SharingMode.NONE : sharing;
        this.superclass = superclass == null || superclass.isBlank() ? null : superclass;
        this.interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.methods = methods == null ? List.of() : List.copyOf(methods);
        this.innerClasses = innerClasses == null ? List.of() : List.copyOf(innerClasses);
        this.docComment = docComment == null || docComment.isBlank() ? null : docComment;
        this.file = file == null ? "" : file;
        this.line = line;
    }

    public boolean hasAnnotation(String annotationName) {
        return annotations.stream().anyMatch(a -> a.isNamed(annotationName));
    }

    public boolean isTestClass() {
        return hasAnnotation("IsTest");
    }

    /** Methods with the given name, in declaration order; Apex names are case-insensitive. */
    public List<ApexMethod> methodsNamed(String methodName) {
        List<ApexMethod> out = new ArrayList<>();
        for (ApexMethod m : methods) {
            if (m.name.equalsIgnoreCase(methodName)) out.add(m);
        }
        return out;
    }

    /** This class followed by all nested classes, depth-first in declaration order. */
    public List<ApexClass> flatten() {
        List<ApexClass> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(ApexClass c, List<ApexClass> out) {
        out.add(c);
        for (ApexClass inner : c.innerClasses) collect(inner, out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexClass)) return false;
        ApexClass that = (ApexClass) o;
        return line == that.line &&
                Objects.equals(name, that.name) &&
                Objects.equals(qualifiedName, that.qualifiedName) &&
                kind == that.kind &&
                Objects.equals(modifiers, that.modifiers) &&
                sharing == that.sharing &&
                Objects.equals(superclass, that.superclass) &&
                Objects.equals(interfaces, that.interfaces) &&
                Objects.equals(annotations, that.annotations) &&
                Objects.equals(properties, that.properties) &&
                Objects.equals(methods, that.methods) &&
                Objects.equals(innerClasses, that.innerClasses) &&
                Objects.equals(docComment, that.docComment) &&
                Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(name, qualifiedName, kind, modifiers, sharing, superclass, interfaces, annotations,
                properties, methods, innerClasses, docComment, file, line);
    }

    @Override public String toString() {
        return "ApexClass{" + qualifiedName + ", methods=" + methods.size() + ", inner=" + innerClasses.size() + "}";
    }
}
