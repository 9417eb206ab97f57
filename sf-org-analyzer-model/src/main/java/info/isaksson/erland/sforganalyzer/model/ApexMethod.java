package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A method or constructor declared by an {@link ApexClass}.
 *
 * <p>Body facts (DML, SOQL, call sites) are kept in source order; downstream path ordering depends on it.
 * Constructors have an empty {@code returnType}.</p>
 */
@JsonPropertyOrder({"name","returnType","parameters","modifiers","annotations","constructor","abstractMethod",
        "testMethod","dmlOperations","soqlQueries","callSites","docComment","line"})
public final class ApexMethod {
    public final String name;
    public final String returnType;
    public final List<ApexParameter> parameters;
    public final List<String> modifiers;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ApexAnnotation> annotations;

    public final boolean constructor;
    public final boolean abstractMethod;
    public final boolean testMethod;
    public final List<DmlOperation> dmlOperations;
    public final List<SoqlQuery> soqlQueries;
    public final List<CallSite> callSites;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String docComment;

    public final int line;

    @JsonCreator
    public ApexMethod(
            @JsonProperty("name") String name,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("parameters") List<ApexParameter> parameters,
            @JsonProperty("modifiers") List<String> modifiers,
            @JsonProperty("annotations") List<ApexAnnotation> annotations,
            @JsonProperty("constructor") boolean constructor,
            @JsonProperty("abstractMethod") boolean abstractMethod,
            @JsonProperty("testMethod") boolean testMethod,
            @JsonProperty("dmlOperations") List<DmlOperation> dmlOperations,
            @JsonProperty("soqlQueries") List<SoqlQuery> soqlQueries,
            @JsonProperty("callSites") List<CallSite> callSites,
            @JsonProperty("docComment") String docComment,
            @JsonProperty("line") int line
    ) {
        this.name = name == null ? "" : name;
        this.returnType = returnType == null ? "" : returnType;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.constructor = constructor;
        this.abstractMethod = abstractMethod;
        this.testMethod = testMethod;
        this.dmlOperations = dmlOperations == null ? List.of() : List.copyOf(dmlOperations);
        this.soqlQueries = soqlQueries == null ? List.of() : List.copyOf(soqlQueries);
        this.callSites = callSites == null ? List.of() : List.copyOf(callSites);
        this.docComment = docComment == null || docComment.isBlank() ? null : docComment;
        this.line = line;
    }

    public ApexVisibility visibility() {
        return ApexVisibility.fromModifiers(modifiers);
    }

    public boolean isStatic() {
        return modifiers.stream().anyMatch(m -> m.toLowerCase(Locale.ROOT).equals("static"));
    }

    public boolean hasAnnotation(String annotationName) {
        return annotations.stream().anyMatch(a -> a.isNamed(annotationName));
    }

    /** {@code name(Type1, Type2)}; used in reports. */
    public String signature() {
        return name + "(" + parameters.stream().map(p -> p.type).collect(Collectors.joining(", ")) + ")";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexMethod)) return false;
        ApexMethod that = (ApexMethod) o;
        return constructor == that.constructor &&
                abstractMethod == that.abstractMethod &&
                testMethod == that.testMethod &&
                line == that.line &&
                Objects.equals(name, that.name) &&
                Objects.equals(returnType, that.returnType) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(modifiers, that.modifiers) &&
                Objects.equals(annotations, that.annotations) &&
                Objects.equals(dmlOperations, that.dmlOperations) &&
                Objects.equals(soqlQueries, that.soqlQueries) &&
                Objects.equals(callSites, that.callSites) &&
                Objects.equals(docComment, that.docComment);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, parameters, modifiers, annotations, constructor, abstractMethod,
                testMethod, dmlOperations, soqlQueries, callSites, docComment, line);
    }
}
