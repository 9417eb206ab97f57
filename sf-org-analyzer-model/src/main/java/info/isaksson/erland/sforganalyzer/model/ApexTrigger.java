package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** An Apex trigger: {@code trigger Name on Object (contexts) { body }}. */
@JsonPropertyOrder({"name","objectName","contexts","callSites","dmlOperations","soqlQueries","docComment","file","line"})
public final class ApexTrigger {
    public final String name;
    public final String objectName;
    public final List<TriggerContext> contexts;
    public final List<CallSite> callSites;
    public final List<DmlOperation> dmlOperations;
    public final List<SoqlQuery> soqlQueries;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String docComment;

    public final String file;
    public final int line;

    @JsonCreator
    public ApexTrigger(
            @JsonProperty("name") String name,
            @JsonProperty("objectName") String objectName,
            @JsonProperty("contexts") List<TriggerContext> contexts,
            @JsonProperty("callSites") List<CallSite> callSites,
            @JsonProperty("dmlOperations") List<DmlOperation> dmlOperations,
            @JsonProperty("soqlQueries") List<SoqlQuery> soqlQueries,
            @JsonProperty("docComment") String docComment,
            @JsonProperty("file") String file,
            @JsonProperty("line") int line
    ) {
        this.name = name == null ? "" : name;
        this.objectName = objectName == null ? "" : objectName;
        this.contexts = contexts == null ? List.of() : List.copyOf(contexts);
        this.callSites = callSites == null ? List.of() : List.copyOf(callSites);
        this.dmlOperations = dmlOperations == null ? List.of() : List.copyOf(dmlOperations);
        this.soqlQueries = soqlQueries == null ? List.of() : List.copyOf(soqlQueries);
        this.docComment = docComment == null || docComment.isBlank() ? null : docComment;
        this.file = file == null ? "" : file;
        this.line = line;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexTrigger)) return false;
        ApexTrigger that = (ApexTrigger) o;
        return line == that.line &&
                Objects.equals(name, that.name) &&
                Objects.equals(objectName, that.objectName) &&
                Objects.equals(contexts, that.contexts) &&
                Objects.equals(callSites, that.callSites) &&
                Objects.equals(dmlOperations, that.dmlOperations) &&
                Objects.equals(soqlQueries, that.soqlQueries) &&
                Objects.equals(docComment, that.docComment) &&
                Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(name, objectName, contexts, callSites, dmlOperations, soqlQueries, docComment, file, line);
    }
}
