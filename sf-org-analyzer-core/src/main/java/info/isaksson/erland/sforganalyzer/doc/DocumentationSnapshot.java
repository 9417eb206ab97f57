package info.isaksson.erland.sforganalyzer.doc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.analysis.ObjectDependencySummary;

import java.util.List;

/**
 * Input for a documentation generator: plain strings and lists only, no references into the live model, so
 * it can be written to JSON and consumed out of process.
 */
@JsonPropertyOrder({"subject","entryPointCount","classes","triggers","paths","objectDependencies","recursionRisks",
        "sharingNotices"})
public final class DocumentationSnapshot {
    public final String subject;
    public final int entryPointCount;
    public final List<ClassFacts> classes;
    public final List<TriggerFacts> triggers;
    public final List<PathSummary> paths;
    public final List<ObjectDependencySummary> objectDependencies;
    public final List<String> recursionRisks;
    public final List<String> sharingNotices;

    @JsonCreator
    public DocumentationSnapshot(
            @JsonProperty("subject") String subject,
            @JsonProperty("entryPointCount") int entryPointCount,
            @JsonProperty("classes") List<ClassFacts> classes,
            @JsonProperty("triggers") List<TriggerFacts> triggers,
            @JsonProperty("paths") List<PathSummary> paths,
            @JsonProperty("objectDependencies") List<ObjectDependencySummary> objectDependencies,
            @JsonProperty("recursionRisks") List<String> recursionRisks,
            @JsonProperty("sharingNotices") List<String> sharingNotices
    ) {
        this.subject = subject == null ? "" : subject;
        this.entryPointCount = entryPointCount;
        this.classes = copy(classes);
        this.triggers = copy(triggers);
        this.paths = copy(paths);
        this.objectDependencies = copy(objectDependencies);
        this.recursionRisks = copy(recursionRisks);
        this.sharingNotices = copy(sharingNotices);
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    @JsonPropertyOrder({"name","file","sharing","docComment","methods"})
    public static final class ClassFacts {
        public final String name;
        public final String file;
        public final String sharing;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public final String docComment;
        public final List<MethodFacts> methods;

        @JsonCreator
        public ClassFacts(
                @JsonProperty("name") String name,
                @JsonProperty("file") String file,
                @JsonProperty("sharing") String sharing,
                @JsonProperty("docComment") String docComment,
                @JsonProperty("methods") List<MethodFacts> methods
        ) {
            this.name = name;
            this.file = file;
            this.sharing = sharing;
            this.docComment = docComment;
            this.methods = copy(methods);
        }
    }

    @JsonPropertyOrder({"signature","docComment","dml","soql","calls"})
    public static final class MethodFacts {
        public final String signature;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public final String docComment;
        public final List<String> dml;
        public final List<String> soql;
        public final List<String> calls;

        @JsonCreator
        public MethodFacts(
                @JsonProperty("signature") String signature,
                @JsonProperty("docComment") String docComment,
                @JsonProperty("dml") List<String> dml,
                @JsonProperty("soql") List<String> soql,
                @JsonProperty("calls") List<String> calls
        ) {
            this.signature = signature;
            this.docComment = docComment;
            this.dml = copy(dml);
            this.soql = copy(soql);
            this.calls = copy(calls);
        }
    }

    @JsonPropertyOrder({"name","object","contexts","dml","soql","calls"})
    public static final class TriggerFacts {
        public final String name;
        public final String object;
        public final List<String> contexts;
        public final List<String> dml;
        public final List<String> soql;
        public final List<String> calls;

        @JsonCreator
        public TriggerFacts(
                @JsonProperty("name") String name,
                @JsonProperty("object") String object,
                @JsonProperty("contexts") List<String> contexts,
                @JsonProperty("dml") List<String> dml,
                @JsonProperty("soql") List<String> soql,
                @JsonProperty("calls") List<String> calls
        ) {
            this.name = name;
            this.object = object;
            this.contexts = copy(contexts);
            this.dml = copy(dml);
            this.soql = copy(soql);
            this.calls = copy(calls);
        }
    }

    @JsonPropertyOrder({"entryId","object","context","nodes","depth","recursion","truncated","stopReason"})
    public static final class PathSummary {
        public final String entryId;
        public final String object;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public final String context;
        public final List<String> nodes;
        public final int depth;
        public final boolean recursion;
        public final boolean truncated;
        public final String stopReason;

        @JsonCreator
        public PathSummary(
                @JsonProperty("entryId") String entryId,
                @JsonProperty("object") String object,
                @JsonProperty("context") String context,
                @JsonProperty("nodes") List<String> nodes,
                @JsonProperty("depth") int depth,
                @JsonProperty("recursion") boolean recursion,
                @JsonProperty("truncated") boolean truncated,
                @JsonProperty("stopReason") String stopReason
        ) {
            this.entryId = entryId;
            this.object = object;
            this.context = context;
            this.nodes = copy(nodes);
            this.depth = depth;
            this.recursion = recursion;
            this.truncated = truncated;
            this.stopReason = stopReason;
        }
    }
}
