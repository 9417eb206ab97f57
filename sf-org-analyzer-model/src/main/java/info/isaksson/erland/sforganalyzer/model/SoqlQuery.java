package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A SOQL query found in a method body.
 *
 * <p>{@code dynamic} marks queries recovered from string literals (for example passed to
 * {@code Database.query}) rather than from inline {@code [SELECT ...]} syntax.</p>
 */
@JsonPropertyOrder({"query","referencedObjects","dynamic","line","column"})
public final class SoqlQuery {
    private static final Pattern AGGREGATE = Pattern.compile(
            "\\b(COUNT|COUNT_DISTINCT|SUM|AVG|MIN|MAX)\\s*\\(|\\bGROUP\\s+BY\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBQUERY = Pattern.compile("\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOTTED_FIELD = Pattern.compile("^\\s*SELECT\\s+.*?\\b\\w+\\.\\w+.*?\\bFROM\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BIND = Pattern.compile(":\\s*[A-Za-z_]");

    public final String query;
    public final List<String> referencedObjects;
    public final boolean dynamic;
    public final int line;

    /** 1-based column of the opening bracket or string literal; 0 when unknown. */
    public final int column;

    @JsonCreator
    public SoqlQuery(
            @JsonProperty("query") String query,
            @JsonProperty("referencedObjects") List<String> referencedObjects,
            @JsonProperty("dynamic") boolean dynamic,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.query = query == null ? "" : query;
        this.referencedObjects = referencedObjects == null ? List.of() : List.copyOf(referencedObjects);
        this.dynamic = dynamic;
        this.line = line;
        this.column = column;
    }

    /** The object named by the outermost FROM clause, or {@link DmlOperation#UNKNOWN_OBJECT}. */
    @JsonIgnore
    public String primaryObject() {
        return referencedObjects.isEmpty() ? DmlOperation.UNKNOWN_OBJECT : referencedObjects.get(0);
    }

    @JsonProperty("queryType")
    public SoqlQueryType queryType() {
        if (AGGREGATE.matcher(query).find()) return SoqlQueryType.AGGREGATE;
        if (SUBQUERY.matcher(query).find() || DOTTED_FIELD.matcher(query).find()) {
            return SoqlQueryType.RELATIONSHIP;
        }
        return SoqlQueryType.SIMPLE;
    }

    @JsonProperty("hasBindVariables")
    public boolean hasBindVariables() {
        return BIND.matcher(stripQuoted(query)).find();
    }

    private static String stripQuoted(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && quoted && i + 1 < s.length()) {
                i++;
                continue;
            }
            if (c == '\'') {
                quoted = !quoted;
                continue;
            }
            if (!quoted) sb.append(c);
        }
        return sb.toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SoqlQuery)) return false;
        SoqlQuery that = (SoqlQuery) o;
        return dynamic == that.dynamic &&
                line == that.line &&
                column == that.column &&
                Objects.equals(query, that.query) &&
                Objects.equals(referencedObjects, that.referencedObjects);
    }

    @Override public int hashCode() {
        return Objects.hash(query, referencedObjects, dynamic, line, column);
    }

    @Override public String toString() {
        String q = query.length() > 60 ? query.substring(0, 57) + "..." : query;
        return "[" + q + "] @" + line;
    }
}
