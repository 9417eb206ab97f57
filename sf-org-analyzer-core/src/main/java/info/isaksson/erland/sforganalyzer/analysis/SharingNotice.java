package info.isaksson.erland.sforganalyzer.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** An entry point reaches Apex that does not enforce sharing rules. */
@JsonPropertyOrder({"entryId","apexNodeId","sharing","message"})
public final class SharingNotice {
    public final String entryId;
    public final String apexNodeId;
    public final String sharing;
    public final String message;

    @JsonCreator
    public SharingNotice(
            @JsonProperty("entryId") String entryId,
            @JsonProperty("apexNodeId") String apexNodeId,
            @JsonProperty("sharing") String sharing,
            @JsonProperty("message") String message
    ) {
        this.entryId = entryId;
        this.apexNodeId = apexNodeId;
        this.sharing = sharing;
        this.message = message;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SharingNotice)) return false;
        SharingNotice that = (SharingNotice) o;
        return Objects.equals(entryId, that.entryId) &&
                Objects.equals(apexNodeId, that.apexNodeId) &&
                Objects.equals(sharing, that.sharing) &&
                Objects.equals(message, that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(entryId, apexNodeId, sharing, message);
    }

    @Override public String toString() {
        return message;
    }
}
