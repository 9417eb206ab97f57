package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Sharing declaration of an Apex class. */
public enum SharingMode {
    NONE(""),
    WITH_SHARING("with sharing"),
    WITHOUT_SHARING("without sharing"),
    INHERITED_SHARING("inherited sharing");

    private final String keyword;

    SharingMode(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String keyword() {
        return keyword;
    }

    /** Map the word preceding {@code sharing} ("with", "without", "inherited"). */
    public static SharingMode fromPrefix(String prefix) {
        if (prefix == null) return NONE;
        switch (prefix.trim().toLowerCase(Locale.ROOT)) {
            case "with":
                return WITH_SHARING;
            case "without":
                return WITHOUT_SHARING;
            case "inherited":
                return INHERITED_SHARING;
            default:
                return NONE;
        }
    }

    @com.fasterxml.jackson.annotation.JsonCreator
    public static SharingMode fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) return NONE;
        for (SharingMode m : values()) {
            if (m.keyword.equalsIgnoreCase(keyword.trim())) return m;
        }
        return NONE;
    }
}
