package org.dxworks.formframe.model.infopath;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SectionKind {
    COSMETIC("Cosmetic"),
    REPEATING("Repeating"),
    CONDITIONAL("Conditional");

    private final String displayName;

    SectionKind(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
