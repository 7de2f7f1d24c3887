package org.dxworks.formframe.model.infopath;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RepeatingKind {
    SECTION("Section"),
    TABLE("Table");

    private final String displayName;

    RepeatingKind(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
