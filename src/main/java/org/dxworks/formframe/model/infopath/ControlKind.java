package org.dxworks.formframe.model.infopath;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum ControlKind {
    TEXT_FIELD("TextField"),
    RICH_TEXT("RichText"),
    DROP_DOWN("DropDown"),
    COMBO_BOX("ComboBox"),
    LIST_BOX("ListBox"),
    DATE_PICKER("DatePicker"),
    CHECK_BOX("CheckBox"),
    RADIO_BUTTON("RadioButton"),
    BUTTON("Button"),
    FILE_ATTACHMENT("FileAttachment"),
    SHAREPOINT_FILE_ATTACHMENT("SharePointFileAttachment"),
    PEOPLE_PICKER("PeoplePicker"),
    ACTIVE_X("ActiveX"),
    HYPERLINK("Hyperlink"),
    INLINE_PICTURE("InlinePicture"),
    LINKED_PICTURE("LinkedPicture"),
    SIGNATURE_LINE("SignatureLine"),
    BULLETED_LIST("BulletedList"),
    NUMBERED_LIST("NumberedList"),
    PLAIN_NUMBERED_LIST("PlainNumberedList"),
    MULTIPLE_SELECT_LIST("MultipleSelectList"),
    EXPRESSION_BOX("ExpressionBox"),
    SECTION("Section"),
    REPEATING_SECTION("RepeatingSection"),
    OPTIONAL_SECTION("OptionalSection"),
    REPEATING_TABLE("RepeatingTable"),
    LABEL("Label"),
    OTHER("Other");

    private static final Set<ControlKind> CHOICE_KINDS = EnumSet.of(DROP_DOWN, COMBO_BOX, LIST_BOX, MULTIPLE_SELECT_LIST);

    private final String displayName;

    ControlKind(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Kinds whose values come from a static list of options.
     */
    public boolean isChoice() {
        return CHOICE_KINDS.contains(this);
    }

    public static ControlKind fromDisplayName(String name) {
        if (name == null) return null;
        for (ControlKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(name)) {
                return kind;
            }
        }
        return null;
    }
}
