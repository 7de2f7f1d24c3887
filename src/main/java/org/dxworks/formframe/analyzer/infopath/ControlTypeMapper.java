package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.model.infopath.ControlKind;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps InfoPath control markers ({@code xd:xctname}, {@code class} behaviours,
 * {@code input type}) to {@link ControlKind}.
 */
public final class ControlTypeMapper {

    static final String PEOPLE_PICKER_CLASSID = "61e40d31-993d-4777-8fa0-19ca59b6d0bb";

    private static final Map<String, ControlKind> XCT_NAMES = new HashMap<>();

    static {
        XCT_NAMES.put("plaintext", ControlKind.TEXT_FIELD);
        XCT_NAMES.put("textfield", ControlKind.TEXT_FIELD);
        XCT_NAMES.put("dtpicker", ControlKind.DATE_PICKER);
        XCT_NAMES.put("datepicker", ControlKind.DATE_PICKER);
        XCT_NAMES.put("richtext", ControlKind.RICH_TEXT);
        XCT_NAMES.put("dropdown", ControlKind.DROP_DOWN);
        XCT_NAMES.put("combobox", ControlKind.COMBO_BOX);
        XCT_NAMES.put("listbox", ControlKind.LIST_BOX);
        XCT_NAMES.put("checkbox", ControlKind.CHECK_BOX);
        XCT_NAMES.put("optionbutton", ControlKind.RADIO_BUTTON);
        XCT_NAMES.put("radiobutton", ControlKind.RADIO_BUTTON);
        XCT_NAMES.put("button", ControlKind.BUTTON);
        XCT_NAMES.put("fileattachment", ControlKind.FILE_ATTACHMENT);
        XCT_NAMES.put("sharepoint:sharepointfileattachment", ControlKind.SHAREPOINT_FILE_ATTACHMENT);
        XCT_NAMES.put("sharepointfileattachment", ControlKind.SHAREPOINT_FILE_ATTACHMENT);
        XCT_NAMES.put("section", ControlKind.SECTION);
        XCT_NAMES.put("repeatingsection", ControlKind.REPEATING_SECTION);
        XCT_NAMES.put("optionalsection", ControlKind.OPTIONAL_SECTION);
        XCT_NAMES.put("repeatingtable", ControlKind.REPEATING_TABLE);
        XCT_NAMES.put("bulletedlist", ControlKind.BULLETED_LIST);
        XCT_NAMES.put("numberedlist", ControlKind.NUMBERED_LIST);
        XCT_NAMES.put("plainnumberedlist", ControlKind.PLAIN_NUMBERED_LIST);
        XCT_NAMES.put("plainlist", ControlKind.PLAIN_NUMBERED_LIST);
        XCT_NAMES.put("multipleselectlist", ControlKind.MULTIPLE_SELECT_LIST);
        XCT_NAMES.put("expressionbox", ControlKind.EXPRESSION_BOX);
        XCT_NAMES.put("hyperlink", ControlKind.HYPERLINK);
        XCT_NAMES.put("inlinepicture", ControlKind.INLINE_PICTURE);
        XCT_NAMES.put("inlineimage", ControlKind.INLINE_PICTURE);
        XCT_NAMES.put("linkedpicture", ControlKind.LINKED_PICTURE);
        XCT_NAMES.put("linkedimage", ControlKind.LINKED_PICTURE);
        XCT_NAMES.put("signatureline", ControlKind.SIGNATURE_LINE);
        XCT_NAMES.put("peoplepicker", ControlKind.PEOPLE_PICKER);
    }

    private ControlTypeMapper() {
        // utility class
    }

    /**
     * Kind for an {@code xctname} value. ActiveX class ids ({@code {...}}) map to
     * {@link ControlKind#PEOPLE_PICKER} or {@link ControlKind#ACTIVE_X}; unknown names to
     * {@link ControlKind#OTHER}.
     */
    public static ControlKind fromXctName(String xctName) {
        if (xctName == null || xctName.isBlank()) return ControlKind.OTHER;
        String value = xctName.trim();
        if (isClassId(value)) {
            return value.toLowerCase(Locale.ROOT).contains(PEOPLE_PICKER_CLASSID)
                    ? ControlKind.PEOPLE_PICKER : ControlKind.ACTIVE_X;
        }
        ControlKind kind = XCT_NAMES.get(value.toLowerCase(Locale.ROOT));
        if (kind != null) return kind;
        kind = ControlKind.fromDisplayName(value);
        return kind != null ? kind : ControlKind.OTHER;
    }

    /**
     * Display type for an {@code xctname} value: the kind name, {@code ActiveX-{classid}},
     * or the raw value when unknown.
     */
    public static String typeFromXctName(String xctName) {
        ControlKind kind = fromXctName(xctName);
        if (kind == ControlKind.ACTIVE_X) return "ActiveX-" + xctName.trim();
        if (kind == ControlKind.OTHER) return xctName == null ? "" : xctName.trim();
        return kind.getDisplayName();
    }

    /**
     * Kind implied by the InfoPath behaviour classes on an element, or null when none is present.
     */
    public static ControlKind fromClass(String className) {
        if (className == null || className.isEmpty()) return null;
        if (className.contains("xdBehavior_Boolean")) return ControlKind.CHECK_BOX;
        if (className.contains("xdRichTextBox")) return ControlKind.RICH_TEXT;
        if (className.contains("xdTextBox")) return ControlKind.TEXT_FIELD;
        if (className.contains("xdComboBox")) return ControlKind.DROP_DOWN;
        if (className.contains("xdDTPicker")) return ControlKind.DATE_PICKER;
        if (className.contains("xdListBox")) return ControlKind.LIST_BOX;
        if (className.contains("xdExpressionBox")) return ControlKind.EXPRESSION_BOX;
        if (className.contains("xdFileAttachment")) return ControlKind.FILE_ATTACHMENT;
        if (className.contains("xdInlinePicture")) return ControlKind.INLINE_PICTURE;
        if (className.contains("xdLinkedPicture")) return ControlKind.LINKED_PICTURE;
        if (className.contains("xdButton")) return ControlKind.BUTTON;
        return null;
    }

    public static ControlKind fromInputType(String inputType) {
        if (inputType == null || inputType.isEmpty()) return ControlKind.TEXT_FIELD;
        switch (inputType.toLowerCase(Locale.ROOT)) {
            case "checkbox":
                return ControlKind.CHECK_BOX;
            case "radio":
                return ControlKind.RADIO_BUTTON;
            case "button":
            case "submit":
            case "reset":
                return ControlKind.BUTTON;
            case "file":
                return ControlKind.FILE_ATTACHMENT;
            default:
                return ControlKind.TEXT_FIELD;
        }
    }

    static boolean isClassId(String value) {
        return value.startsWith("{") && value.endsWith("}");
    }
}
