package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.analyzer.DomHelper;
import org.dxworks.formframe.model.infopath.ChoiceOption;
import org.dxworks.formframe.model.infopath.Control;
import org.dxworks.formframe.model.infopath.ControlKind;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Control} from a single view element. The result carries kind, type,
 * label, binding, properties, options and cell spans; placement, naming and scope
 * tagging are left to the walker.
 */
final class ControlExtractor {

    private static final Set<String> BOUND_INLINE_ELEMENTS =
            Set.of("span", "font", "a", "strong", "em", "b", "i", "u", "label");

    private static final Set<String> LABEL_ELEMENTS =
            Set.of("strong", "font", "label", "em", "b", "i", "span", "p", "h1", "h2", "h3", "h4", "h5", "h6");

    private static final Set<String> TEXT_CELL_ELEMENTS = Set.of("div", "td", "th");

    private static final Set<String> STRUCTURAL_XCT_NAMES =
            Set.of("expressionbox", "section", "repeatingsection", "repeatingtable", "optionalsection");

    private static final Set<String> NATIVE_ELEMENTS = Set.of("input", "select", "textarea");

    private static final Set<String> SKIPPED_ATTRIBUTES =
            Set.of("style", "class", "hidefocus", "tabindex", "contenteditable", "xctname", "title", "binding", "ctrlid");

    /**
     * Control for the element, or null when the element is not a control.
     */
    Control extract(Element element) {
        String name = DomHelper.localName(element);
        String binding = DomHelper.attr(element, "binding");
        String xctName = DomHelper.attr(element, "xctname");

        if (!binding.isEmpty() && BOUND_INLINE_ELEMENTS.contains(name)) {
            return boundInline(element, xctName);
        }

        String labelText = labelText(element);
        if (labelText != null) {
            Control label = new Control();
            label.kind = ControlKind.LABEL;
            label.type = ControlKind.LABEL.getDisplayName();
            label.label = labelText;
            label.binding = "";
            copySpans(element, label);
            return label;
        }

        boolean activeX = name.equals("object") || name.equals("embed");
        if (!xctName.isEmpty() && !STRUCTURAL_XCT_NAMES.contains(xctName.toLowerCase(Locale.ROOT))) {
            // object elements keep their binding and id in param children
            return activeX ? activeXControl(element) : xctControl(element, xctName);
        }
        if (NATIVE_ELEMENTS.contains(name)) {
            return nativeControl(element);
        }
        if (activeX) {
            return activeXControl(element);
        }
        if (!binding.isEmpty()) {
            return genericBound(element);
        }
        return null;
    }

    private Control boundInline(Element element, String xctName) {
        ControlKind kind = null;
        String type = null;
        if (!xctName.isEmpty()) {
            kind = ControlTypeMapper.fromXctName(xctName);
            type = ControlTypeMapper.typeFromXctName(xctName);
        }
        if (kind == null || kind == ControlKind.OTHER) {
            ControlKind byClass = ControlTypeMapper.fromClass(DomHelper.attr(element, "class"));
            if (byClass != null) {
                kind = byClass;
                type = byClass.getDisplayName();
            }
        }
        if (kind == null) {
            kind = ControlKind.OTHER;
            type = DomHelper.localName(element);
        }
        Control control = newControl(element, kind, type);
        if (kind.isChoice()) {
            extractOptions(element, control);
        }
        return control;
    }

    private Control xctControl(Element element, String xctName) {
        ControlKind kind = ControlTypeMapper.fromXctName(xctName);
        Control control = newControl(element, kind, ControlTypeMapper.typeFromXctName(xctName));
        if (kind.isChoice() || DomHelper.isNamed(element, "select")) {
            extractOptions(element, control);
        }
        if (DomHelper.isNamed(element, "input")) {
            applyInputDefaults(element, control);
        }
        return control;
    }

    private Control nativeControl(Element element) {
        String name = DomHelper.localName(element);
        ControlKind kind;
        if (name.equals("select")) {
            kind = ControlKind.DROP_DOWN;
        } else if (name.equals("textarea")) {
            kind = ControlKind.RICH_TEXT;
        } else {
            kind = ControlTypeMapper.fromInputType(DomHelper.attr(element, "type"));
        }
        Control control = newControl(element, kind, kind.getDisplayName());
        if (name.equals("select")) {
            extractOptions(element, control);
        } else if (name.equals("input")) {
            applyInputDefaults(element, control);
        }
        return control;
    }

    private Control activeXControl(Element element) {
        String classId = DomHelper.firstNonEmptyAttr(element, "xctname", "classid");
        String normalized = classId.replaceFirst("(?i)^clsid:", "");
        ControlKind kind = normalized.toLowerCase(Locale.ROOT).contains(ControlTypeMapper.PEOPLE_PICKER_CLASSID)
                ? ControlKind.PEOPLE_PICKER : ControlKind.ACTIVE_X;
        String type = kind == ControlKind.PEOPLE_PICKER ? kind.getDisplayName() : "ActiveX-" + normalized;
        if (normalized.isEmpty() && kind == ControlKind.ACTIVE_X) {
            type = kind.getDisplayName();
        }

        Control control = newControl(element, kind, type);
        for (Element param : DomHelper.descendants(element)) {
            if (!DomHelper.isNamed(param, "param")) continue;
            String name = DomHelper.attr(param, "name");
            String value = DomHelper.attr(param, "value");
            if (name.isEmpty() || value.isEmpty()) continue;
            if (name.equalsIgnoreCase("CtrlId")) {
                control.properties.putIfAbsent("CtrlId", value);
            } else if (name.equalsIgnoreCase("binding")) {
                if (control.binding.isEmpty()) control.binding = value;
            } else {
                control.properties.putIfAbsent(name, value);
            }
        }
        return control;
    }

    private Control genericBound(Element element) {
        ControlKind kind = ControlTypeMapper.fromClass(DomHelper.attr(element, "class"));
        String type;
        if (kind != null) {
            type = kind.getDisplayName();
        } else {
            kind = ControlKind.OTHER;
            type = DomHelper.localName(element);
        }
        Control control = newControl(element, kind, type);
        if (kind.isChoice()) {
            extractOptions(element, control);
        }
        return control;
    }

    private Control newControl(Element element, ControlKind kind, String type) {
        Control control = new Control();
        control.kind = kind;
        control.type = type;
        control.label = DomHelper.attr(element, "title");
        control.binding = DomHelper.attr(element, "binding");

        String ctrlId = DomHelper.attr(element, "CtrlId");
        if (!ctrlId.isEmpty()) {
            control.properties.put("CtrlId", ctrlId);
        }
        for (Attr attr : DomHelper.attributes(element)) {
            String attrName = DomHelper.attributeLocalName(attr);
            if (!SKIPPED_ATTRIBUTES.contains(attrName.toLowerCase(Locale.ROOT))) {
                control.properties.put(attrName, attr.getValue());
            }
        }
        copySpans(element, control);
        return control;
    }

    private void copySpans(Element element, Control control) {
        Element cell = element;
        while (cell != null && !DomHelper.isNamed(cell, "td") && !DomHelper.isNamed(cell, "th")) {
            cell = DomHelper.parentElement(cell);
        }
        if (cell == null) return;
        control.columnSpan = Math.max(1, ElementClassifier.parseSpan(DomHelper.attr(cell, "colspan")));
        control.rowSpan = Math.max(1, ElementClassifier.parseSpan(DomHelper.attr(cell, "rowspan")));
    }

    // --- options ---

    private void extractOptions(Element element, Control control) {
        List<ChoiceOption> options = new ArrayList<>();
        int order = 0;
        for (Element option : DomHelper.descendants(element)) {
            if (!DomHelper.isNamed(option, "option")) continue;
            String value = DomHelper.attr(option, "value");
            String text = DomHelper.normalizeInline(option.getTextContent());
            if (text.isEmpty()) text = value;
            options.add(new ChoiceOption(value, text, DomHelper.hasAttr(option, "selected"), order++));
        }
        setOptions(control, options);
    }

    private void applyInputDefaults(Element input, Control control) {
        String type = DomHelper.attr(input, "type").toLowerCase(Locale.ROOT);
        if (type.equals("radio")) {
            extractRadioOptions(input, control);
        } else if (type.equals("checkbox")) {
            control.properties.put("DefaultValue", String.valueOf(DomHelper.hasAttr(input, "checked")));
        }
        String value = DomHelper.attr(input, "value");
        if (!value.isEmpty()) {
            control.properties.putIfAbsent("DefaultValue", value);
        }
    }

    private void extractRadioOptions(Element radio, Control control) {
        String groupName = DomHelper.attr(radio, "name");
        if (groupName.isEmpty()) return;

        Element container = DomHelper.parentElement(radio);
        while (container != null && !DomHelper.isNamed(container, "div") && !DomHelper.isNamed(container, "td")) {
            container = DomHelper.parentElement(container);
        }
        if (container == null) container = DomHelper.parentElement(radio);
        if (container == null) return;

        List<ChoiceOption> options = new ArrayList<>();
        int order = 0;
        for (Element candidate : DomHelper.descendants(container)) {
            if (!DomHelper.isNamed(candidate, "input")
                    || !DomHelper.attr(candidate, "type").equalsIgnoreCase("radio")
                    || !groupName.equals(DomHelper.attr(candidate, "name"))) {
                continue;
            }
            String value = DomHelper.attr(candidate, "value");
            options.add(new ChoiceOption(value, radioText(candidate, value), DomHelper.hasAttr(candidate, "checked"), order++));
        }
        setOptions(control, options);
        if (DomHelper.hasAttr(radio, "checked")) {
            control.properties.putIfAbsent("DefaultValue", DomHelper.attr(radio, "value"));
        }
    }

    private String radioText(Element radio, String fallback) {
        String title = DomHelper.attr(radio, "title");
        if (!title.isEmpty()) return title;
        for (Node next = radio.getNextSibling(); next != null; next = next.getNextSibling()) {
            String text;
            if (next.getNodeType() == Node.ELEMENT_NODE) {
                Element sibling = (Element) next;
                if (DomHelper.isNamed(sibling, "input")) break;
                text = DomHelper.normalizeInline(sibling.getTextContent());
            } else if (next.getNodeType() == Node.TEXT_NODE) {
                text = DomHelper.normalizeInline(next.getNodeValue());
            } else {
                continue;
            }
            if (!text.isEmpty()) return text;
        }
        return fallback;
    }

    private void setOptions(Control control, List<ChoiceOption> options) {
        if (options.isEmpty()) return;
        control.choiceOptions = options;
        control.properties.put("DataValues",
                options.stream().map(o -> o.displayText).collect(Collectors.joining(", ")));
        options.stream().filter(o -> o.isDefault).findFirst()
                .ifPresent(o -> control.properties.put("DefaultValue", o.value));
    }

    // --- labels ---

    /**
     * Text of a label-only element, or null when the element is not one.
     */
    static String labelText(Element element) {
        String name = DomHelper.localName(element);
        boolean eligible = LABEL_ELEMENTS.contains(name)
                || (TEXT_CELL_ELEMENTS.contains(name) && DomHelper.hasOwnText(element));
        if (!eligible || ElementClassifier.hasControlMarker(element)) return null;
        if (DomHelper.anyDescendant(element, ControlExtractor::isControlElement)) return null;

        String text = DomHelper.normalizeInline(DomHelper.directText(element));
        if (text.isEmpty()) {
            text = DomHelper.normalizeInline(DomHelper.attr(element, "title"));
        }
        return text.length() > 1 ? text : null;
    }

    static boolean isControlElement(Element element) {
        String name = DomHelper.localName(element);
        return ElementClassifier.hasControlMarker(element)
                || NATIVE_ELEMENTS.contains(name)
                || name.equals("object")
                || name.equals("embed");
    }

    /**
     * Upper-cased letters and digits of the text, used as a control name.
     */
    static String sanitizeName(String text) {
        if (text == null) return "";
        return text.replaceAll("[^a-zA-Z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
