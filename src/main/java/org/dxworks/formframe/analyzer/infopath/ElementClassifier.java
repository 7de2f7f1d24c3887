package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.analyzer.DomHelper;
import org.w3c.dom.Element;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns exactly one {@link ElementKind} to an element. Pure: looks at the element,
 * the walk context and the table-row flag, never changes anything.
 */
final class ElementClassifier {

    private static final Set<String> CAPTION_ELEMENTS =
            Set.of("strong", "font", "b", "em", "div", "h1", "h2", "h3", "h4", "h5", "h6");

    private static final Pattern BORDER_TOP = Pattern.compile("border-top\\s*:\\s*([^;\"]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEAVY_WIDTH = Pattern.compile("(?<![\\d.])(2|2\\.25|3)pt\\b");

    static final int MIN_CAPTION_LENGTH = 3;
    static final int MAX_CAPTION_LENGTH = 50;

    ElementKind classify(Element element, WalkContext ctx, ParserState state) {
        if (isRepeatingSectionContainer(element)) return ElementKind.REPEATING_SECTION;

        if (DomHelper.isXsl(element, "template") && DomHelper.hasAttr(element, "mode")) {
            return ElementKind.MODED_TEMPLATE;
        }
        if (DomHelper.isXsl(element, "apply-templates") && DomHelper.hasAttr(element, "mode")) {
            return ElementKind.MODED_APPLY_TEMPLATES;
        }
        if (ctx.inTemplate() && DomHelper.isXsl(element, "if")) {
            return ElementKind.CONDITIONAL_FRAGMENT;
        }
        if (!ctx.inTemplate() && captionText(element) != null) {
            return ElementKind.CAPTION;
        }
        if (isRowBreak(element, state.inTableRow)) return ElementKind.ROW_BREAK;

        return classifyLayout(element);
    }

    /**
     * Rules that still apply once a row break has been taken into account.
     */
    ElementKind classifyLayout(Element element) {
        if (isPlaceholder(element)) return ElementKind.PLACEHOLDER;
        if (isPlainSection(element)) return ElementKind.SECTION;
        if (isRepeatingTable(element)) return ElementKind.REPEATING_TABLE;
        return ElementKind.CONTROL_CANDIDATE;
    }

    static boolean isRepeatingSectionContainer(Element element) {
        if (DomHelper.localName(element).equals("table")) return false;
        if (isXslElement(element)) return false;
        if (DomHelper.attr(element, "class").contains("xdRepeatingSection")) return true;
        if (DomHelper.attr(element, "xctname").equalsIgnoreCase("RepeatingSection")) return true;
        Element apply = DomHelper.firstChild(element, c -> DomHelper.isXsl(c, "apply-templates"));
        return apply != null && DomHelper.hasAttr(apply, "mode") && DomHelper.attr(apply, "select").contains("/");
    }

    /**
     * Section container as seen from a conditional fragment: an {@code xctname} of
     * {@code Section} or an {@code xdSection} class.
     */
    static boolean isSectionContainer(Element element) {
        return DomHelper.attr(element, "xctname").equalsIgnoreCase("Section")
                || DomHelper.attr(element, "class").contains("xdSection");
    }

    static boolean isPlainSection(Element element) {
        String className = DomHelper.attr(element, "class");
        if (className.contains("xdSection") && !className.contains("xdRepeating")) return true;
        String xctName = DomHelper.attr(element, "xctname");
        return xctName.equalsIgnoreCase("Section") || xctName.equalsIgnoreCase("OptionalSection");
    }

    static boolean isPlaceholder(Element element) {
        return DomHelper.attr(element, "class").contains("optionalPlaceholder")
                || DomHelper.attr(element, "action").equals("xCollection::insert");
    }

    static boolean isRepeatingTable(Element element) {
        if (!DomHelper.isNamed(element, "table")) return false;
        if (DomHelper.attr(element, "class").contains("xdRepeatingTable")) return true;
        if (DomHelper.attr(element, "xctname").equalsIgnoreCase("RepeatingTable")) return true;
        Element body = DomHelper.firstChild(element, c -> DomHelper.isNamed(c, "tbody")
                && (DomHelper.hasAttr(c, "repeating")
                || DomHelper.attr(c, "xctname").equalsIgnoreCase("RepeatingTable")));
        return body != null;
    }

    static boolean isRowBreak(Element element, boolean inTableRow) {
        String name = DomHelper.localName(element);
        String className = DomHelper.attr(element, "class");

        if (name.equals("tr") || name.equals("hr")) return true;
        if (name.equals("div") && (className.contains("xdSection") || className.contains("xdRepeatingSection"))) {
            return true;
        }
        if ((name.equals("td") || name.equals("th")) && !inTableRow && parseSpan(DomHelper.attr(element, "colspan")) > 2) {
            return true;
        }
        if (name.equals("img") && DomHelper.attr(element, "src").toLowerCase(Locale.ROOT).contains("line")) {
            return true;
        }
        if (hasHeavyTopBorder(DomHelper.attr(element, "style"))) return true;
        return className.contains("xdTableHeader") || className.contains("xdHeadingRow") || className.contains("xdTitleRow");
    }

    static boolean hasHeavyTopBorder(String style) {
        if (style == null || style.isEmpty()) return false;
        Matcher m = BORDER_TOP.matcher(style);
        while (m.find()) {
            String value = m.group(1).toLowerCase(Locale.ROOT);
            if (value.contains("solid") && HEAVY_WIDTH.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Caption text of a bare formatting element, or null when the element is not a caption.
     */
    static String captionText(Element element) {
        if (!CAPTION_ELEMENTS.contains(DomHelper.localName(element))) return null;
        if (hasControlMarker(element) || DomHelper.attr(element, "class").contains("xd")) return null;
        for (Element d : DomHelper.descendants(element)) {
            if (!DomHelper.isInlineTextElement(d) || hasControlMarker(d)) {
                return null;
            }
        }
        String text = DomHelper.normalizeInline(DomHelper.directText(element));
        if (text.length() < MIN_CAPTION_LENGTH || text.length() > MAX_CAPTION_LENGTH || text.endsWith(":")) {
            return null;
        }
        return text;
    }

    static boolean hasControlMarker(Element element) {
        return DomHelper.hasAttr(element, "binding") || DomHelper.hasAttr(element, "xctname");
    }

    static boolean isXslElement(Element element) {
        return DomHelper.XSL_NAMESPACE.equals(element.getNamespaceURI()) || element.getTagName().startsWith("xsl:");
    }

    static int parseSpan(String value) {
        if (value == null || value.isBlank()) return 1;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
