package org.dxworks.formframe.analyzer;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

public class DomHelper {

    public static final String XSL_NAMESPACE = "http://www.w3.org/1999/XSL/Transform";

    private static final String[] INLINE_TEXT_ELEMENTS = {"strong", "em", "font", "span", "b", "i", "u"};

    /**
     * Lower-cased local name, without any namespace prefix.
     */
    public static String localName(Element element) {
        if (element == null) return "";
        String name = element.getLocalName();
        if (name == null) {
            name = element.getTagName();
            int colon = name.indexOf(':');
            if (colon >= 0) {
                name = name.substring(colon + 1);
            }
        }
        return name.toLowerCase(Locale.ROOT);
    }

    public static boolean isNamed(Element element, String localName) {
        return localName(element).equals(localName);
    }

    /**
     * True when the element belongs to the XSLT namespace, or carries the conventional
     * {@code xsl:} prefix in documents parsed without namespace awareness.
     */
    public static boolean isXsl(Element element, String localName) {
        if (element == null || !isNamed(element, localName)) return false;
        if (XSL_NAMESPACE.equals(element.getNamespaceURI())) return true;
        return element.getTagName().startsWith("xsl:");
    }

    /**
     * Attribute value matched by local name, ignoring case and namespace prefix
     * ({@code xd:CtrlId} and {@code ctrlid} both match {@code "CtrlId"}). Never null.
     */
    public static String attr(Element element, String localName) {
        Attr attr = findAttr(element, localName);
        return attr == null ? "" : attr.getValue();
    }

    public static boolean hasAttr(Element element, String localName) {
        return findAttr(element, localName) != null;
    }

    public static String firstNonEmptyAttr(Element element, String... localNames) {
        for (String name : localNames) {
            String value = attr(element, name);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static Attr findAttr(Element element, String localName) {
        if (element == null) return null;
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (attributeLocalName(attr).equalsIgnoreCase(localName)) {
                return attr;
            }
        }
        return null;
    }

    public static String attributeLocalName(Attr attr) {
        String name = attr.getLocalName();
        if (name == null) {
            name = attr.getName();
            int colon = name.indexOf(':');
            if (colon >= 0) {
                name = name.substring(colon + 1);
            }
        }
        return name;
    }

    public static List<Attr> attributes(Element element) {
        List<Attr> result = new ArrayList<>();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            String name = attr.getName();
            if (name.equals("xmlns") || name.startsWith("xmlns:")) continue;
            result.add(attr);
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        if (parent == null) return children;
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) child);
            }
        }
        return children;
    }

    /**
     * All descendant elements in document order, excluding the element itself.
     */
    public static List<Element> descendants(Element parent) {
        List<Element> result = new ArrayList<>();
        collectDescendants(parent, result);
        return result;
    }

    private static void collectDescendants(Element parent, List<Element> result) {
        for (Element child : childElements(parent)) {
            result.add(child);
            collectDescendants(child, result);
        }
    }

    public static Element firstDescendant(Element parent, Predicate<Element> predicate) {
        if (parent == null) return null;
        for (Element child : childElements(parent)) {
            if (predicate.test(child)) {
                return child;
            }
            Element nested = firstDescendant(child, predicate);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    public static boolean anyDescendant(Element parent, Predicate<Element> predicate) {
        return firstDescendant(parent, predicate) != null;
    }

    public static Element firstChild(Element parent, Predicate<Element> predicate) {
        for (Element child : childElements(parent)) {
            if (predicate.test(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Text of the element's own text nodes plus the text of nested inline formatting
     * elements; text inside any other child element is ignored.
     */
    public static String directText(Element element) {
        StringBuilder sb = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            short type = node.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                sb.append(node.getNodeValue());
            } else if (type == Node.ELEMENT_NODE && isInlineTextElement((Element) node)) {
                sb.append(directText((Element) node));
            }
        }
        return sb.toString();
    }

    /**
     * True when at least one immediate text node carries non-whitespace text.
     */
    public static boolean hasOwnText(Element element) {
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            short type = node.getNodeType();
            if ((type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) && !node.getNodeValue().isBlank()) {
                return true;
            }
        }
        return false;
    }

    public static boolean isInlineTextElement(Element element) {
        String name = localName(element);
        for (String inline : INLINE_TEXT_ELEMENTS) {
            if (inline.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collapse all whitespace to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static Element parentElement(Element element) {
        Node parent = element.getParentNode();
        return parent != null && parent.getNodeType() == Node.ELEMENT_NODE ? (Element) parent : null;
    }
}
