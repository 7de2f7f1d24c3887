package org.dxworks.formframe.analyzer.infopath;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field extraction from {@code xsl:if} test expressions.
 *
 * <p>A field reference is a prefixed name ({@code my:isRoundTrip}). Prefixes of the
 * InfoPath function libraries ({@code xdXDocument:}, {@code xdMath:}, ...) and the
 * XSLT namespaces are not fields, nor is anything followed by an argument list.</p>
 */
public final class ConditionExpressions {

    private static final String PREFIX = "(?<![\\w:.-])(?!xd|xsl:|msxsl:)[A-Za-z][\\w-]*:";
    private static final String FIELD = PREFIX + "([A-Za-z_][\\w]*)(?![\\w-]*\\s*\\()";

    static final Pattern FIELD_REFERENCE = Pattern.compile(FIELD);

    private static final List<Pattern> SECTION_NAME_PATTERNS = List.of(
            Pattern.compile(FIELD + "\\s*="),
            Pattern.compile(FIELD + "\\s*!="),
            Pattern.compile("\\.\\./" + FIELD),
            Pattern.compile("not\\(.*?" + FIELD + ".*\\)"),
            Pattern.compile("boolean\\(" + FIELD + "\\)")
    );

    private static final Pattern CONTAINS_LITERAL =
            Pattern.compile("contains\\([^,]+,\\s*[\"']([^\"']+)[\"']\\)");

    private static final String[] BOOLEAN_PREFIXES = {"is", "has", "should", "can", "will"};

    private ConditionExpressions() {
        // utility class
    }

    /**
     * First field referenced by the expression, without prefix; empty when none.
     */
    public static String conditionField(String test) {
        if (test == null) return "";
        Matcher m = FIELD_REFERENCE.matcher(test);
        return m.find() ? m.group(1) : "";
    }

    /**
     * First quoted literal passed to a {@code contains(...)} call; empty when none.
     */
    public static String conditionValue(String test) {
        if (test == null) return "";
        Matcher m = CONTAINS_LITERAL.matcher(test);
        return m.find() ? m.group(1) : "";
    }

    /**
     * Field named by the first matching section-name pattern, or null.
     */
    public static String sectionField(String test) {
        if (test == null || test.isBlank()) return null;
        for (Pattern pattern : SECTION_NAME_PATTERNS) {
            Matcher m = pattern.matcher(test);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }

    public static boolean referencesParentContext(String test) {
        return test != null && test.contains("../");
    }

    /**
     * {@code isRoundTrip} becomes {@code Round Trip}.
     */
    public static String toReadableFieldName(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) return fieldName;

        String name = fieldName;
        for (String prefix : BOOLEAN_PREFIXES) {
            if (name.startsWith(prefix) && name.length() > prefix.length()
                    && Character.isUpperCase(name.charAt(prefix.length()))) {
                name = name.substring(prefix.length());
                break;
            }
        }
        return BindingPaths.toReadable(name);
    }
}
