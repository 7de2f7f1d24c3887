package org.dxworks.formframe.analyzer.infopath;

/**
 * Structural role of a view element, in the priority order the walker tests them.
 */
enum ElementKind {
    REPEATING_SECTION,
    MODED_TEMPLATE,
    MODED_APPLY_TEMPLATES,
    CONDITIONAL_FRAGMENT,
    CAPTION,
    ROW_BREAK,
    PLACEHOLDER,
    SECTION,
    REPEATING_TABLE,
    CONTROL_CANDIDATE
}
