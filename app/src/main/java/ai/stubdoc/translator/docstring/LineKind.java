package ai.stubdoc.translator.docstring;

/**
 * Structural role of a single docstring line.
 */
public enum LineKind {
    BLANK,
    SECTION_DECORATION,
    LIST_ITEM,
    LIST_TABLE_ITEM,
    PLAIN
}
