package org.texparse.latex;

/** What a parsed unit means to a renderer. */
public enum Lexeme {
    BINARY_OPERATOR,
    BRACKETS,
    CAPTION,
    CELL_SEPARATOR,
    CHAR,
    DIGIT,
    DIRECTIVE,
    DISPLAY_EQUATION,
    FLOATING_BOX,
    GRAPHICS,
    HEADING,
    HORIZONTAL_SKIP,
    INLINE_EQUATION,
    LABEL,
    LENGTH,
    LETTER,
    LINE_BREAK,
    LIST_ITEM,
    LIST,
    NUMBER,
    PARAGRAPH_SEPARATOR,
    POST_OPERATOR,
    PRE_OPERATOR,
    PUNCTUATION,
    RAW,
    SPACE,
    SUBSCRIPT,
    SUPERSCRIPT,
    TABLE,
    TABULAR_PARAMETERS,
    TAG,
    UNKNOWN,
    URL,
    VERTICAL_SKIP,
    WORD,
    WRAPPER
}
