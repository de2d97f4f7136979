package org.texparse.latex;

/** Document modes gating which definitions apply. */
public enum Mode {
    LIST,
    MATH,
    PICTURE,
    TABLE,
    TEXT,
    VERTICAL
}
