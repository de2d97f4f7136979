package org.texparse.latex.tree;

public enum TokenKind {
    DOCUMENT,
    SYMBOL,
    COMMAND,
    PARAMETER,
    ENVIRONMENT,
    ENVIRONMENT_BODY,
    SPACE,
    SOURCE
}
