package org.texparse.latex.parser;

/** What the parser takes next at the cursor. */
public enum ParseStep {
    COMMAND,
    PARAMETER,
    SOURCE,
    ENVIRONMENT_BODY,
    ENVIRONMENT,
    SYMBOL
}
