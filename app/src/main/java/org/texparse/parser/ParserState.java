package org.texparse.parser;

/** State carried by a parsing context; copied whenever the context is. */
public interface ParserState<S extends ParserState<S>> {
    S copy();
}
