package org.texparse.latex.syntax;

import java.util.List;

import org.texparse.latex.ModeState;

/**
 * Candidate lookup for the parser. Every list holds only definitions that
 * apply in {@code state}, highest priority first.
 */
public interface SyntaxRegistry {
    List<SymbolSyntax> symbolsFor(ModeState state, String firstChar);

    List<CommandSyntax> commandsFor(ModeState state, String name);

    List<EnvironmentSyntax> environmentsFor(ModeState state, String name);
}
