package org.texparse.latex.syntax;

import java.util.List;

/** Definitions loaded and unloaded together. */
public record SyntaxPackage(
    List<SymbolSyntax> symbols,
    List<CommandSyntax> commands,
    List<EnvironmentSyntax> environments
) {
    public SyntaxPackage {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        commands = commands == null ? List.of() : List.copyOf(commands);
        environments = environments == null ? List.of() : List.copyOf(environments);
    }
}
