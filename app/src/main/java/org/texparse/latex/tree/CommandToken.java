package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.syntax.CommandSyntax;

public final class CommandToken extends SymbolToken {
    private final String name;

    public CommandToken(CommandSyntax command) {
        super(command);
        this.name = command.name();
    }

    /** Unrecognized command. */
    public CommandToken(String name) {
        super();
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Optional<CommandSyntax> command() {
        return symbol().map(CommandSyntax.class::cast);
    }

    @Override
    public TokenKind kind() {
        return TokenKind.COMMAND;
    }

    @Override
    public String toSource() {
        return "\\" + name + patternSource();
    }
}
