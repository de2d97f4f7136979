package org.texparse.latex.tree;

import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.latex.syntax.EnvironmentSyntax;

/**
 * {@code \begin{name} ... \end{name}}. Children, in order: begin command,
 * body, end command; the tail is missing when the environment is cut short.
 */
public final class EnvironmentToken extends LatexToken {
    private final EnvironmentSyntax environment;
    private final String name;

    public EnvironmentToken(EnvironmentSyntax environment) {
        this.environment = environment;
        this.name = environment.name();
    }

    /** Unrecognized environment. */
    public EnvironmentToken(String name) {
        this.environment = null;
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Optional<EnvironmentSyntax> environment() {
        return Optional.ofNullable(environment);
    }

    public boolean isRecognized() {
        return environment != null;
    }

    public Optional<CommandToken> beginCommand() {
        return commandAt(0);
    }

    public Optional<EnvironmentBodyToken> body() {
        return childAt(1) instanceof EnvironmentBodyToken body ? Optional.of(body) : Optional.empty();
    }

    public Optional<CommandToken> endCommand() {
        return commandAt(2);
    }

    public boolean isTerminated() {
        return endCommand().isPresent();
    }

    private Optional<CommandToken> commandAt(int index) {
        return childAt(index) instanceof CommandToken command ? Optional.of(command) : Optional.empty();
    }

    @Override
    public TokenKind kind() {
        return TokenKind.ENVIRONMENT;
    }

    @Override
    public Optional<Lexeme> lexeme() {
        return environment == null ? Optional.of(Lexeme.UNKNOWN) : environment.lexeme();
    }

    @Override
    public String toSource() {
        var sb = new StringBuilder("\\begin{").append(name).append('}');
        beginCommand().ifPresent(command -> sb.append(command.patternSource()));
        body().ifPresent(body -> sb.append(body.toSource()));
        endCommand().ifPresent(command ->
            sb.append("\\end{").append(name).append('}').append(command.patternSource()));
        return sb.toString();
    }
}
