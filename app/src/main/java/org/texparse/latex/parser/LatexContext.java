package org.texparse.latex.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.ModeState;
import org.texparse.latex.Operation;
import org.texparse.latex.syntax.ParameterSyntax;
import org.texparse.latex.tree.LatexToken;
import org.texparse.parser.ParsingContext;

/**
 * Parsing context with the values one LaTeX step hands to the next. Each
 * pending value is set at most once and cleared by the step that takes it.
 */
public class LatexContext extends ParsingContext<LatexToken, ModeState> {

    /** Command name the next step must parse; implicit ones are not reported when unknown. */
    record PendingCommand(String name, boolean implicit) {}

    private Lexeme lexeme;
    private PendingCommand command;
    private ParameterSyntax parameter;
    private String environmentName;
    private List<String> comments;

    public LatexContext(String source) {
        this(source, new ModeState());
    }

    public LatexContext(String source, ModeState initialState) {
        super(source, initialState);
        comments = new ArrayList<>();
    }

    protected LatexContext(LatexContext other) {
        super(other);
        copyPending(other, this);
    }

    @Override
    public LatexContext copy() {
        return new LatexContext(this);
    }

    @Override
    public void copyInto(ParsingContext<LatexToken, ModeState> target) {
        if (!(target instanceof LatexContext latexTarget)) {
            throw new IllegalArgumentException("target is not a LaTeX context");
        }
        super.copyInto(target);
        copyPending(this, latexTarget);
    }

    private static void copyPending(LatexContext from, LatexContext to) {
        to.lexeme = from.lexeme;
        to.command = from.command;
        to.parameter = from.parameter;
        to.environmentName = from.environmentName;
        to.comments = new ArrayList<>(from.comments);
    }

    /* Pending values */

    public Optional<Lexeme> lexeme() {
        return Optional.ofNullable(lexeme);
    }

    public void setLexeme(Lexeme value) {
        lexeme = setOnce(lexeme, value, "lexeme");
    }

    public Lexeme takeLexeme() {
        Lexeme value = lexeme;
        lexeme = null;
        return value;
    }

    public Optional<String> commandName() {
        return Optional.ofNullable(command).map(PendingCommand::name);
    }

    public void setCommandName(String name) {
        setCommand(name, false);
    }

    void setCommand(String name, boolean implicit) {
        if (name == null) {
            throw new IllegalArgumentException("command name is null");
        }
        command = setOnce(command, new PendingCommand(name, implicit), "command name");
    }

    PendingCommand takeCommand() {
        PendingCommand value = command;
        command = null;
        return value;
    }

    public Optional<ParameterSyntax> parameter() {
        return Optional.ofNullable(parameter);
    }

    public void setParameter(ParameterSyntax value) {
        parameter = setOnce(parameter, value, "parameter");
    }

    public ParameterSyntax takeParameter() {
        ParameterSyntax value = parameter;
        parameter = null;
        return value;
    }

    public Optional<String> environmentName() {
        return Optional.ofNullable(environmentName);
    }

    public void setEnvironmentName(String name) {
        environmentName = setOnce(environmentName, name, "environment name");
    }

    public String takeEnvironmentName() {
        String value = environmentName;
        environmentName = null;
        return value;
    }

    private static <V> V setOnce(V current, V value, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " is null");
        }
        if (current != null) {
            throw new IllegalStateException(what + " is already set: " + current);
        }
        return value;
    }

    /* Comments */

    public List<String> comments() {
        return Collections.unmodifiableList(comments);
    }

    public void addComment(String comment) {
        comments.add(comment);
    }

    /* Modes */

    /**
     * Applies mode operations in order. Mode changes are collected and only
     * written when a group opens or the list ends; closing a group drops the
     * changes collected so far.
     *
     * @return false if a group was closed that was never opened
     */
    public boolean updateState(List<Operation> operations) {
        var changes = new EnumMap<Mode, Boolean>(Mode.class);
        boolean balanced = true;
        for (Operation operation : operations) {
            switch (operation.directive()) {
                case BEGIN -> {
                    if (operation.isGroup()) {
                        state().update(changes);
                        changes.clear();
                        pushState();
                    } else {
                        changes.put(operation.mode(), true);
                    }
                }
                case END -> {
                    if (operation.isGroup()) {
                        changes.clear();
                        balanced &= popState();
                    } else {
                        changes.put(operation.mode(), false);
                    }
                }
            }
        }
        state().update(changes);
        return balanced;
    }
}
