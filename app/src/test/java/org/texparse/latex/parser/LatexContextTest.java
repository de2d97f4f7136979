package org.texparse.latex.parser;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.texparse.latex.Lexeme;
import org.texparse.latex.Mode;
import org.texparse.latex.ModeState;
import org.texparse.latex.Operation;
import org.texparse.latex.syntax.ParameterSyntax;

class LatexContextTest {
    @Test void modeChangesApply() {
        var context = new LatexContext("");
        assertTrue(context.updateState(List.of(Operation.begin(Mode.MATH), Operation.end(Mode.TEXT))));
        assertTrue(context.state().isOn(Mode.MATH));
        assertFalse(context.state().isOn(Mode.TEXT));
    }

    @Test void groupRestoresModes() {
        var context = new LatexContext("");
        context.updateState(List.of(Operation.beginGroup(), Operation.end(Mode.TEXT), Operation.begin(Mode.MATH)));
        assertTrue(context.state().isOn(Mode.MATH));
        assertEquals(1, context.stateDepth());

        assertTrue(context.updateState(List.of(Operation.endGroup())));
        assertEquals(new ModeState(), context.state());
        assertEquals(0, context.stateDepth());
    }

    @Test void changesBeforeGroupAreSaved() {
        var context = new LatexContext("");
        context.updateState(List.of(Operation.begin(Mode.LIST), Operation.beginGroup(), Operation.begin(Mode.MATH)));
        context.updateState(List.of(Operation.endGroup()));

        assertTrue(context.state().isOn(Mode.LIST));
        assertFalse(context.state().isOn(Mode.MATH));
    }

    @Test void changesBeforeGroupEndAreDropped() {
        var context = new LatexContext("");
        context.updateState(List.of(Operation.beginGroup()));
        context.updateState(List.of(Operation.begin(Mode.MATH), Operation.endGroup()));

        assertFalse(context.state().isOn(Mode.MATH));
    }

    @Test void unbalancedGroupIsReported() {
        var context = new LatexContext("");
        assertFalse(context.updateState(List.of(Operation.endGroup(), Operation.begin(Mode.VERTICAL))));
        assertTrue(context.state().isOn(Mode.VERTICAL));
    }

    @Test void pendingValuesAreSetOnce() {
        var context = new LatexContext("x");
        context.setCommandName("section");
        context.setLexeme(Lexeme.URL);
        context.setParameter(ParameterSyntax.plain());
        context.setEnvironmentName("document");

        assertThrows(IllegalStateException.class, () -> context.setCommandName("other"));
        assertThrows(IllegalStateException.class, () -> context.setLexeme(Lexeme.RAW));
        assertThrows(IllegalStateException.class, () -> context.setParameter(ParameterSyntax.plain()));
        assertThrows(IllegalStateException.class, () -> context.setEnvironmentName("other"));

        assertEquals("section", context.takeCommand().name());
        assertEquals(Lexeme.URL, context.takeLexeme());
        assertEquals(ParameterSyntax.plain(), context.takeParameter());
        assertEquals("document", context.takeEnvironmentName());
        assertTrue(context.commandName().isEmpty());
        assertNull(context.takeLexeme());
        context.setCommandName("other");
    }

    @Test void copiesCarryPendingValuesAndComments() {
        var context = new LatexContext("x");
        context.setEnvironmentName("document");
        context.addComment(" one");
        context.updateState(List.of(Operation.beginGroup(), Operation.begin(Mode.MATH)));

        var copy = context.copy();
        context.takeEnvironmentName();
        context.addComment(" two");
        context.updateState(List.of(Operation.endGroup()));

        assertEquals("document", copy.environmentName().get());
        assertEquals(List.of(" one"), copy.comments());
        assertTrue(copy.state().isOn(Mode.MATH));
        assertEquals(1, copy.stateDepth());

        copy.copyInto(context);
        assertEquals("document", context.environmentName().get());
        assertEquals(List.of(" one"), context.comments());
        assertTrue(context.state().isOn(Mode.MATH));
    }
}
