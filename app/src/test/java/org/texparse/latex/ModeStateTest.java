package org.texparse.latex;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class ModeStateTest {
    @Test void textIsTheOnlyInitialMode() {
        var state = new ModeState();
        assertTrue(state.isOn(Mode.TEXT));
        assertFalse(state.isOn(Mode.MATH));
        assertEquals(
            "{ LIST: false, MATH: false, PICTURE: false, TABLE: false, TEXT: true, VERTICAL: false }",
            state.toString());
    }

    @Test void testChecksOnlyListedModes() {
        var state = new ModeState(Map.of(Mode.MATH, true));

        assertTrue(state.test(Map.of()));
        assertTrue(state.test(Map.of(Mode.MATH, true)));
        assertTrue(state.test(Map.of(Mode.MATH, true, Mode.LIST, false)));
        assertFalse(state.test(Map.of(Mode.MATH, true, Mode.TEXT, false)));
        assertFalse(state.test(Map.of(Mode.LIST, true)));
    }

    @Test void copiesAreIndependent() {
        var state = new ModeState();
        var copy = state.copy();
        copy.update(Map.of(Mode.TABLE, true));

        assertFalse(state.isOn(Mode.TABLE));
        assertTrue(copy.isOn(Mode.TABLE));
        assertNotEquals(state, copy);
        assertEquals(state, new ModeState());
    }

    @Test void operationsRender() {
        assertEquals("BEGIN GROUP", Operation.beginGroup().toString());
        assertEquals("END MATH", Operation.end(Mode.MATH).toString());
        assertTrue(Operation.endGroup().isGroup());
        assertFalse(Operation.begin(Mode.LIST).isGroup());
    }
}
