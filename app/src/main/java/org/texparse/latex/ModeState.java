package org.texparse.latex;

import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.texparse.parser.ParserState;

/** Current value of every {@link Mode}. TEXT starts on, the rest off. */
public final class ModeState implements ParserState<ModeState> {
    private final EnumMap<Mode, Boolean> modes = new EnumMap<>(Mode.class);

    public ModeState() {
        for (Mode mode : Mode.values()) {
            modes.put(mode, false);
        }
        modes.put(Mode.TEXT, true);
    }

    public ModeState(Map<Mode, Boolean> initial) {
        this();
        update(initial);
    }

    @Override
    public ModeState copy() {
        var copy = new ModeState();
        copy.modes.putAll(modes);
        return copy;
    }

    public boolean isOn(Mode mode) {
        return modes.get(mode);
    }

    public void update(Map<Mode, Boolean> changes) {
        modes.putAll(changes);
    }

    /** True when every listed mode has exactly the listed value. */
    public boolean test(Map<Mode, Boolean> requirements) {
        for (var requirement : requirements.entrySet()) {
            if (!modes.get(requirement.getKey()).equals(requirement.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModeState other && modes.equals(other.modes);
    }

    @Override
    public int hashCode() {
        return modes.hashCode();
    }

    @Override
    public String toString() {
        return modes.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining(", ", "{ ", " }"));
    }
}
