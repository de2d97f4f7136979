package org.texparse.latex;

/**
 * Mode directive: switch a mode on or off, or with a null mode open or
 * close a group.
 */
public record Operation(Directive directive, Mode mode) {
    public Operation {
        if (directive == null) {
            throw new IllegalArgumentException("directive is null");
        }
    }

    public static Operation begin(Mode mode) {
        return new Operation(Directive.BEGIN, mode);
    }

    public static Operation end(Mode mode) {
        return new Operation(Directive.END, mode);
    }

    public static Operation beginGroup() {
        return new Operation(Directive.BEGIN, null);
    }

    public static Operation endGroup() {
        return new Operation(Directive.END, null);
    }

    public boolean isGroup() {
        return mode == null;
    }

    @Override
    public String toString() {
        return directive + " " + (isGroup() ? "GROUP" : mode.name());
    }
}
