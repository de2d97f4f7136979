package org.texparse.latex;

public enum Directive {
    BEGIN,
    END
}
