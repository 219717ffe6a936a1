package org.srcgen.ast.expr;

import org.srcgen.ast.Node;

public abstract class Expression extends Node {

    protected Expression(int line) {
        super(line);
    }
}
