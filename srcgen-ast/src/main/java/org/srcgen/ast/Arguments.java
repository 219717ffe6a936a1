package org.srcgen.ast;

import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formal parameter list of a function or lambda. Defaults align with the <em>last</em>
 * parameters, so {@code defaults.size() <= parameters.size()}.
 */
public class Arguments extends Node {

    private final List<Parameter> parameters;
    private final List<Expression> defaults;
    private final String vararg;
    private final String kwarg;

    public Arguments(List<Parameter> parameters) {
        this(parameters, List.of(), null, null);
    }

    public Arguments(List<Parameter> parameters, List<Expression> defaults, String vararg, String kwarg) {
        super(0);
        this.parameters = copyOf(parameters);
        this.defaults = copyOf(defaults);
        if (this.defaults.size() > this.parameters.size()) {
            throw new IllegalArgumentException("More defaults (" + this.defaults.size()
                                               + ") than parameters (" + this.parameters.size() + ")");
        }
        this.vararg = vararg;
        this.kwarg = kwarg;
    }

    public static Arguments of(String... names) {
        List<Parameter> parameters = new ArrayList<>();
        for (String name : names) {
            parameters.add(new Parameter(name));
        }
        return new Arguments(parameters);
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Expression> getDefaults() {
        return defaults;
    }

    /**
     * @return the default for each parameter in order, {@code null} where the parameter has none
     */
    public List<Expression> getPaddedDefaults() {
        List<Expression> padded = new ArrayList<>(Collections.nCopies(parameters.size() - defaults.size(), null));
        padded.addAll(defaults);
        return padded;
    }

    public String getVararg() {
        return vararg;
    }

    public String getKwarg() {
        return kwarg;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(parameters, defaults);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
