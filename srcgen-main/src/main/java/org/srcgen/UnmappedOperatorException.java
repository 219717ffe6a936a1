package org.srcgen;

public class UnmappedOperatorException extends NodeEmissionException {

    private final String operator;
    private final String backend;

    public UnmappedOperatorException(Enum<?> operator, String backend) {
        super("Operator " + describe(operator) + " has no " + backend + " symbol", describe(operator));
        this.operator = operator.name();
        this.backend = backend;
    }

    private static String describe(Enum<?> operator) {
        Class<?> owner = operator.getDeclaringClass().getEnclosingClass();
        return owner == null ? operator.name() : owner.getSimpleName() + "." + operator.name();
    }

    public String getOperator() {
        return operator;
    }

    public String getBackend() {
        return backend;
    }
}
