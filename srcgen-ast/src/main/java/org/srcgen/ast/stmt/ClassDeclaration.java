package org.srcgen.ast.stmt;

import org.srcgen.ast.Keyword;
import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class ClassDeclaration extends Statement {

    private final String name;
    private final List<Expression> bases;
    private final List<Keyword> keywords;
    private final List<Statement> body;
    private final List<Expression> decorators;

    public ClassDeclaration(String name, List<Expression> bases, List<Statement> body) {
        this(0, name, bases, List.of(), body, List.of());
    }

    public ClassDeclaration(int line, String name, List<Expression> bases, List<Keyword> keywords,
                            List<Statement> body, List<Expression> decorators) {
        super(line);
        this.name = name;
        this.bases = copyOf(bases);
        this.keywords = copyOf(keywords);
        this.body = copyOf(body);
        this.decorators = copyOf(decorators);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(decorators, bases, keywords, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
