package org.srcgen.printer;

import org.srcgen.Diagnostic;
import org.srcgen.GenerationResult;
import org.srcgen.UnsupportedNodeException;
import org.srcgen.ast.Alias;
import org.srcgen.ast.Comprehension;
import org.srcgen.ast.Keyword;
import org.srcgen.ast.Module;
import org.srcgen.ast.Node;
import org.srcgen.ast.Parameter;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.ComprehensionExpr;
import org.srcgen.ast.expr.DictCompExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.ExtSliceExpr;
import org.srcgen.ast.expr.GeneratorExpr;
import org.srcgen.ast.expr.LambdaExpr;
import org.srcgen.ast.expr.ListCompExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.SetCompExpr;
import org.srcgen.ast.expr.SliceExpr;
import org.srcgen.ast.expr.StarredExpr;
import org.srcgen.ast.expr.SubscriptExpr;
import org.srcgen.ast.expr.UnaryExpr;
import org.srcgen.ast.expr.YieldExpr;
import org.srcgen.ast.stmt.AugAssignStmt;
import org.srcgen.ast.stmt.BreakStmt;
import org.srcgen.ast.stmt.ContinueStmt;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.ReturnStmt;
import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.visitor.VoidVisitorWithDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a syntax tree depth-first and writes source text through a {@link SourceBuffer}.
 * <p>
 * Subclasses override the node kinds they print. Every other kind falls through to
 * {@link #defaultAction(Node, Void)}, which visits the node's children in order, or aborts the run
 * when there are none: silently dropping code is worse than failing.
 * <p>
 * An emitter holds the state of exactly one run and cannot be reused.
 */
public abstract class SourceEmitter extends VoidVisitorWithDefaults<Void> {

    private static final Logger logger = LoggerFactory.getLogger(SourceEmitter.class);

    protected final EmitterConfiguration configuration;
    protected final SourceBuffer printer;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean used;

    protected SourceEmitter(EmitterConfiguration configuration) {
        this.configuration = configuration;
        this.printer = new SourceBuffer(configuration.getIndentUnit());
    }

    /**
     * Emits the whole tree. Fatal conditions propagate as exceptions and no text is returned.
     *
     * @throws IllegalStateException if this emitter has already run
     */
    public final GenerationResult generate(Node root) {
        if (used) {
            throw new IllegalStateException(getClass().getSimpleName() + " instances are single-use, create one per tree");
        }
        used = true;
        logger.debug("Emitting {} source for {}", getBackendName(), root);
        root.accept(this, null);
        String source = finish(printer.getSource());
        logger.debug("Emitted {} characters of {} source with {} diagnostic(s)", source.length(), getBackendName(),
                     diagnostics.size());
        return new GenerationResult(source, diagnostics);
    }

    /**
     * @return a short name of the target syntax, used in messages
     */
    public abstract String getBackendName();

    /**
     * Post-processes the text of the completed walk.
     */
    protected abstract String finish(String source);

    /**
     * @return the comment introducer used for line information
     */
    protected abstract String getLineCommentToken();

    /**
     * Writes the no-op statement that stands in for an empty body.
     */
    protected abstract void writePlaceholder();

    /**
     * Invoked after every body. Does nothing unless the target syntax delimits blocks explicitly.
     */
    protected void closeBlock() {
    }

    protected abstract String symbol(BinaryExpr.Operator operator);

    protected abstract String symbol(BooleanExpr.Operator operator);

    protected abstract String symbol(CompareExpr.Operator operator);

    protected abstract String symbol(UnaryExpr.Operator operator);

    @Override
    public void defaultAction(Node n, Void arg) {
        List<Node> children = n.getChildNodes();
        if (children.isEmpty()) {
            throw new UnsupportedNodeException(n.getKind(), n.getLine(), getBackendName());
        }
        for (Node child : children) {
            child.accept(this, arg);
        }
    }

    // Buffer helpers

    protected void write(String text) {
        printer.write(text);
    }

    protected void newline() {
        printer.requestNewline(0);
    }

    protected void newline(int extra) {
        printer.requestNewline(extra);
    }

    protected void newline(Node node) {
        printer.requestNewline(0);
        if (configuration.isAddLineInformation()) {
            printer.write(getLineCommentToken() + " line: " + node.getLine());
            printer.requestNewline(0);
        }
    }

    /**
     * Writes an indented block. The placeholder stands in when the statements produced no text,
     * either because there are none or because the backend absorbed all of them.
     */
    protected void body(List<Statement> statements) {
        printer.indent();
        int start = printer.length();
        for (Statement statement : statements) {
            statement.accept(this, null);
        }
        if (printer.length() == start) {
            writePlaceholder();
        }
        printer.unindent();
        closeBlock();
    }

    protected void visitJoined(List<? extends Node> nodes, String separator) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                write(separator);
            }
            nodes.get(i).accept(this, null);
        }
    }

    protected void report(Diagnostic.Kind kind, Node node, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, node.getKind(), node.getLine(), message);
        logger.warn("{} backend: {}", getBackendName(), diagnostic);
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    // Statements shared by both syntaxes

    @Override
    public void visit(Module n, Void arg) {
        for (Node child : n.getChildNodes()) {
            child.accept(this, arg);
        }
    }

    @Override
    public void visit(ExpressionStmt n, Void arg) {
        newline(n);
        n.getExpression().accept(this, arg);
    }

    @Override
    public void visit(AugAssignStmt n, Void arg) {
        newline(n);
        n.getTarget().accept(this, arg);
        write(" " + symbol(n.getOperator()) + "= ");
        n.getValue().accept(this, arg);
    }

    @Override
    public void visit(ReturnStmt n, Void arg) {
        newline(n);
        write("return");
        if (n.getValue() != null) {
            write(" ");
            n.getValue().accept(this, arg);
        }
    }

    @Override
    public void visit(BreakStmt n, Void arg) {
        newline(n);
        write("break");
    }

    @Override
    public void visit(ContinueStmt n, Void arg) {
        newline(n);
        write("continue");
    }

    // Expressions shared by both syntaxes

    @Override
    public void visit(NameExpr n, Void arg) {
        write(n.getId());
    }

    @Override
    public void visit(NumberLiteralExpr n, Void arg) {
        write(n.getValue());
    }

    @Override
    public void visit(AttributeExpr n, Void arg) {
        operand(n.getValue());
        write("." + n.getAttribute());
    }

    @Override
    public void visit(CallExpr n, Void arg) {
        operand(n.getFunction());
        write("(");
        boolean first = true;
        for (Expression argument : n.getArguments()) {
            if (!first) {
                write(", ");
            }
            first = false;
            argument.accept(this, arg);
        }
        for (Keyword keyword : n.getKeywords()) {
            if (!first) {
                write(", ");
            }
            first = false;
            keyword.accept(this, arg);
        }
        write(")");
    }

    @Override
    public void visit(Keyword n, Void arg) {
        write(n.isExpansion() ? "**" : n.getArg() + "=");
        n.getValue().accept(this, arg);
    }

    @Override
    public void visit(Parameter n, Void arg) {
        write(n.getName());
    }

    @Override
    public void visit(Alias n, Void arg) {
        write(n.getName());
        if (n.getAsName() != null) {
            write(" as " + n.getAsName());
        }
    }

    @Override
    public void visit(BinaryExpr n, Void arg) {
        operand(n.getLeft());
        write(" " + symbol(n.getOperator()) + " ");
        operand(n.getRight());
    }

    /**
     * Visits an expression that binds tighter than its own top-level operator, parenthesized if
     * needed. Boolean, comparison, unary and conditional forms already print their own parentheses.
     */
    protected void operand(Expression operand) {
        if (operand instanceof BinaryExpr || operand instanceof LambdaExpr) {
            write("(");
            operand.accept(this, null);
            write(")");
        } else {
            operand.accept(this, null);
        }
    }

    @Override
    public void visit(BooleanExpr n, Void arg) {
        write("(");
        visitJoined(n.getValues(), " " + symbol(n.getOperator()) + " ");
        write(")");
    }

    @Override
    public void visit(CompareExpr n, Void arg) {
        write("(");
        n.getLeft().accept(this, arg);
        for (int i = 0; i < n.getOperators().size(); i++) {
            write(" " + symbol(n.getOperators().get(i)) + " ");
            n.getComparators().get(i).accept(this, arg);
        }
        write(")");
    }

    @Override
    public void visit(UnaryExpr n, Void arg) {
        String symbol = symbol(n.getOperator());
        write("(" + symbol);
        if (Character.isLetter(symbol.charAt(symbol.length() - 1))) {
            write(" ");
        }
        operand(n.getOperand());
        write(")");
    }

    @Override
    public void visit(SubscriptExpr n, Void arg) {
        operand(n.getValue());
        write("[");
        n.getSlice().accept(this, arg);
        write("]");
    }

    @Override
    public void visit(SliceExpr n, Void arg) {
        if (n.getLower() != null) {
            n.getLower().accept(this, arg);
        }
        write(":");
        if (n.getUpper() != null) {
            n.getUpper().accept(this, arg);
        }
        if (n.getStep() != null) {
            write(":");
            if (!isNoneName(n.getStep())) {
                n.getStep().accept(this, arg);
            }
        }
    }

    private static boolean isNoneName(Expression expression) {
        return expression instanceof NameExpr && "None".equals(((NameExpr) expression).getId());
    }

    @Override
    public void visit(ExtSliceExpr n, Void arg) {
        visitJoined(n.getDimensions(), ", ");
    }

    @Override
    public void visit(YieldExpr n, Void arg) {
        write("yield");
        if (n.getValue() != null) {
            write(" ");
            n.getValue().accept(this, arg);
        }
    }

    @Override
    public void visit(StarredExpr n, Void arg) {
        write("*");
        n.getValue().accept(this, arg);
    }

    @Override
    public void visit(ListCompExpr n, Void arg) {
        comprehension(n, "[", "]");
    }

    @Override
    public void visit(SetCompExpr n, Void arg) {
        comprehension(n, "{", "}");
    }

    @Override
    public void visit(GeneratorExpr n, Void arg) {
        comprehension(n, "(", ")");
    }

    private void comprehension(ComprehensionExpr n, String open, String close) {
        write(open);
        n.getElement().accept(this, null);
        for (Comprehension generator : n.getGenerators()) {
            generator.accept(this, null);
        }
        write(close);
    }

    @Override
    public void visit(DictCompExpr n, Void arg) {
        write("{");
        n.getKey().accept(this, arg);
        write(": ");
        n.getValue().accept(this, arg);
        for (Comprehension generator : n.getGenerators()) {
            generator.accept(this, arg);
        }
        write("}");
    }

    @Override
    public void visit(Comprehension n, Void arg) {
        write(" for ");
        n.getTarget().accept(this, arg);
        write(" in ");
        n.getIter().accept(this, arg);
        for (Expression condition : n.getIfs()) {
            write(" if ");
            condition.accept(this, arg);
        }
    }
}
