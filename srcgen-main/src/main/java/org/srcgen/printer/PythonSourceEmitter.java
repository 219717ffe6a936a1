package org.srcgen.printer;

import org.srcgen.NodeEmissionException;
import org.srcgen.ast.Arguments;
import org.srcgen.ast.ExceptHandler;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.BytesLiteralExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.ConditionalExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.EllipsisExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.LambdaExpr;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.ReprExpr;
import org.srcgen.ast.expr.SetExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.expr.TupleExpr;
import org.srcgen.ast.expr.UnaryExpr;
import org.srcgen.ast.stmt.AssertStmt;
import org.srcgen.ast.stmt.AssignStmt;
import org.srcgen.ast.stmt.ClassDeclaration;
import org.srcgen.ast.stmt.DeleteStmt;
import org.srcgen.ast.stmt.ForStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.GlobalStmt;
import org.srcgen.ast.stmt.IfStmt;
import org.srcgen.ast.stmt.ImportFromStmt;
import org.srcgen.ast.stmt.ImportStmt;
import org.srcgen.ast.stmt.NonlocalStmt;
import org.srcgen.ast.stmt.PassStmt;
import org.srcgen.ast.stmt.PrintStmt;
import org.srcgen.ast.stmt.RaiseStmt;
import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.stmt.TryStmt;
import org.srcgen.ast.stmt.WhileStmt;
import org.srcgen.ast.stmt.WithStmt;

import java.util.List;

/**
 * Prints a tree back in the surface syntax it was parsed from. Used to verify that trees survive a
 * round trip and, with line information switched on, to check the line numbers of statements.
 */
public class PythonSourceEmitter extends SourceEmitter {

    public PythonSourceEmitter() {
        this(EmitterConfiguration.defaults());
    }

    public PythonSourceEmitter(EmitterConfiguration configuration) {
        super(configuration);
    }

    @Override
    public String getBackendName() {
        return "Python";
    }

    @Override
    protected String getLineCommentToken() {
        return "#";
    }

    @Override
    protected void writePlaceholder() {
        newline();
        write("pass");
    }

    @Override
    protected String finish(String source) {
        String decoded = CommentSentinel.decode(source, CommentSentinel.IDENTIFIER + " = '", "#", PythonLiterals::unescape);
        return CommentSentinel.decode(decoded, CommentSentinel.IDENTIFIER + " = \"", "#", PythonLiterals::unescape);
    }

    @Override
    protected String symbol(BinaryExpr.Operator operator) {
        return operator.asString();
    }

    @Override
    protected String symbol(BooleanExpr.Operator operator) {
        return operator.asString();
    }

    @Override
    protected String symbol(CompareExpr.Operator operator) {
        return operator.asString();
    }

    @Override
    protected String symbol(UnaryExpr.Operator operator) {
        return operator.asString();
    }

    private void decorators(List<Expression> decorators) {
        for (Expression decorator : decorators) {
            newline();
            write("@");
            decorator.accept(this, null);
        }
    }

    // Statements

    @Override
    public void visit(AssignStmt n, Void arg) {
        newline(n);
        for (Expression target : n.getTargets()) {
            target.accept(this, arg);
            write(" = ");
        }
        n.getValue().accept(this, arg);
    }

    @Override
    public void visit(ImportStmt n, Void arg) {
        newline(n);
        write("import ");
        visitJoined(n.getNames(), ", ");
    }

    @Override
    public void visit(ImportFromStmt n, Void arg) {
        newline(n);
        write("from " + ".".repeat(n.getLevel()) + (n.getModule() == null ? "" : n.getModule()) + " import ");
        visitJoined(n.getNames(), ", ");
    }

    @Override
    public void visit(FunctionDeclaration n, Void arg) {
        newline(1);
        decorators(n.getDecorators());
        newline(n);
        write("def " + n.getName() + "(");
        n.getArguments().accept(this, arg);
        write("):");
        body(n.getBody());
    }

    @Override
    public void visit(Arguments n, Void arg) {
        List<Expression> defaults = n.getPaddedDefaults();
        boolean first = true;
        for (int i = 0; i < n.getParameters().size(); i++) {
            if (!first) {
                write(", ");
            }
            first = false;
            n.getParameters().get(i).accept(this, arg);
            if (defaults.get(i) != null) {
                write("=");
                defaults.get(i).accept(this, arg);
            }
        }
        if (n.getVararg() != null) {
            write((first ? "*" : ", *") + n.getVararg());
            first = false;
        }
        if (n.getKwarg() != null) {
            write((first ? "**" : ", **") + n.getKwarg());
        }
    }

    @Override
    public void visit(ClassDeclaration n, Void arg) {
        newline(2);
        decorators(n.getDecorators());
        newline(n);
        write("class " + n.getName());
        if (!n.getBases().isEmpty() || !n.getKeywords().isEmpty()) {
            write("(");
            visitJoined(n.getBases(), ", ");
            for (int i = 0; i < n.getKeywords().size(); i++) {
                if (i > 0 || !n.getBases().isEmpty()) {
                    write(", ");
                }
                n.getKeywords().get(i).accept(this, arg);
            }
            write(")");
        }
        write(":");
        body(n.getBody());
    }

    @Override
    public void visit(IfStmt n, Void arg) {
        newline(n);
        write("if ");
        n.getTest().accept(this, arg);
        write(":");
        body(n.getBody());
        IfStmt current = n;
        while (current.getElif() != null) {
            current = current.getElif();
            newline();
            write("elif ");
            current.getTest().accept(this, arg);
            write(":");
            body(current.getBody());
        }
        if (!current.getOrElse().isEmpty()) {
            newline();
            write("else:");
            body(current.getOrElse());
        }
    }

    @Override
    public void visit(ForStmt n, Void arg) {
        newline(n);
        write("for ");
        n.getTarget().accept(this, arg);
        write(" in ");
        n.getIter().accept(this, arg);
        write(":");
        bodyOrElse(n.getBody(), n.getOrElse());
    }

    @Override
    public void visit(WhileStmt n, Void arg) {
        newline(n);
        write("while ");
        n.getTest().accept(this, arg);
        write(":");
        bodyOrElse(n.getBody(), n.getOrElse());
    }

    private void bodyOrElse(List<Statement> body, List<Statement> orElse) {
        body(body);
        if (!orElse.isEmpty()) {
            newline();
            write("else:");
            body(orElse);
        }
    }

    @Override
    public void visit(WithStmt n, Void arg) {
        newline(n);
        write("with ");
        n.getContextExpression().accept(this, arg);
        if (n.getOptionalVars() != null) {
            write(" as ");
            n.getOptionalVars().accept(this, arg);
        }
        write(":");
        body(n.getBody());
    }

    @Override
    public void visit(PassStmt n, Void arg) {
        newline(n);
        write("pass");
    }

    @Override
    public void visit(PrintStmt n, Void arg) {
        newline(n);
        write("print");
        boolean wantComma = false;
        if (n.getDestination() != null) {
            write(" >> ");
            n.getDestination().accept(this, arg);
            wantComma = true;
        }
        for (Expression value : n.getValues()) {
            write(wantComma ? ", " : " ");
            value.accept(this, arg);
            wantComma = true;
        }
        if (!n.isNewline()) {
            write(",");
        }
    }

    @Override
    public void visit(DeleteStmt n, Void arg) {
        newline(n);
        write("del ");
        visitJoined(n.getTargets(), ", ");
    }

    @Override
    public void visit(TryStmt n, Void arg) {
        newline(n);
        write("try:");
        body(n.getBody());
        for (ExceptHandler handler : n.getHandlers()) {
            handler.accept(this, arg);
        }
        if (!n.getOrElse().isEmpty()) {
            newline();
            write("else:");
            body(n.getOrElse());
        }
        if (!n.getFinalBody().isEmpty()) {
            newline();
            write("finally:");
            body(n.getFinalBody());
        }
    }

    @Override
    public void visit(ExceptHandler n, Void arg) {
        newline(n);
        write("except");
        if (!n.isBare()) {
            write(" ");
            n.getType().accept(this, arg);
            if (n.getName() != null) {
                write(" as " + n.getName());
            }
        }
        write(":");
        body(n.getBody());
    }

    @Override
    public void visit(GlobalStmt n, Void arg) {
        newline(n);
        write("global " + String.join(", ", n.getNames()));
    }

    @Override
    public void visit(NonlocalStmt n, Void arg) {
        newline(n);
        write("nonlocal " + String.join(", ", n.getNames()));
    }

    @Override
    public void visit(RaiseStmt n, Void arg) {
        newline(n);
        write("raise");
        if (n.getException() != null) {
            write(" ");
            n.getException().accept(this, arg);
            if (n.getCause() != null) {
                write(" from ");
                n.getCause().accept(this, arg);
            }
        }
    }

    @Override
    public void visit(AssertStmt n, Void arg) {
        newline(n);
        write("assert ");
        n.getTest().accept(this, arg);
        if (n.getMessage() != null) {
            write(", ");
            n.getMessage().accept(this, arg);
        }
    }

    // Expressions

    @Override
    public void visit(StringLiteralExpr n, Void arg) {
        write(PythonLiterals.repr(n.getValue()));
    }

    @Override
    public void visit(BytesLiteralExpr n, Void arg) {
        String literal;
        try {
            literal = PythonLiterals.bytesRepr(n.getValue());
        } catch (IllegalArgumentException e) {
            throw new NodeEmissionException(e.getMessage(), n.toString(), e);
        }
        write(literal);
    }

    @Override
    public void visit(TupleExpr n, Void arg) {
        write("(");
        visitJoined(n.getElements(), ", ");
        write(n.getElements().size() == 1 ? ",)" : ")");
    }

    @Override
    public void visit(ListExpr n, Void arg) {
        write("[");
        visitJoined(n.getElements(), ", ");
        write("]");
    }

    @Override
    public void visit(SetExpr n, Void arg) {
        if (n.getElements().isEmpty()) {
            write("set()");
            return;
        }
        write("{");
        visitJoined(n.getElements(), ", ");
        write("}");
    }

    @Override
    public void visit(DictExpr n, Void arg) {
        write("{");
        for (int i = 0; i < n.getKeys().size(); i++) {
            if (i > 0) {
                write(", ");
            }
            n.getKeys().get(i).accept(this, arg);
            write(": ");
            n.getValues().get(i).accept(this, arg);
        }
        write("}");
    }

    @Override
    public void visit(LambdaExpr n, Void arg) {
        write("lambda");
        Arguments arguments = n.getArguments();
        if (!arguments.getParameters().isEmpty() || arguments.getVararg() != null || arguments.getKwarg() != null) {
            write(" ");
            arguments.accept(this, arg);
        }
        write(": ");
        n.getBody().accept(this, arg);
    }

    @Override
    public void visit(ConditionalExpr n, Void arg) {
        write("(");
        n.getBody().accept(this, arg);
        write(" if ");
        n.getTest().accept(this, arg);
        write(" else ");
        n.getOrElse().accept(this, arg);
        write(")");
    }

    @Override
    public void visit(ReprExpr n, Void arg) {
        write("`");
        n.getValue().accept(this, arg);
        write("`");
    }

    @Override
    public void visit(EllipsisExpr n, Void arg) {
        write("...");
    }
}
