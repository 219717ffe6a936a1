package org.srcgen.objc;

import com.github.javaparser.utils.StringEscapeUtils;
import com.github.javaparser.utils.Utils;
import org.srcgen.Diagnostic;
import org.srcgen.ast.Arguments;
import org.srcgen.ast.ExceptHandler;
import org.srcgen.ast.Parameter;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.BytesLiteralExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.ConditionalExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.LambdaExpr;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
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
import org.srcgen.printer.CommentSentinel;
import org.srcgen.printer.EmitterConfiguration;
import org.srcgen.printer.SourceEmitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Translates a tree into Objective-C-flavored text.
 * <p>
 * Classes become {@code @implementation} blocks, methods get selectors synthesized from their
 * names, and calls on an attribute become message sends. Attributes accessed through a method's
 * receiver or assigned in a class body are collected in a {@link ClassAttributeRegistry} and
 * declared in {@code @interface} blocks appended after the implementation text.
 * <p>
 * The translation is approximate. Constructs without a faithful counterpart are reported as
 * {@link Diagnostic}s; operators and node kinds that cannot be rendered at all abort the run.
 */
public class ObjectiveCEmitter extends SourceEmitter {

    private static final String TERMINATOR = ";";

    private final ClassAttributeRegistry registry = new ClassAttributeRegistry();

    private String currentClass;
    private String receiver;
    private boolean inClassBody;

    public ObjectiveCEmitter() {
        this(EmitterConfiguration.defaults());
    }

    public ObjectiveCEmitter(EmitterConfiguration configuration) {
        super(configuration);
    }

    @Override
    public String getBackendName() {
        return ObjectiveCOperators.BACKEND;
    }

    @Override
    protected String getLineCommentToken() {
        return "//";
    }

    @Override
    protected void writePlaceholder() {
        newline();
        write(TERMINATOR);
    }

    @Override
    protected void closeBlock() {
        newline();
        write("}");
    }

    @Override
    protected String finish(String source) {
        String decoded = CommentSentinel.decode(source, CommentSentinel.IDENTIFIER + " = @\"", "//",
                                                StringEscapeUtils::unescapeJava);
        String body = terminateStatements(decoded);
        if (registry.isEmpty()) {
            return body;
        }
        String interfaces = registry.emitInterfaces(configuration.getIndentUnit());
        return body.isEmpty() ? interfaces : body + "\n\n" + interfaces;
    }

    /**
     * Appends the statement terminator to every line that carries a statement. Lines that open a
     * block, lone closing braces, directives and comments are left alone. A statement ending in a
     * brace, such as a dictionary literal or a block, is still terminated.
     */
    static String terminateStatements(String source) {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            if (trimmed.isEmpty() || isDirective(trimmed) || trimmed.startsWith("//")) {
                continue;
            }
            if (trimmed.endsWith("{") || trimmed.equals("}") || trimmed.endsWith(TERMINATOR)) {
                continue;
            }
            lines[i] = lines[i] + TERMINATOR;
        }
        return String.join("\n", lines);
    }

    // @end, @implementation and decorators, as opposed to @"..", @[..] and @{..} literals
    private static boolean isDirective(String line) {
        return line.length() > 1 && line.charAt(0) == '@' && Character.isLetter(line.charAt(1));
    }

    @Override
    protected String symbol(BinaryExpr.Operator operator) {
        return ObjectiveCOperators.symbol(operator);
    }

    @Override
    protected String symbol(BooleanExpr.Operator operator) {
        return ObjectiveCOperators.symbol(operator);
    }

    @Override
    protected String symbol(CompareExpr.Operator operator) {
        return ObjectiveCOperators.symbol(operator);
    }

    @Override
    protected String symbol(UnaryExpr.Operator operator) {
        return ObjectiveCOperators.symbol(operator);
    }

    private void decorators(List<Expression> decorators) {
        for (Expression decorator : decorators) {
            newline();
            write("@");
            decorator.accept(this, null);
        }
    }

    // Declarations

    @Override
    public void visit(ClassDeclaration n, Void arg) {
        newline(2);
        decorators(n.getDecorators());
        newline(n);
        List<String> bases = new ArrayList<>();
        for (Expression base : n.getBases()) {
            Optional<String> baseName = AttributeTypeInference.dottedName(base);
            if (baseName.isPresent()) {
                bases.add(baseName.get());
            } else {
                report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n,
                       "Base class expression of class '" + n.getName() + "' is not a name and was left out");
            }
        }
        write("@implementation " + n.getName());
        if (!bases.isEmpty()) {
            write(" : " + String.join(", ", bases));
        }
        if (!n.getKeywords().isEmpty()) {
            report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n,
                   "Class keywords of '" + n.getName() + "' have no counterpart and were dropped");
        }
        registry.declareClass(n.getName(), bases);

        String outerClass = currentClass;
        String outerReceiver = receiver;
        boolean outerInClassBody = inClassBody;
        currentClass = n.getName();
        receiver = null;
        inClassBody = true;
        try {
            for (Statement statement : n.getBody()) {
                statement.accept(this, arg);
            }
        } finally {
            currentClass = outerClass;
            receiver = outerReceiver;
            inClassBody = outerInClassBody;
        }
        newline(1);
        write("@end");
    }

    @Override
    public void visit(FunctionDeclaration n, Void arg) {
        newline(1);
        decorators(n.getDecorators());
        newline(n);

        String outerReceiver = receiver;
        boolean outerInClassBody = inClassBody;
        try {
            if (inClassBody) {
                receiver = methodHeader(n);
            } else {
                write("id " + n.getName() + "(");
                n.getArguments().accept(this, arg);
                write(") {");
            }
            inClassBody = false;
            body(n.getBody());
        } finally {
            receiver = outerReceiver;
            inClassBody = outerInClassBody;
        }
    }

    /**
     * Writes the method header up to the opening brace and returns the name of the receiver
     * parameter, or {@code null} for a method without parameters.
     */
    private String methodHeader(FunctionDeclaration n) {
        Arguments arguments = n.getArguments();
        List<Parameter> parameters = arguments.getParameters();
        String methodReceiver = parameters.isEmpty() ? null : parameters.get(0).getName();
        List<Parameter> labeled = parameters.isEmpty() ? parameters : parameters.subList(1, parameters.size());
        if (!arguments.getDefaults().isEmpty() || arguments.getVararg() != null || arguments.getKwarg() != null) {
            report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n,
                   "Defaults and variadic parameters of method '" + n.getName() + "' were dropped");
        }

        String declared = Selector.declaredName(n.getName(), configuration.getSelectorDelimiter());
        write("- (id)" + declared);
        if (labeled.isEmpty()) {
            write(" {");
            return methodReceiver;
        }
        if (Selector.isInitializer(declared)) {
            write("With");
        }
        for (int i = 0; i < labeled.size(); i++) {
            String name = labeled.get(i).getName();
            write((i == 0 ? Utils.capitalize(name) : name) + ":(id)" + name + " ");
        }
        write("{");
        return methodReceiver;
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
            write("id ");
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

    // Statements

    @Override
    public void visit(AssignStmt n, Void arg) {
        if (inClassBody) {
            for (Expression target : n.getTargets()) {
                recordClassAttribute(n, target, n.getValue());
            }
            return;
        }
        newline(n);
        for (Expression target : n.getTargets()) {
            target.accept(this, arg);
            write(" = ");
        }
        n.getValue().accept(this, arg);
    }

    private void recordClassAttribute(AssignStmt n, Expression target, Expression value) {
        if (target instanceof NameExpr) {
            String attribute = ((NameExpr) target).getId();
            Optional<String> type = AttributeTypeInference.infer(value);
            if (type.isEmpty()) {
                report(Diagnostic.Kind.UNINFERRED_ATTRIBUTE_TYPE, n,
                       "No type inferred for attribute '" + attribute + "' of class '" + currentClass
                               + "' from a " + value.getKind() + ", declared as " + ClassAttributeRegistry.DEFAULT_TYPE);
            }
            registry.recordAssignment(currentClass, attribute, type);
            return;
        }
        List<Expression> targets = elementsOf(target);
        if (targets == null) {
            report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n,
                   "Class-level assignment to a " + target.getKind() + " was dropped");
            return;
        }
        List<Expression> values = elementsOf(value);
        boolean elementWise = values != null && values.size() == targets.size();
        for (int i = 0; i < targets.size(); i++) {
            recordClassAttribute(n, targets.get(i), elementWise ? values.get(i) : value);
        }
    }

    private static List<Expression> elementsOf(Expression expression) {
        if (expression instanceof TupleExpr) {
            return ((TupleExpr) expression).getElements();
        }
        if (expression instanceof ListExpr) {
            return ((ListExpr) expression).getElements();
        }
        return null;
    }

    @Override
    public void visit(PassStmt n, Void arg) {
        if (inClassBody) {
            return;
        }
        newline(n);
        write(TERMINATOR);
    }

    @Override
    public void visit(IfStmt n, Void arg) {
        newline(n);
        write("if (");
        n.getTest().accept(this, arg);
        write(") {");
        body(n.getBody());
        IfStmt current = n;
        while (current.getElif() != null) {
            current = current.getElif();
            newline();
            write("else if (");
            current.getTest().accept(this, arg);
            write(") {");
            body(current.getBody());
        }
        newline();
        write("else {");
        body(current.getOrElse());
    }

    @Override
    public void visit(ForStmt n, Void arg) {
        newline(n);
        write("for (id ");
        n.getTarget().accept(this, arg);
        write(" in ");
        n.getIter().accept(this, arg);
        write(") {");
        body(n.getBody());
        dropElse(n, n.getOrElse(), "for");
    }

    @Override
    public void visit(WhileStmt n, Void arg) {
        newline(n);
        write("while (");
        n.getTest().accept(this, arg);
        write(") {");
        body(n.getBody());
        dropElse(n, n.getOrElse(), "while");
    }

    private void dropElse(Statement n, List<Statement> orElse, String construct) {
        if (!orElse.isEmpty()) {
            report(Diagnostic.Kind.DROPPED_ELSE_BRANCH, n,
                   "The else branch of a " + construct + " statement was dropped (" + orElse.size() + " statement(s))");
        }
    }

    @Override
    public void visit(TryStmt n, Void arg) {
        newline(n);
        write("@try {");
        body(n.getBody());
        for (ExceptHandler handler : n.getHandlers()) {
            handler.accept(this, arg);
        }
        dropElse(n, n.getOrElse(), "try");
        if (!n.getFinalBody().isEmpty()) {
            newline();
            write("@finally {");
            body(n.getFinalBody());
        }
    }

    @Override
    public void visit(ExceptHandler n, Void arg) {
        newline(n);
        write("@catch (");
        if (n.isBare()) {
            write("id");
        } else {
            n.getType().accept(this, arg);
            write("*");
            if (n.getName() != null) {
                write(" " + n.getName());
            }
        }
        write(") {");
        body(n.getBody());
    }

    @Override
    public void visit(RaiseStmt n, Void arg) {
        newline(n);
        write("@throw");
        if (n.getException() != null) {
            write(" ");
            n.getException().accept(this, arg);
        }
        write(TERMINATOR);
        if (n.getCause() != null) {
            report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n, "Exception cause of a raise statement was dropped");
        }
    }

    @Override
    public void visit(AssertStmt n, Void arg) {
        newline(n);
        write("NSAssert(");
        n.getTest().accept(this, arg);
        write(", ");
        if (n.getMessage() != null) {
            n.getMessage().accept(this, arg);
        } else {
            write("@\"\"");
        }
        write(")");
    }

    @Override
    public void visit(PrintStmt n, Void arg) {
        newline(n);
        write("NSLog(@\"" + String.join(" ", Collections.nCopies(n.getValues().size(), "%@")) + "\"");
        for (Expression value : n.getValues()) {
            write(", ");
            value.accept(this, arg);
        }
        write(")");
        if (n.getDestination() != null) {
            report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n, "Print destination was dropped, output goes to NSLog");
        }
    }

    @Override
    public void visit(DeleteStmt n, Void arg) {
        for (Expression target : n.getTargets()) {
            newline(n);
            target.accept(this, arg);
            write(" = nil");
        }
    }

    @Override
    public void visit(ImportStmt n, Void arg) {
        newline(n);
        write("// Python: import ");
        visitJoined(n.getNames(), ", ");
    }

    @Override
    public void visit(ImportFromStmt n, Void arg) {
        newline(n);
        write("// Python: from " + ".".repeat(n.getLevel()) + (n.getModule() == null ? "" : n.getModule()) + " import ");
        visitJoined(n.getNames(), ", ");
    }

    @Override
    public void visit(GlobalStmt n, Void arg) {
        newline(n);
        write("// global " + String.join(", ", n.getNames()));
    }

    @Override
    public void visit(NonlocalStmt n, Void arg) {
        newline(n);
        write("// nonlocal " + String.join(", ", n.getNames()));
    }

    @Override
    public void visit(WithStmt n, Void arg) {
        report(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT, n,
               "with statement emitted as a plain block, the context manager protocol is not translated");
        newline(n);
        if (n.getOptionalVars() != null) {
            n.getOptionalVars().accept(this, arg);
            write(" = ");
        }
        n.getContextExpression().accept(this, arg);
        newline();
        write("{");
        body(n.getBody());
    }

    // Expressions

    @Override
    public void visit(NameExpr n, Void arg) {
        switch (n.getId()) {
            case "None":
                write("nil");
                break;
            case "True":
                write("YES");
                break;
            case "False":
                write("NO");
                break;
            default:
                write(n.getId());
        }
    }

    @Override
    public void visit(AttributeExpr n, Void arg) {
        if (currentClass != null && receiver != null && n.getValue() instanceof NameExpr
                && receiver.equals(((NameExpr) n.getValue()).getId())) {
            registry.recordAccess(currentClass, n.getAttribute());
        }
        super.visit(n, arg);
    }

    @Override
    public void visit(CallExpr n, Void arg) {
        if (!(n.getFunction() instanceof AttributeExpr)) {
            super.visit(n, arg);
            return;
        }
        AttributeExpr target = (AttributeExpr) n.getFunction();
        Selector selector = Selector.parse(target.getAttribute(), configuration.getSelectorDelimiter());
        List<Expression> arguments = n.getArguments();

        write("[");
        operand(target.getValue());
        if (arguments.isEmpty()) {
            write(" " + target.getAttribute());
            if (selector.parts().size() > 1) {
                reportMismatch(n, selector, 0);
            }
        } else {
            List<String> keywords = selector.keywordParts();
            int pairs = Math.min(keywords.size(), arguments.size());
            for (int i = 0; i < pairs; i++) {
                write(" " + keywords.get(i) + ":");
                arguments.get(i).accept(this, arg);
            }
            if (keywords.size() != arguments.size()) {
                reportMismatch(n, selector, arguments.size());
            }
        }
        write("]");

        if (!n.getKeywords().isEmpty()) {
            report(Diagnostic.Kind.DROPPED_KEYWORD_ARGUMENTS, n,
                   n.getKeywords().size() + " keyword argument(s) of message '" + target.getAttribute() + "' dropped");
        }
    }

    private void reportMismatch(CallExpr n, Selector selector, int argumentCount) {
        report(Diagnostic.Kind.SELECTOR_ARGUMENT_MISMATCH, n,
               "Selector '" + selector.getName() + "' has " + selector.parts().size() + " part(s) but the call passes "
                       + argumentCount + " argument(s)");
    }

    @Override
    public void visit(StringLiteralExpr n, Void arg) {
        write("@\"" + StringEscapeUtils.escapeJava(n.getValue()) + "\"");
    }

    @Override
    public void visit(BytesLiteralExpr n, Void arg) {
        write("\"" + StringEscapeUtils.escapeJava(n.getValue()) + "\"");
    }

    @Override
    public void visit(ListExpr n, Void arg) {
        arrayLiteral(n.getElements());
    }

    @Override
    public void visit(TupleExpr n, Void arg) {
        arrayLiteral(n.getElements());
    }

    private void arrayLiteral(List<Expression> elements) {
        write("@[");
        visitJoined(elements, ", ");
        write("]");
    }

    @Override
    public void visit(DictExpr n, Void arg) {
        write("@{");
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
    public void visit(SetExpr n, Void arg) {
        write("[NSSet setWithObjects:");
        visitJoined(n.getElements(), ", ");
        write(n.getElements().isEmpty() ? "nil]" : ", nil]");
    }

    @Override
    public void visit(ConditionalExpr n, Void arg) {
        write("(");
        n.getTest().accept(this, arg);
        write(" ? ");
        n.getBody().accept(this, arg);
        write(" : ");
        n.getOrElse().accept(this, arg);
        write(")");
    }

    @Override
    public void visit(LambdaExpr n, Void arg) {
        write("^(");
        n.getArguments().accept(this, arg);
        write(") { return ");
        n.getBody().accept(this, arg);
        write("; }");
    }

    @Override
    public void visit(ReprExpr n, Void arg) {
        write("[");
        n.getValue().accept(this, arg);
        write(" description]");
    }
}
