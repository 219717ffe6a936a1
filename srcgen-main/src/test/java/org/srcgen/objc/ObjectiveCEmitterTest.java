package org.srcgen.objc;

import org.junit.jupiter.api.Test;
import org.srcgen.Diagnostic;
import org.srcgen.GenerationResult;
import org.srcgen.UnmappedOperatorException;
import org.srcgen.UnsupportedNodeException;
import org.srcgen.ast.Alias;
import org.srcgen.ast.Arguments;
import org.srcgen.ast.ExceptHandler;
import org.srcgen.ast.Keyword;
import org.srcgen.ast.Module;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.BooleanExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.CompareExpr;
import org.srcgen.ast.expr.ConditionalExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.EllipsisExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.LambdaExpr;
import org.srcgen.ast.expr.ListExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.expr.ReprExpr;
import org.srcgen.ast.expr.SetExpr;
import org.srcgen.ast.expr.StringLiteralExpr;
import org.srcgen.ast.expr.TupleExpr;
import org.srcgen.ast.expr.UnaryExpr;
import org.srcgen.ast.stmt.AssertStmt;
import org.srcgen.ast.stmt.AssignStmt;
import org.srcgen.ast.stmt.ClassDeclaration;
import org.srcgen.ast.stmt.DeleteStmt;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.ForStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.GlobalStmt;
import org.srcgen.ast.stmt.IfStmt;
import org.srcgen.ast.stmt.ImportStmt;
import org.srcgen.ast.stmt.PassStmt;
import org.srcgen.ast.stmt.PrintStmt;
import org.srcgen.ast.stmt.RaiseStmt;
import org.srcgen.ast.stmt.ReturnStmt;
import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.stmt.TryStmt;
import org.srcgen.ast.stmt.WithStmt;
import org.srcgen.printer.CommentSentinel;
import org.srcgen.printer.EmitterConfiguration;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectiveCEmitterTest {

    private static GenerationResult generate(Statement... statements) {
        return generate(EmitterConfiguration.defaults(), statements);
    }

    private static GenerationResult generate(EmitterConfiguration configuration, Statement... statements) {
        return new ObjectiveCEmitter(configuration).generate(new Module(Arrays.asList(statements)));
    }

    private static String emit(Statement... statements) {
        GenerationResult result = generate(statements);
        assertThat(result.getDiagnostics()).isEmpty();
        return result.getSource();
    }

    private static Expression name(String id) {
        return new NameExpr(id);
    }

    private static Expression self(String attribute) {
        return new AttributeExpr(name("self"), attribute);
    }

    private static Statement send(Expression receiver, String selector, Expression... arguments) {
        return new ExpressionStmt(new CallExpr(new AttributeExpr(receiver, selector), Arrays.asList(arguments)));
    }

    // Classes and interfaces

    @Test
    void class_getterWithInferredAttribute() {
        String source = emit(new ClassDeclaration("Foo", List.of(name("Base")), List.of(
                new AssignStmt(name("count"), new NumberLiteralExpr(0)),
                new FunctionDeclaration("get_count", Arguments.of("self"), List.of(new ReturnStmt(self("count")))))));

        assertThat(source).isEqualTo("@implementation Foo : Base\n"
                                     + "\n"
                                     + "- (id)count {\n"
                                     + "    return self.count;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end\n"
                                     + "\n"
                                     + "@interface Foo : Base {\n"
                                     + "    int count;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end");
    }

    @Test
    void initializer_labelsParametersAndRecordsReceiverAttributes() {
        String source = emit(new ClassDeclaration("Person", List.of(), List.of(
                new FunctionDeclaration("__init__", Arguments.of("self", "name", "age"), List.of(
                        new AssignStmt(self("name"), name("name")))))));

        assertThat(source).isEqualTo("@implementation Person\n"
                                     + "\n"
                                     + "- (id)initWithName:(id)name age:(id)age {\n"
                                     + "    self.name = name;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end\n"
                                     + "\n"
                                     + "@interface Person {\n"
                                     + "    id name;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end");
    }

    @Test
    void receiver_isTheFirstParameterWhateverItsName() {
        GenerationResult result = generate(new ClassDeclaration("Node", List.of(), List.of(
                new FunctionDeclaration("link", Arguments.of("this", "next"), List.of(
                        new AssignStmt(new AttributeExpr(name("this"), "next"), name("next")),
                        new AssignStmt(new AttributeExpr(name("other"), "ignored"), name("next")))))));

        assertThat(result.getSource()).contains("- (id)linkNext:(id)next {")
                                      .contains("@interface Node {\n    id next;\n}");
        assertThat(result.getSource()).doesNotContain("id ignored;");
    }

    @Test
    void classLevelAssignments_inferElementWiseAndReportUnknownShapes() {
        GenerationResult result = generate(new ClassDeclaration("P", List.of(), List.of(
                new AssignStmt(new TupleExpr(List.of(name("x"), name("y"))),
                               new TupleExpr(List.of(new NumberLiteralExpr(1), new StringLiteralExpr("s")))),
                new AssignStmt(name("z"), name("other")))));

        assertThat(result.getSource()).isEqualTo("@implementation P\n"
                                                 + "\n"
                                                 + "@end\n"
                                                 + "\n"
                                                 + "@interface P {\n"
                                                 + "    int x;\n"
                                                 + "    NSString * y;\n"
                                                 + "    id z;\n"
                                                 + "}\n"
                                                 + "\n"
                                                 + "@end");
        assertThat(result.getDiagnostics(Diagnostic.Kind.UNINFERRED_ATTRIBUTE_TYPE))
                .singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("'z'"));
    }

    @Test
    void passInClassBody_emitsNothing() {
        assertThat(emit(new ClassDeclaration("E", List.of(), List.of(new PassStmt()))))
                .isEqualTo("@implementation E\n\n@end\n\n@interface E {\n}\n\n@end");
    }

    @Test
    void classLevelBlock_whoseStatementsAreAllAbsorbed_getsPlaceholder() {
        String source = emit(new ClassDeclaration("C", List.of(), List.of(
                new IfStmt(name("x"), List.of(new AssignStmt(name("y"), new NumberLiteralExpr(1)))))));

        assertThat(source).isEqualTo("@implementation C\n"
                                     + "if (x) {\n"
                                     + "    ;\n"
                                     + "}\n"
                                     + "else {\n"
                                     + "    ;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end\n"
                                     + "\n"
                                     + "@interface C {\n"
                                     + "    int y;\n"
                                     + "}\n"
                                     + "\n"
                                     + "@end");
    }

    @Test
    void classKeywords_areReported() {
        GenerationResult result = generate(new ClassDeclaration(0, "M", List.of(),
                List.of(new Keyword("metaclass", name("Meta"))), List.of(new PassStmt()), List.of()));

        assertThat(result.getDiagnostics(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT)).hasSize(1);
    }

    // Functions and message sends

    @Test
    void freeFunction_withMessageSend() {
        String source = emit(new FunctionDeclaration("run", Arguments.of("obj"), List.of(
                send(name("obj"), "foo_bar_", name("x"), name("y")))));

        assertThat(source).isEqualTo("id run(id obj) {\n    [obj foo:x bar_:y];\n}");
    }

    @Test
    void messageSend_withoutArgumentsUsesNameVerbatim() {
        assertThat(emit(send(name("obj"), "update"))).isEqualTo("[obj update];");
    }

    @Test
    void messageSend_mismatchedPartsAreReported() {
        GenerationResult noArguments = generate(send(name("obj"), "set_value"));
        assertThat(noArguments.getSource()).isEqualTo("[obj set_value];");
        assertThat(noArguments.getDiagnostics(Diagnostic.Kind.SELECTOR_ARGUMENT_MISMATCH)).hasSize(1);

        GenerationResult extraArgument = generate(send(name("obj"), "move", name("a"), name("b")));
        assertThat(extraArgument.getSource()).isEqualTo("[obj move:a];");
        assertThat(extraArgument.getDiagnostics(Diagnostic.Kind.SELECTOR_ARGUMENT_MISMATCH))
                .singleElement()
                .satisfies(d -> assertThat(d.getNodeKind()).isEqualTo("CallExpr"));
    }

    @Test
    void messageSend_compoundReceiverIsParenthesized() {
        assertThat(emit(send(new BinaryExpr(name("a"), BinaryExpr.Operator.ADD, name("b")), "foo")))
                .isEqualTo("[(a + b) foo];");
    }

    @Test
    void messageSend_keywordArgumentsAreDropped() {
        CallExpr call = new CallExpr(new AttributeExpr(name("obj"), "put"), List.of(name("v")),
                                     List.of(new Keyword("force", name("True"))));

        GenerationResult result = generate(new ExpressionStmt(call));

        assertThat(result.getSource()).isEqualTo("[obj put:v];");
        assertThat(result.getDiagnostics(Diagnostic.Kind.DROPPED_KEYWORD_ARGUMENTS)).hasSize(1);
    }

    @Test
    void messageSend_customDelimiter() {
        EmitterConfiguration configuration = EmitterConfiguration.builder().selectorDelimiter('$').build();

        GenerationResult result = generate(configuration, send(name("obj"), "move$to", name("a"), name("b")));

        assertThat(result.getSource()).isEqualTo("[obj move:a to:b];");
    }

    // Control flow

    @Test
    void if_alwaysEndsWithElseBlock() {
        String source = emit(new IfStmt(name("a"), List.of(new PassStmt()), List.of(
                new IfStmt(name("b"), List.of(send(name("x"), "run"))))));

        assertThat(source).isEqualTo("if (a) {\n    ;\n}\n"
                                     + "else if (b) {\n    [x run];\n}\n"
                                     + "else {\n    ;\n}");
    }

    @Test
    void loopElse_isDroppedWithDiagnostic() {
        GenerationResult result = generate(new ForStmt(0, name("x"), name("xs"), List.of(new PassStmt()),
                                                       List.of(new PassStmt())));

        assertThat(result.getSource()).isEqualTo("for (id x in xs) {\n    ;\n}");
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.DROPPED_ELSE_BRANCH);
    }

    @Test
    void try_catchAndFinally() {
        String source = emit(new TryStmt(0, List.of(new PassStmt()), List.of(
                new ExceptHandler(name("NSException"), "e", List.of(new PassStmt())),
                new ExceptHandler(null, null, List.of(new PassStmt()))), List.of(), List.of(new PassStmt())));

        assertThat(source).isEqualTo("@try {\n    ;\n}\n"
                                     + "@catch (NSException* e) {\n    ;\n}\n"
                                     + "@catch (id) {\n    ;\n}\n"
                                     + "@finally {\n    ;\n}");
    }

    @Test
    void try_elseBranchIsDroppedWithDiagnostic() {
        GenerationResult result = generate(new TryStmt(0, List.of(new PassStmt()),
                                                       List.of(new ExceptHandler(null, null, List.of(new PassStmt()))),
                                                       List.of(send(name("x"), "run")), List.of()));

        assertThat(result.getSource()).isEqualTo("@try {\n    ;\n}\n@catch (id) {\n    ;\n}");
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.DROPPED_ELSE_BRANCH);
    }

    @Test
    void with_becomesScopedBlock() {
        GenerationResult result = generate(new WithStmt(new CallExpr(name("open"), List.of(name("p"))), name("f"),
                                                        List.of(new PassStmt())));

        assertThat(result.getSource()).isEqualTo("f = open(p);\n{\n    ;\n}");
        assertThat(result.getDiagnostics(Diagnostic.Kind.UNTRANSLATED_CONSTRUCT)).hasSize(1);
    }

    @Test
    void simpleStatements() {
        String source = emit(
                new RaiseStmt(new CallExpr(name("Err"), List.of())),
                new AssertStmt(name("x"), null),
                new PrintStmt(List.of(name("a"), name("b"))),
                new DeleteStmt(List.of(name("a"), name("b"))),
                new ImportStmt(List.of(new Alias("os"))),
                new GlobalStmt(List.of("a", "b")));

        assertThat(source).isEqualTo("@throw Err();\n"
                                     + "NSAssert(x, @\"\");\n"
                                     + "NSLog(@\"%@ %@\", a, b);\n"
                                     + "a = nil;\n"
                                     + "b = nil;\n"
                                     + "// Python: import os\n"
                                     + "// global a, b");
    }

    // Expressions

    @Test
    void literalsAndConstants() {
        String source = emit(
                new ExpressionStmt(name("None")),
                new ExpressionStmt(new ListExpr(List.of(new NumberLiteralExpr(1), new StringLiteralExpr("a\"b")))),
                new ExpressionStmt(new DictExpr(List.of(new StringLiteralExpr("k")), List.of(name("True")))),
                new ExpressionStmt(new SetExpr(List.of(name("a")))),
                new ExpressionStmt(new ConditionalExpr(name("t"), name("a"), name("b"))),
                new ExpressionStmt(new ReprExpr(name("x"))),
                new ExpressionStmt(new LambdaExpr(Arguments.of("x"), name("x"))));

        assertThat(source).isEqualTo("nil;\n"
                                     + "@[1, @\"a\\\"b\"];\n"
                                     + "@{@\"k\": YES};\n"
                                     + "[NSSet setWithObjects:a, nil];\n"
                                     + "(t ? a : b);\n"
                                     + "[x description];\n"
                                     + "^(id x) { return x; };");
    }

    @Test
    void assignmentsEndingInBrace_areTerminated() {
        String source = emit(
                new AssignStmt(name("d"), new DictExpr(List.of(new StringLiteralExpr("k")), List.of(new NumberLiteralExpr(1)))),
                new AssignStmt(name("f"), new LambdaExpr(Arguments.of("x"), name("x"))));

        assertThat(source).isEqualTo("d = @{@\"k\": 1};\nf = ^(id x) { return x; };");
    }

    @Test
    void operators_mapToCSymbols() {
        String source = emit(
                new ExpressionStmt(new BooleanExpr(BooleanExpr.Operator.AND, List.of(name("a"), name("b")))),
                new ExpressionStmt(new UnaryExpr(UnaryExpr.Operator.NOT, name("x"))),
                new ExpressionStmt(new CompareExpr(name("a"), CompareExpr.Operator.IS_NOT, name("None"))));

        assertThat(source).isEqualTo("(a && b);\n(!x);\n(a != nil);");
    }

    @Test
    void unaryOperand_keepsPrecedence() {
        String source = emit(new ExpressionStmt(new UnaryExpr(UnaryExpr.Operator.MINUS,
                new BinaryExpr(name("a"), BinaryExpr.Operator.ADD, name("b")))));

        assertThat(source).isEqualTo("(-(a + b));");
    }

    @Test
    void operatorWithoutCSymbol_isFatal() {
        Statement power = new ExpressionStmt(new BinaryExpr(name("a"), BinaryExpr.Operator.POW, name("b")));

        assertThatThrownBy(() -> generate(power))
                .isInstanceOf(UnmappedOperatorException.class)
                .satisfies(e -> {
                    UnmappedOperatorException uoe = (UnmappedOperatorException) e;
                    assertThat(uoe.getOperator()).isEqualTo("POW");
                    assertThat(uoe.getBackend()).isEqualTo("Objective-C");
                    assertThat(uoe.getNodeDescription()).isEqualTo("BinaryExpr.POW");
                });
    }

    @Test
    void ellipsis_hasNoTranslation() {
        assertThatThrownBy(() -> generate(new ExpressionStmt(new EllipsisExpr())))
                .isInstanceOf(UnsupportedNodeException.class)
                .hasMessageContaining("EllipsisExpr")
                .hasMessageContaining("Objective-C");
    }

    // Text post-pass

    @Test
    void commentSentinel_becomesLineComment() {
        String source = emit(new FunctionDeclaration("f", Arguments.of(), List.of(
                new AssignStmt(name(CommentSentinel.IDENTIFIER), new StringLiteralExpr(" note")))));

        assertThat(source).isEqualTo("id f() {\n    // note\n}");
    }

    @Test
    void lineInformation_isNotTerminated() {
        EmitterConfiguration configuration = EmitterConfiguration.builder().lineInformation(true).build();

        GenerationResult result = generate(configuration, new AssignStmt(3, List.of(name("x")), new NumberLiteralExpr(1)));

        assertThat(result.getSource()).isEqualTo("// line: 3\nx = 1;");
    }

    @Test
    void terminateStatements_skipsBlocksDirectivesAndComments() {
        assertThat(ObjectiveCEmitter.terminateStatements("a = 1\n\n@end\n// c\nif (x) {\n    }\n}\nb;"))
                .isEqualTo("a = 1;\n\n@end\n// c\nif (x) {\n    }\n}\nb;");
    }

    @Test
    void terminateStatements_terminatesStatementsEndingInBrace() {
        assertThat(ObjectiveCEmitter.terminateStatements("d = @{k: 1}\n@[a]\n@property\n    f = ^(id x) { return x; }"))
                .isEqualTo("d = @{k: 1};\n@[a];\n@property\n    f = ^(id x) { return x; };");
    }
}
