package org.celshape.parser.antlr4;

import java.util.List;
import java.util.Map;

import org.celshape.ExpressionParseException;
import org.celshape.parser.ast.expr.CelExpr;
import org.celshape.parser.ast.expr.ConstantKind;
import org.celshape.parser.ast.expr.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Antlr4CelParserTest {

    private static final CelExpr THIS = new CelExpr.Ident("this");

    private static CelExpr field(String name) {
        return new CelExpr.Select(THIS, name);
    }

    @Test
    void equality_isBinaryCall() {
        CelExpr expr = Antlr4CelParser.parseExpression("this.name == ''");
        assertThat(expr).isEqualTo(CelExpr.Call.of(Operator.EQUALS, field("name"), CelExpr.Constant.ofString("")));
    }

    @Test
    void nestedSelect_keepsOperandChain() {
        CelExpr expr = Antlr4CelParser.parseExpression("this.parent.child");
        assertThat(expr).isEqualTo(new CelExpr.Select(field("parent"), "child"));
    }

    @Test
    void hasMacro_isGlobalCall() {
        CelExpr expr = Antlr4CelParser.parseExpression("!has(this.id)");
        CelExpr has = CelExpr.Call.global(Operator.HAS, List.of(field("id")));
        assertThat(expr).isEqualTo(CelExpr.Call.of(Operator.LOGICAL_NOT, has));
    }

    @Test
    void orChain_isOneCallWithOperandPerTerm() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression("this.a == 1 || this.b == 2 || this.c == 3");
        assertThat(expr.function()).isEqualTo(Operator.LOGICAL_OR.getFunction());
        assertThat(expr.args()).hasSize(3);
    }

    @Test
    void parenthesizedOr_staysNested() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression("(this.a == 1 || this.b == 2) || this.c == 3");
        assertThat(expr.args()).hasSize(2);
        assertThat(expr.args().get(0)).isInstanceOfSatisfying(CelExpr.Call.class,
                inner -> assertThat(inner.function()).isEqualTo("_||_"));
    }

    @Test
    void andBindsTighterThanOr() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression("this.a == 1 && this.b == 2 || this.c == 3");
        assertThat(expr.function()).isEqualTo("_||_");
        assertThat(((CelExpr.Call) expr.args().get(0)).function()).isEqualTo("_&&_");
    }

    @Test
    void doubleNegation_cancels() {
        assertThat(Antlr4CelParser.parseExpression("!!this.flag")).isEqualTo(field("flag"));
    }

    @Test
    void numericLiterals_haveTheirKinds() {
        assertThat(constant("this.f == 0")).isEqualTo(CelExpr.Constant.ofInt(0));
        assertThat(constant("this.f == -7")).isEqualTo(CelExpr.Constant.ofInt(-7));
        assertThat(constant("this.f == 0x1F")).isEqualTo(CelExpr.Constant.ofInt(31));
        assertThat(constant("this.f == 0u")).isEqualTo(CelExpr.Constant.ofUint(0));
        assertThat(constant("this.f == 2.5")).isEqualTo(CelExpr.Constant.ofDouble(2.5));
        assertThat(constant("this.f == true")).isEqualTo(CelExpr.Constant.ofBool(true));
        assertThat(constant("this.f == null").kind()).isEqualTo(ConstantKind.NULL);
    }

    @Test
    void stringLiterals_areUnquoted() {
        assertThat(constant("this.f == \"a\\tb\"").value()).isEqualTo("a\tb");
        assertThat(constant("this.f == r'a\\tb'").value()).isEqualTo("a\\tb");
        assertThat(constant("this.f == '''x'y'''").value()).isEqualTo("x'y");
    }

    @Test
    void memberCall_keepsTarget() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression("this.name.startsWith('a')");
        assertThat(expr.isGlobal()).isFalse();
        assertThat(expr.target()).isEqualTo(field("name"));
        assertThat(expr.function()).isEqualTo("startsWith");
    }

    @Test
    void aggregateLiterals_areParsed() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression("this.kind in ['a', 'b'] && {'k': 1}['k'] == 1");
        assertThat(expr.args()).hasSize(2);
        CelExpr.Call in = (CelExpr.Call) expr.args().get(0);
        assertThat(in.function()).isEqualTo(Operator.IN.getFunction());
        assertThat(in.args().get(1)).isInstanceOf(CelExpr.CreateList.class);
    }

    @Test
    void messageConstruction_isCreateStruct() {
        CelExpr.Call expr = (CelExpr.Call) Antlr4CelParser.parseExpression(
                "this.t == google.protobuf.Timestamp{seconds: 0, nanos: 5,}");

        assertThat(expr.args().get(1)).isEqualTo(new CelExpr.CreateStruct("google.protobuf.Timestamp", List.of(
                Map.entry("seconds", CelExpr.Constant.ofInt(0)),
                Map.entry("nanos", CelExpr.Constant.ofInt(5)))));
    }

    @Test
    void messageConstruction_withLeadingDotAndNoFields() {
        CelExpr expr = Antlr4CelParser.parseExpression(".acme.Empty{}");

        assertThat(expr).isEqualTo(new CelExpr.CreateStruct(".acme.Empty", List.of()));
    }

    @Test
    void messageConstruction_afterNonName_isParseError() {
        assertThatThrownBy(() -> Antlr4CelParser.parseExpression("this.f() {a: 1}"))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("expected a message type name");
    }

    @Test
    void invalidSyntax_throwsWithPosition() {
        String bad = "invalid expression +++";
        assertThatThrownBy(() -> Antlr4CelParser.parseExpression(bad))
                .isInstanceOf(ExpressionParseException.class)
                .satisfies(e -> {
                    ExpressionParseException pe = (ExpressionParseException) e;
                    assertThat(pe.getExpression()).isEqualTo(bad);
                    assertThat(pe.getLine()).isEqualTo(1);
                    assertThat(pe.getColumn()).isEqualTo(8);
                    assertThat(pe.getMessage()).startsWith("Parse error at 1:8");
                });
    }

    @Test
    void outOfRangeInt_isParseError() {
        assertThatThrownBy(() -> Antlr4CelParser.parseExpression("this.f == 99999999999999999999"))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("out of range");
    }

    private static CelExpr.Constant constant(String expression) {
        CelExpr.Call call = (CelExpr.Call) Antlr4CelParser.parseExpression(expression);
        return (CelExpr.Constant) call.args().get(1);
    }
}
