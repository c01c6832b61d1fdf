package org.celshape.parser.ast.visitor;

import java.util.List;
import java.util.Map;

import org.celshape.parser.ast.expr.CelExpr;
import org.celshape.parser.ast.expr.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CelGenericVisitorWithDefaultsTest {

    private static final CelGenericVisitorWithDefaults<String, Void> KIND = new CelGenericVisitorWithDefaults<>() {
        @Override
        public String defaultAction(CelExpr n, Void arg) {
            return "default";
        }

        @Override
        public String visit(CelExpr.Select n, Void arg) {
            return "select:" + n.field();
        }
    };

    @Test
    void overriddenNodeKind_isDispatchedToOverride() {
        CelExpr select = new CelExpr.Select(new CelExpr.Ident("this"), "name");
        assertThat(select.accept(KIND, null)).isEqualTo("select:name");
    }

    @Test
    void everyOtherNodeKind_fallsIntoDefaultAction() {
        List<CelExpr> nodes = List.of(
                new CelExpr.Ident("this"),
                CelExpr.Constant.ofString("x"),
                CelExpr.Call.of(Operator.LOGICAL_NOT, new CelExpr.Ident("a")),
                new CelExpr.CreateList(List.of(CelExpr.Constant.ofInt(1))),
                new CelExpr.CreateMap(List.of(Map.entry(CelExpr.Constant.ofString("k"), CelExpr.Constant.ofBool(true)))),
                new CelExpr.CreateStruct("acme.Point", List.of(Map.entry("x", CelExpr.Constant.ofInt(1)))));

        assertThat(nodes).allSatisfy(node -> assertThat(node.accept(KIND, null)).isEqualTo("default"));
    }

    @Test
    void call_knowsGlobalFunctionAndArity() {
        CelExpr.Call has = CelExpr.Call.global(Operator.HAS, List.of(new CelExpr.Ident("x")));
        CelExpr.Call member = new CelExpr.Call(new CelExpr.Ident("s"), "size", List.of());

        assertThat(has.isFunction("has", 1)).isTrue();
        assertThat(has.isFunction("has", 2)).isFalse();
        assertThat(member.isGlobal()).isFalse();
        assertThat(member.isFunction("size", 0)).isFalse();
    }

    @Test
    void operator_isFoundByFunctionName() {
        assertThat(Operator.byFunction("_||_")).contains(Operator.LOGICAL_OR);
        assertThat(Operator.byFunction("!_")).contains(Operator.LOGICAL_NOT);
        assertThat(Operator.byFunction("size")).isEmpty();
    }
}
