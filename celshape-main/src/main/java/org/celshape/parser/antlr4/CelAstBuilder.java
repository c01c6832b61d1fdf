/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.celshape.parser.antlr4;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.antlr.v4.runtime.Token;
import org.celshape.ExpressionParseException;
import org.celshape.parser.ast.expr.CelExpr;
import org.celshape.parser.ast.expr.ConstantKind;
import org.celshape.parser.ast.expr.Operator;
import org.celshape.parser.util.AstUtils;

/**
 * Turns the ANTLR parse tree into a {@link CelExpr} tree.
 * <p>
 * Follows the node shapes of the CEL reference parser: a chain of {@code ||} (or {@code &&}) at one
 * nesting level becomes a single call with one argument per operand, an even run of {@code !} cancels
 * out, and parentheses leave no node of their own.
 */
public class CelAstBuilder extends CelBaseVisitor<CelExpr> {

    private final String expression;

    public CelAstBuilder(String expression) {
        this.expression = expression;
    }

    @Override
    public CelExpr visitStart(CelParser.StartContext ctx) {
        return visit(ctx.e);
    }

    @Override
    public CelExpr visitExpr(CelParser.ExprContext ctx) {
        CelExpr condition = visit(ctx.e);
        if (ctx.op == null) {
            return condition;
        }
        return CelExpr.Call.of(Operator.CONDITIONAL, condition, visit(ctx.e1), visit(ctx.e2));
    }

    @Override
    public CelExpr visitConditionalOr(CelParser.ConditionalOrContext ctx) {
        if (ctx.ops.isEmpty()) {
            return visit(ctx.e);
        }
        List<CelExpr> operands = new ArrayList<>();
        operands.add(visit(ctx.e));
        for (CelParser.ConditionalAndContext term : ctx.e1) {
            operands.add(visit(term));
        }
        return CelExpr.Call.global(Operator.LOGICAL_OR.getFunction(), operands);
    }

    @Override
    public CelExpr visitConditionalAnd(CelParser.ConditionalAndContext ctx) {
        if (ctx.ops.isEmpty()) {
            return visit(ctx.e);
        }
        List<CelExpr> operands = new ArrayList<>();
        operands.add(visit(ctx.e));
        for (CelParser.RelationContext term : ctx.e1) {
            operands.add(visit(term));
        }
        return CelExpr.Call.global(Operator.LOGICAL_AND.getFunction(), operands);
    }

    @Override
    public CelExpr visitRelation(CelParser.RelationContext ctx) {
        if (ctx.calc() != null) {
            return visit(ctx.calc());
        }
        Operator operator = AstUtils.getBinaryOperator(ctx.op.getText());
        return CelExpr.Call.of(operator, visit(ctx.relation(0)), visit(ctx.relation(1)));
    }

    @Override
    public CelExpr visitCalc(CelParser.CalcContext ctx) {
        if (ctx.unary() != null) {
            return visit(ctx.unary());
        }
        Operator operator = AstUtils.getBinaryOperator(ctx.op.getText());
        return CelExpr.Call.of(operator, visit(ctx.calc(0)), visit(ctx.calc(1)));
    }

    @Override
    public CelExpr visitMemberExpr(CelParser.MemberExprContext ctx) {
        return visit(ctx.member());
    }

    @Override
    public CelExpr visitLogicalNot(CelParser.LogicalNotContext ctx) {
        CelExpr operand = visit(ctx.member());
        return ctx.ops.size() % 2 == 0 ? operand : CelExpr.Call.of(Operator.LOGICAL_NOT, operand);
    }

    @Override
    public CelExpr visitNegate(CelParser.NegateContext ctx) {
        CelExpr operand = visit(ctx.member());
        return ctx.ops.size() % 2 == 0 ? operand : CelExpr.Call.of(Operator.NEGATE, operand);
    }

    @Override
    public CelExpr visitPrimaryExpr(CelParser.PrimaryExprContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public CelExpr visitSelect(CelParser.SelectContext ctx) {
        return new CelExpr.Select(visit(ctx.member()), ctx.id.getText());
    }

    @Override
    public CelExpr visitMemberCall(CelParser.MemberCallContext ctx) {
        return new CelExpr.Call(visit(ctx.member()), ctx.id.getText(), arguments(ctx.args));
    }

    @Override
    public CelExpr visitIndex(CelParser.IndexContext ctx) {
        return CelExpr.Call.of(Operator.INDEX, visit(ctx.member()), visit(ctx.index));
    }

    @Override
    public CelExpr visitCreateMessage(CelParser.CreateMessageContext ctx) {
        String messageName = messageName(visit(ctx.member()));
        if (messageName == null) {
            throw parseError(ctx.op, "expected a message type name before '{'", null);
        }
        List<Map.Entry<String, CelExpr>> fields = new ArrayList<>();
        if (ctx.entries != null) {
            for (int i = 0; i < ctx.entries.fields.size(); i++) {
                fields.add(Map.entry(ctx.entries.fields.get(i).getText(), visit(ctx.entries.values.get(i))));
            }
        }
        return new CelExpr.CreateStruct(messageName, fields);
    }

    @Override
    public CelExpr visitIdentOrGlobalCall(CelParser.IdentOrGlobalCallContext ctx) {
        String name = ctx.leadingDot != null ? "." + ctx.id.getText() : ctx.id.getText();
        if (ctx.op == null) {
            return new CelExpr.Ident(name);
        }
        return CelExpr.Call.global(name, arguments(ctx.args));
    }

    @Override
    public CelExpr visitNested(CelParser.NestedContext ctx) {
        return visit(ctx.e);
    }

    @Override
    public CelExpr visitCreateList(CelParser.CreateListContext ctx) {
        return new CelExpr.CreateList(arguments(ctx.elems));
    }

    @Override
    public CelExpr visitCreateStruct(CelParser.CreateStructContext ctx) {
        List<Map.Entry<CelExpr, CelExpr>> entries = new ArrayList<>();
        if (ctx.entries != null) {
            for (int i = 0; i < ctx.entries.keys.size(); i++) {
                entries.add(Map.entry(visit(ctx.entries.keys.get(i)), visit(ctx.entries.values.get(i))));
            }
        }
        return new CelExpr.CreateMap(entries);
    }

    @Override
    public CelExpr visitConstantLiteral(CelParser.ConstantLiteralContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public CelExpr visitInt(CelParser.IntContext ctx) {
        try {
            return CelExpr.Constant.ofInt(AstUtils.parseInt(ctx.tok.getText(), ctx.sign != null));
        } catch (NumberFormatException e) {
            throw parseError(ctx.tok, "int literal out of range: " + ctx.getText(), e);
        }
    }

    @Override
    public CelExpr visitUint(CelParser.UintContext ctx) {
        try {
            return CelExpr.Constant.ofUint(AstUtils.parseUint(ctx.tok.getText()));
        } catch (NumberFormatException e) {
            throw parseError(ctx.tok, "uint literal out of range: " + ctx.getText(), e);
        }
    }

    @Override
    public CelExpr visitDouble(CelParser.DoubleContext ctx) {
        double value = Double.parseDouble(ctx.tok.getText());
        return CelExpr.Constant.ofDouble(ctx.sign != null ? -value : value);
    }

    @Override
    public CelExpr visitString(CelParser.StringContext ctx) {
        try {
            return CelExpr.Constant.ofString(AstUtils.unquote(ctx.tok.getText()));
        } catch (IllegalArgumentException e) {
            throw parseError(ctx.tok, e.getMessage(), e);
        }
    }

    @Override
    public CelExpr visitBytes(CelParser.BytesContext ctx) {
        try {
            String text = AstUtils.unquote(ctx.tok.getText().substring(1));
            return new CelExpr.Constant(ConstantKind.BYTES, text.getBytes(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw parseError(ctx.tok, e.getMessage(), e);
        }
    }

    @Override
    public CelExpr visitBoolTrue(CelParser.BoolTrueContext ctx) {
        return CelExpr.Constant.ofBool(true);
    }

    @Override
    public CelExpr visitBoolFalse(CelParser.BoolFalseContext ctx) {
        return CelExpr.Constant.ofBool(false);
    }

    @Override
    public CelExpr visitNull(CelParser.NullContext ctx) {
        return CelExpr.Constant.ofNull();
    }

    private List<CelExpr> arguments(CelParser.ExprListContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<CelExpr> args = new ArrayList<>(ctx.e.size());
        for (CelParser.ExprContext arg : ctx.e) {
            args.add(visit(arg));
        }
        return args;
    }

    /**
     * The dotted name a message type reference spells, or {@code null} if {@code type} is not a plain name.
     */
    private static String messageName(CelExpr type) {
        if (type instanceof CelExpr.Ident ident) {
            return ident.name();
        }
        if (type instanceof CelExpr.Select select) {
            String operand = messageName(select.operand());
            return operand == null ? null : operand + "." + select.field();
        }
        return null;
    }

    private ExpressionParseException parseError(Token token, String message, Throwable cause) {
        return new ExpressionParseException("Parse error at " + token.getLine() + ":" + token.getCharPositionInLine()
                + ": " + message, expression, token.getLine(), token.getCharPositionInLine(), cause);
    }
}
