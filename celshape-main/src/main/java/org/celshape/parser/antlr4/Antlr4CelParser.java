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

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.celshape.ExpressionParseException;
import org.celshape.parser.ast.expr.CelExpr;

/**
 * Entry point to the ANTLR based CEL parser.
 */
public final class Antlr4CelParser {

    private Antlr4CelParser() {
    }

    /**
     * Parses a CEL expression into a {@link CelExpr} tree.
     *
     * @throws ExpressionParseException if the text is not a well formed expression
     */
    public static CelExpr parseExpression(String expression) {
        CelParser.StartContext tree = parseExpressionAsAntlrAST(expression);
        return new CelAstBuilder(expression).visit(tree);
    }

    public static CelParser.StartContext parseExpressionAsAntlrAST(String expression) {
        ThrowingErrorListener errorListener = new ThrowingErrorListener(expression);

        CelLexer lexer = new CelLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CelParser parser = new CelParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser.start();
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String expression;

        ThrowingErrorListener(String expression) {
            this.expression = expression;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ExpressionParseException("Parse error at " + line + ":" + charPositionInLine + ": " + msg,
                    expression, line, charPositionInLine, e);
        }
    }
}
