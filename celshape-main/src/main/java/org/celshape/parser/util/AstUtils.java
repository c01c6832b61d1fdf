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

package org.celshape.parser.util;

import java.util.Map;

import org.celshape.parser.ast.expr.Operator;

public class AstUtils {

    private static final Map<String, Operator> OPERATOR_MAP = Map.ofEntries(
            Map.entry("==", Operator.EQUALS),
            Map.entry("!=", Operator.NOT_EQUALS),
            Map.entry("<", Operator.LESS),
            Map.entry(">", Operator.GREATER),
            Map.entry("<=", Operator.LESS_EQUALS),
            Map.entry(">=", Operator.GREATER_EQUALS),
            Map.entry("in", Operator.IN),
            Map.entry("+", Operator.ADD),
            Map.entry("-", Operator.SUBTRACT),
            Map.entry("*", Operator.MULTIPLY),
            Map.entry("/", Operator.DIVIDE),
            Map.entry("%", Operator.MODULO)
    );

    private AstUtils() {
    }

    public static Operator getBinaryOperator(String operatorText) {
        Operator operator = OPERATOR_MAP.get(operatorText);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operatorText);
        }
        return operator;
    }

    /**
     * Parses a CEL int literal, decimal or {@code 0x} hex. Out of range values throw {@link NumberFormatException}.
     */
    public static long parseInt(String text, boolean negative) {
        String sign = negative ? "-" : "";
        if (text.startsWith("0x")) {
            return Long.parseLong(sign + text.substring(2), 16);
        }
        return Long.parseLong(sign + text);
    }

    /**
     * Parses a CEL uint literal such as {@code 42u} or {@code 0xFFu}. The result carries the unsigned bit pattern.
     */
    public static long parseUint(String text) {
        String value = text.substring(0, text.length() - 1);
        if (value.startsWith("0x")) {
            return Long.parseUnsignedLong(value.substring(2), 16);
        }
        return Long.parseUnsignedLong(value);
    }

    /**
     * Strips quotes from a STRING token and resolves its escape sequences. Raw strings ({@code r'...'}) are
     * returned verbatim.
     */
    public static String unquote(String token) {
        boolean raw = false;
        String text = token;
        if (text.charAt(0) == 'r' || text.charAt(0) == 'R') {
            raw = true;
            text = text.substring(1);
        }
        int quoteLength = text.startsWith("\"\"\"") || text.startsWith("'''") ? 3 : 1;
        String body = text.substring(quoteLength, text.length() - quoteLength);
        return raw ? body : unescape(body);
    }

    static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= body.length()) {
                throw new IllegalArgumentException("Dangling escape at end of string literal");
            }
            char e = body.charAt(i++);
            switch (e) {
                case 'a': sb.append('\u0007'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'v': sb.append('\u000B'); break;
                case '"':
                case '\'':
                case '\\':
                case '?':
                case '`':
                    sb.append(e);
                    break;
                case 'x':
                case 'X':
                    sb.appendCodePoint(hex(body, i, 2));
                    i += 2;
                    break;
                case 'u':
                    sb.appendCodePoint(hex(body, i, 4));
                    i += 4;
                    break;
                case 'U':
                    sb.appendCodePoint(hex(body, i, 8));
                    i += 8;
                    break;
                default:
                    if (e >= '0' && e <= '3' && i + 2 <= body.length()) {
                        sb.appendCodePoint(Integer.parseInt(body.substring(i - 1, i + 2), 8));
                        i += 2;
                    } else {
                        throw new IllegalArgumentException("Invalid escape sequence: \\" + e);
                    }
            }
        }
        return sb.toString();
    }

    private static int hex(String body, int start, int length) {
        if (start + length > body.length()) {
            throw new IllegalArgumentException("Truncated escape sequence in string literal");
        }
        int codePoint = Integer.parseInt(body.substring(start, start + length), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point in escape sequence: " + codePoint);
        }
        return codePoint;
    }
}
