package org.celshape.parser.ast.expr;

public enum ConstantKind {
    STRING,
    INT64,
    UINT64,
    DOUBLE,
    BOOL,
    NULL,
    BYTES
}
