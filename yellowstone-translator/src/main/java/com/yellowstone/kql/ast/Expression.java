package com.yellowstone.kql.ast;

/**
 * Condition and projection expressions.
 */
public sealed interface Expression extends AstNode permits PropertyAccess,
        VariableRef, Literal, FunctionCall, Comparison, And, Or, Not,
        NullCheck {
}
