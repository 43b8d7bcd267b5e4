package com.solast.ast;

public sealed interface Expression extends Node permits
    Conditional,
    Assignment,
    TupleExpression,
    UnaryOperation,
    BinaryOperation,
    FunctionCall,
    NewExpression,
    MemberAccess,
    IndexAccess,
    Identifier,
    ElementaryTypeNameExpression,
    Literal {

    ExpressionAnnotation annotation();
}
