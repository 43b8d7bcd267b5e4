package com.solast.ast;

public sealed interface Statement extends Node permits
    Block,
    PlaceholderStatement,
    IfStatement,
    WhileStatement,
    ForStatement,
    Continue,
    Break,
    Return,
    Throw,
    VariableDeclarationStatement,
    ExpressionStatement,
    InlineAssembly {
}
