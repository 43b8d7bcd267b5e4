package com.solast.ast;

/**
 * Operator and literal tokens that survive into the tree.
 */
public enum Token {
    // Assignment operators
    ASSIGN("="),
    ASSIGN_BIT_OR("|="),
    ASSIGN_BIT_XOR("^="),
    ASSIGN_BIT_AND("&="),
    ASSIGN_SHL("<<="),
    ASSIGN_SAR(">>="),
    ASSIGN_SHR(">>>="),
    ASSIGN_ADD("+="),
    ASSIGN_SUB("-="),
    ASSIGN_MUL("*="),
    ASSIGN_DIV("/="),
    ASSIGN_MOD("%="),

    // Binary operators
    OR("||"),
    AND("&&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_AND("&"),
    SHL("<<"),
    SAR(">>"),
    SHR(">>>"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EXP("**"),
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">="),

    // Unary operators
    NOT("!"),
    BIT_NOT("~"),
    INC("++"),
    DEC("--"),
    DELETE("delete"),

    // Literal kinds
    TRUE_LITERAL("true"),
    FALSE_LITERAL("false"),
    NUMBER("number"),
    STRING_LITERAL("string");

    private final String symbol;

    Token(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
