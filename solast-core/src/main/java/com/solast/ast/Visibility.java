package com.solast.ast;

public enum Visibility {
    DEFAULT,
    PRIVATE,
    INTERNAL,
    PUBLIC,
    EXTERNAL
}
