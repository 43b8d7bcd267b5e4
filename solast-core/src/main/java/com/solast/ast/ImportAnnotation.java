package com.solast.ast;

public record ImportAnnotation(String absolutePath, NodeRef sourceUnit) {
}
