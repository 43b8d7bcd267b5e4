package com.solast.ast;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public record Literal(
    long id,
    SourceLocation location,
    Token token,
    byte[] value,  // raw bytes, not necessarily valid UTF-8
    Subdenomination subdenomination,  // Can be null
    ExpressionAnnotation annotation
) implements Expression {
    public Literal {
        value = value.clone();
    }

    public Literal(
        SourceLocation location,
        Token token,
        byte[] value,
        Subdenomination subdenomination,
        ExpressionAnnotation annotation
    ) {
        this(NodeIds.next(), location, token, value, subdenomination, annotation);
    }

    public Literal(SourceLocation location, Token token, String value, ExpressionAnnotation annotation) {
        this(NodeIds.next(), location, token, value.getBytes(StandardCharsets.UTF_8), null, annotation);
    }

    /**
     * Returns a copy of the raw bytes.
     */
    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal other)) {
            return false;
        }
        return id == other.id
            && Objects.equals(location, other.location)
            && token == other.token
            && Arrays.equals(value, other.value)
            && subdenomination == other.subdenomination
            && Objects.equals(annotation, other.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, location, token, Arrays.hashCode(value), subdenomination, annotation);
    }

    @Override
    public String toString() {
        return "Literal[id=" + id + ", location=" + location + ", token=" + token
            + ", value=" + Arrays.toString(value) + ", subdenomination=" + subdenomination
            + ", annotation=" + annotation + "]";
    }

    @Override
    public String nodeType() {
        return "Literal";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }
}
