package com.solast.ast;

/**
 * Base interface for all nodes of an analysed Solidity syntax tree.
 *
 * <p>A node owns its structural children. Relationships that are not containment
 * (scopes, resolved declarations, base contracts) are held as {@link NodeRef}s.</p>
 */
public sealed interface Node permits
    Declaration,
    Statement,
    Expression,
    TypeName,
    SourceUnit,
    PragmaDirective,
    InheritanceSpecifier,
    UsingForDirective,
    ParameterList,
    ModifierInvocation {

    /** Process-unique, non-negative id assigned at construction. */
    long id();

    SourceLocation location();

    String nodeType();

    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
