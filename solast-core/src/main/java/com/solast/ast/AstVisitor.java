package com.solast.ast;

/**
 * Visitor over the closed set of node kinds.
 *
 * <p>There is one method per concrete kind, so adding a kind to the tree without handling it
 * here is a compile error in every implementation.</p>
 *
 * @param <R> result of a visit
 * @param <C> context passed down by the caller
 */
public interface AstVisitor<R, C> {
    // Source units and declarations
    R visit(SourceUnit node, C context);
    R visit(PragmaDirective node, C context);
    R visit(ImportDirective node, C context);
    R visit(ContractDefinition node, C context);
    R visit(InheritanceSpecifier node, C context);
    R visit(UsingForDirective node, C context);
    R visit(StructDefinition node, C context);
    R visit(EnumDefinition node, C context);
    R visit(EnumValue node, C context);
    R visit(ParameterList node, C context);
    R visit(FunctionDefinition node, C context);
    R visit(VariableDeclaration node, C context);
    R visit(ModifierDefinition node, C context);
    R visit(ModifierInvocation node, C context);
    R visit(EventDefinition node, C context);

    // Type names
    R visit(ElementaryTypeName node, C context);
    R visit(UserDefinedTypeName node, C context);
    R visit(FunctionTypeName node, C context);
    R visit(Mapping node, C context);
    R visit(ArrayTypeName node, C context);

    // Statements
    R visit(InlineAssembly node, C context);
    R visit(Block node, C context);
    R visit(PlaceholderStatement node, C context);
    R visit(IfStatement node, C context);
    R visit(WhileStatement node, C context);
    R visit(ForStatement node, C context);
    R visit(Continue node, C context);
    R visit(Break node, C context);
    R visit(Return node, C context);
    R visit(Throw node, C context);
    R visit(VariableDeclarationStatement node, C context);
    R visit(ExpressionStatement node, C context);

    // Expressions
    R visit(Conditional node, C context);
    R visit(Assignment node, C context);
    R visit(TupleExpression node, C context);
    R visit(UnaryOperation node, C context);
    R visit(BinaryOperation node, C context);
    R visit(FunctionCall node, C context);
    R visit(NewExpression node, C context);
    R visit(MemberAccess node, C context);
    R visit(IndexAccess node, C context);
    R visit(Identifier node, C context);
    R visit(ElementaryTypeNameExpression node, C context);
    R visit(Literal node, C context);
}
