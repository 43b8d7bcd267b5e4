package com.solast.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Structural navigation over the syntax tree.
 *
 * <p>Only owned children are reported; {@link NodeRef}s are never followed.</p>
 */
public final class Nodes {

    private static final ChildCollector CHILDREN = new ChildCollector();

    private Nodes() {
        // Utility class
    }

    /**
     * Returns the structural children of a node in source order. Absent optional children are skipped.
     */
    public static List<Node> children(Node node) {
        return node.accept(CHILDREN, null);
    }

    /**
     * Visits the root and all of its descendants in pre-order.
     */
    public static void walk(Node root, Consumer<Node> action) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            action.accept(node);
            List<Node> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Counts the nodes reachable from the root, the root included.
     */
    public static int count(Node root) {
        int[] count = {0};
        walk(root, node -> count[0]++);
        return count[0];
    }

    private static final class ChildCollector implements AstVisitor<List<Node>, Void> {

        private static List<Node> of(Object... parts) {
            List<Node> result = new ArrayList<>();
            for (Object part : parts) {
                if (part instanceof Node n) {
                    result.add(n);
                } else if (part instanceof Collection<?> c) {
                    for (Object element : c) {
                        if (element instanceof Node n) {
                            result.add(n);
                        }
                    }
                }
            }
            return result;
        }

        @Override
        public List<Node> visit(SourceUnit node, Void context) {
            return of(node.nodes());
        }

        @Override
        public List<Node> visit(PragmaDirective node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(ImportDirective node, Void context) {
            List<Node> result = new ArrayList<>();
            for (ImportDirective.SymbolAlias alias : node.symbolAliases()) {
                result.add(alias.foreign());
            }
            return result;
        }

        @Override
        public List<Node> visit(ContractDefinition node, Void context) {
            return of(node.baseContracts(), node.subNodes());
        }

        @Override
        public List<Node> visit(InheritanceSpecifier node, Void context) {
            return of(node.baseName(), node.arguments());
        }

        @Override
        public List<Node> visit(UsingForDirective node, Void context) {
            return of(node.libraryName(), node.typeName());
        }

        @Override
        public List<Node> visit(StructDefinition node, Void context) {
            return of(node.members());
        }

        @Override
        public List<Node> visit(EnumDefinition node, Void context) {
            return of(node.members());
        }

        @Override
        public List<Node> visit(EnumValue node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(ParameterList node, Void context) {
            return of(node.parameters());
        }

        @Override
        public List<Node> visit(FunctionDefinition node, Void context) {
            return of(node.parameters(), node.returnParameters(), node.modifiers(), node.body());
        }

        @Override
        public List<Node> visit(VariableDeclaration node, Void context) {
            return of(node.typeName(), node.value());
        }

        @Override
        public List<Node> visit(ModifierDefinition node, Void context) {
            return of(node.parameters(), node.body());
        }

        @Override
        public List<Node> visit(ModifierInvocation node, Void context) {
            return of(node.modifierName(), node.arguments());
        }

        @Override
        public List<Node> visit(EventDefinition node, Void context) {
            return of(node.parameters());
        }

        @Override
        public List<Node> visit(ElementaryTypeName node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(UserDefinedTypeName node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(FunctionTypeName node, Void context) {
            return of(node.parameterTypes(), node.returnParameterTypes());
        }

        @Override
        public List<Node> visit(Mapping node, Void context) {
            return of(node.keyType(), node.valueType());
        }

        @Override
        public List<Node> visit(ArrayTypeName node, Void context) {
            return of(node.baseType(), node.length());
        }

        @Override
        public List<Node> visit(InlineAssembly node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(Block node, Void context) {
            return of(node.statements());
        }

        @Override
        public List<Node> visit(PlaceholderStatement node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(IfStatement node, Void context) {
            return of(node.condition(), node.trueBody(), node.falseBody());
        }

        @Override
        public List<Node> visit(WhileStatement node, Void context) {
            return of(node.condition(), node.body());
        }

        @Override
        public List<Node> visit(ForStatement node, Void context) {
            return of(node.initExpression(), node.condition(), node.loopExpression(), node.body());
        }

        @Override
        public List<Node> visit(Continue node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(Break node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(Return node, Void context) {
            return of(node.expression());
        }

        @Override
        public List<Node> visit(Throw node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(VariableDeclarationStatement node, Void context) {
            return of(node.declarations(), node.initialValue());
        }

        @Override
        public List<Node> visit(ExpressionStatement node, Void context) {
            return of(node.expression());
        }

        @Override
        public List<Node> visit(Conditional node, Void context) {
            return of(node.condition(), node.trueExpression(), node.falseExpression());
        }

        @Override
        public List<Node> visit(Assignment node, Void context) {
            return of(node.leftHandSide(), node.rightHandSide());
        }

        @Override
        public List<Node> visit(TupleExpression node, Void context) {
            return of(node.components());
        }

        @Override
        public List<Node> visit(UnaryOperation node, Void context) {
            return of(node.subExpression());
        }

        @Override
        public List<Node> visit(BinaryOperation node, Void context) {
            return of(node.leftExpression(), node.rightExpression());
        }

        @Override
        public List<Node> visit(FunctionCall node, Void context) {
            return of(node.arguments(), node.expression());
        }

        @Override
        public List<Node> visit(NewExpression node, Void context) {
            return of(node.typeName());
        }

        @Override
        public List<Node> visit(MemberAccess node, Void context) {
            return of(node.expression());
        }

        @Override
        public List<Node> visit(IndexAccess node, Void context) {
            return of(node.baseExpression(), node.indexExpression());
        }

        @Override
        public List<Node> visit(Identifier node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(ElementaryTypeNameExpression node, Void context) {
            return List.of();
        }

        @Override
        public List<Node> visit(Literal node, Void context) {
            return List.of();
        }
    }
}
