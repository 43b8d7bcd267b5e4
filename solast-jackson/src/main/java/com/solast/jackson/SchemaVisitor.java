package com.solast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solast.ast.*;
import com.solast.jackson.DocumentBuilder.Attribute;
import com.solast.json.InternalCompilerError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The per-kind document schema: which fields of each node kind are embedded as child
 * documents, which are written as id references and which as plain values.
 *
 * <p>One instance serves one conversion. Children are converted before the parent's
 * attribute list is assembled.</p>
 */
final class SchemaVisitor implements AstVisitor<ObjectNode, ConversionContext> {

    private static final Logger logger = LoggerFactory.getLogger(SchemaVisitor.class);

    static final String UNKNOWN_TYPE = "Unknown";

    private final DocumentBuilder builder;
    private final ReferenceResolver references;
    private final JsonNodeFactory nodeFactory;

    SchemaVisitor(DocumentBuilder builder, ReferenceResolver references, JsonNodeFactory nodeFactory) {
        this.builder = builder;
        this.references = references;
        this.nodeFactory = nodeFactory;
    }

    // ==================== Source units and declarations ====================

    @Override
    public ObjectNode visit(SourceUnit node, ConversionContext context) {
        ObjectNode exportedSymbols = nodeFactory.objectNode();
        Map<String, List<NodeRef>> symbols = new TreeMap<>(node.annotation().exportedSymbols());
        symbols.forEach((name, overloads) -> exportedSymbols.set(name, references.idList(overloads)));
        return builder.build(node, "SourceUnit", List.of(
            Attribute.of("absolutePath", node.annotation().path()),
            Attribute.of("exportedSymbols", exportedSymbols),
            Attribute.child("nodes", toJson(node.nodes(), context))
        ));
    }

    @Override
    public ObjectNode visit(PragmaDirective node, ConversionContext context) {
        ArrayNode literals = nodeFactory.arrayNode();
        node.literals().forEach(literals::add);
        return builder.build(node, "PragmaDirective", List.of(
            Attribute.of("literals", literals)
        ));
    }

    @Override
    public ObjectNode visit(ImportDirective node, ConversionContext context) {
        ArrayNode symbolAliases = nodeFactory.arrayNode();
        for (ImportDirective.SymbolAlias alias : node.symbolAliases()) {
            ObjectNode tuple = nodeFactory.objectNode();
            tuple.set("foreign", toJson(alias.foreign(), context));
            tuple.set("local", alias.local() == null ? nodeFactory.nullNode() : nodeFactory.textNode(alias.local()));
            symbolAliases.add(tuple);
        }
        return builder.build(node, "ImportDirective", List.of(
            Attribute.of("file", node.path()),
            Attribute.of("absolutePath", node.annotation().absolutePath()),
            Attribute.of("SourceUnit", references.idOrNull(node.annotation().sourceUnit())),
            Attribute.of("scope", references.idOrNull(node.scope())),
            Attribute.of("unitAlias", node.unitAlias()),
            Attribute.of("symbolAliases", symbolAliases)
        ));
    }

    @Override
    public ObjectNode visit(ContractDefinition node, ConversionContext context) {
        ContractAnnotation annotation = node.annotation();
        return builder.build(node, "ContractDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.of("isLibrary", node.isLibrary()),
            Attribute.of("fullyImplemented", annotation.isFullyImplemented()),
            Attribute.of("linearizedBaseContracts", references.idList(annotation.linearizedBaseContracts())),
            Attribute.of("contractDependencies", references.idList(annotation.contractDependencies())),
            Attribute.child("baseContracts", toJson(node.baseContracts(), context)),
            Attribute.child("nodes", toJson(node.subNodes(), context)),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    @Override
    public ObjectNode visit(InheritanceSpecifier node, ConversionContext context) {
        return builder.build(node, "InheritanceSpecifier", List.of(
            Attribute.child("baseName", toJson(node.baseName(), context)),
            Attribute.child("arguments", toJson(node.arguments(), context))
        ));
    }

    @Override
    public ObjectNode visit(UsingForDirective node, ConversionContext context) {
        return builder.build(node, "UsingForDirective", List.of(
            Attribute.child("libraryName", toJson(node.libraryName(), context)),
            node.typeName() != null
                ? Attribute.child("typeName", toJson(node.typeName(), context))
                : Attribute.of("typeName", "*")
        ));
    }

    @Override
    public ObjectNode visit(StructDefinition node, ConversionContext context) {
        return builder.build(node, "StructDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.of("canonicalName", node.annotation().canonicalName()),
            Attribute.child("members", toJson(node.members(), context)),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    @Override
    public ObjectNode visit(EnumDefinition node, ConversionContext context) {
        return builder.build(node, "EnumDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.of("canonicalName", node.annotation().canonicalName()),
            Attribute.child("members", toJson(node.members(), context)),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    @Override
    public ObjectNode visit(EnumValue node, ConversionContext context) {
        return builder.build(node, "EnumValue", List.of(
            Attribute.of("name", node.name())
        ));
    }

    @Override
    public ObjectNode visit(ParameterList node, ConversionContext context) {
        return builder.build(node, "ParameterList", List.of(
            Attribute.child("parameters", toJson(node.parameters(), context))
        ));
    }

    @Override
    public ObjectNode visit(FunctionDefinition node, ConversionContext context) {
        return builder.build(node, "FunctionDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.of("constant", node.isDeclaredConst()),
            Attribute.of("payable", node.isPayable()),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.child("parameters", toJson(node.parameters(), context)),
            Attribute.of("isConstructor", node.isConstructor()),
            Attribute.child("returnParameters", toJson(node.returnParameters(), context)),
            Attribute.child("modifiers", toJson(node.modifiers(), context)),
            Attribute.child("body", node.isImplemented() ? toJson(node.body(), context) : nodeFactory.nullNode()),
            Attribute.of("isImplemented", node.isImplemented()),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    @Override
    public ObjectNode visit(VariableDeclaration node, ConversionContext context) {
        List<Attribute> attributes = new ArrayList<>(List.of(
            Attribute.of("name", node.name()),
            Attribute.of("type", type(node.type())),
            Attribute.of("constant", node.isConstant()),
            Attribute.of("storageLocation", location(node.storageLocation())),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.child("value", toJson(node.value(), context)),
            Attribute.of("scope", references.idOrNull(node.scope())),
            Attribute.child("typeName", toJson(node.typeName(), context))
        ));
        if (context.inEvent()) {
            attributes.add(Attribute.of("indexed", node.isIndexed()));
        }
        return builder.build(node, "VariableDeclaration", attributes);
    }

    @Override
    public ObjectNode visit(ModifierDefinition node, ConversionContext context) {
        return builder.build(node, "ModifierDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.child("parameters", toJson(node.parameters(), context)),
            Attribute.child("body", toJson(node.body(), context)),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    @Override
    public ObjectNode visit(ModifierInvocation node, ConversionContext context) {
        return builder.build(node, "ModifierInvocation", List.of(
            Attribute.of("name", node.modifierName().name()),
            Attribute.child("modifierName", toJson(node.modifierName(), context)),
            Attribute.child("arguments", toJson(node.arguments(), context))
        ));
    }

    @Override
    public ObjectNode visit(EventDefinition node, ConversionContext context) {
        ConversionContext inner = context.enterEvent();
        return builder.build(node, "EventDefinition", List.of(
            Attribute.of("name", node.name()),
            Attribute.child("parameters", toJson(node.parameters(), inner)),
            Attribute.of("isAnonymous", node.isAnonymous()),
            Attribute.of("scope", references.idOrNull(node.scope()))
        ));
    }

    // ==================== Type names ====================

    @Override
    public ObjectNode visit(ElementaryTypeName node, ConversionContext context) {
        return builder.build(node, "ElementaryTypeName", List.of(
            Attribute.of("name", node.name())
        ));
    }

    @Override
    public ObjectNode visit(UserDefinedTypeName node, ConversionContext context) {
        return builder.build(node, "UserDefinedTypeName", List.of(
            Attribute.of("name", String.join(".", node.namePath())),
            Attribute.of("referencedDeclaration", references.idOrNull(node.annotation().referencedDeclaration())),
            Attribute.of("contractScope", references.idOrNull(node.annotation().contractScope()))
        ));
    }

    @Override
    public ObjectNode visit(FunctionTypeName node, ConversionContext context) {
        return builder.build(node, "FunctionTypeName", List.of(
            Attribute.of("payable", node.isPayable()),
            Attribute.of("visibility", visibility(node.visibility())),
            Attribute.of("constant", node.isDeclaredConst()),
            Attribute.child("parameterTypes", toJson(node.parameterTypes(), context)),
            Attribute.child("returnParameterTypes", toJson(node.returnParameterTypes(), context))
        ));
    }

    @Override
    public ObjectNode visit(Mapping node, ConversionContext context) {
        return builder.build(node, "Mapping", List.of(
            Attribute.child("keyType", toJson(node.keyType(), context)),
            Attribute.child("valueType", toJson(node.valueType(), context))
        ));
    }

    @Override
    public ObjectNode visit(ArrayTypeName node, ConversionContext context) {
        return builder.build(node, "ArrayTypeName", List.of(
            Attribute.child("baseType", toJson(node.baseType(), context)),
            Attribute.child("length", toJson(node.length(), context))
        ));
    }

    // ==================== Statements ====================

    @Override
    public ObjectNode visit(InlineAssembly node, ConversionContext context) {
        return builder.build(node, "InlineAssembly", List.of(
            Attribute.of("operations", node.operations())
        ));
    }

    @Override
    public ObjectNode visit(Block node, ConversionContext context) {
        return builder.build(node, "Block", List.of(
            Attribute.child("statements", toJson(node.statements(), context))
        ));
    }

    @Override
    public ObjectNode visit(PlaceholderStatement node, ConversionContext context) {
        return builder.build(node, "PlaceholderStatement", List.of());
    }

    @Override
    public ObjectNode visit(IfStatement node, ConversionContext context) {
        return builder.build(node, "IfStatement", List.of(
            Attribute.child("condition", toJson(node.condition(), context)),
            Attribute.child("trueBody", toJson(node.trueBody(), context)),
            Attribute.child("falseBody", toJson(node.falseBody(), context))
        ));
    }

    @Override
    public ObjectNode visit(WhileStatement node, ConversionContext context) {
        return builder.build(node, node.isDoWhile() ? "DoWhileStatement" : "WhileStatement", List.of(
            Attribute.child("condition", toJson(node.condition(), context)),
            Attribute.child("body", toJson(node.body(), context))
        ));
    }

    @Override
    public ObjectNode visit(ForStatement node, ConversionContext context) {
        return builder.build(node, "ForStatement", List.of(
            Attribute.child("initExpression", toJson(node.initExpression(), context)),
            Attribute.child("condition", toJson(node.condition(), context)),
            Attribute.child("loopExpression", toJson(node.loopExpression(), context)),
            Attribute.child("body", toJson(node.body(), context))
        ));
    }

    @Override
    public ObjectNode visit(Continue node, ConversionContext context) {
        return builder.build(node, "Continue", List.of());
    }

    @Override
    public ObjectNode visit(Break node, ConversionContext context) {
        return builder.build(node, "Break", List.of());
    }

    @Override
    public ObjectNode visit(Return node, ConversionContext context) {
        return builder.build(node, "Return", List.of(
            Attribute.child("expression", toJson(node.expression(), context)),
            Attribute.of("functionReturnParameters", references.idOrNull(node.annotation().functionReturnParameters()))
        ));
    }

    @Override
    public ObjectNode visit(Throw node, ConversionContext context) {
        return builder.build(node, "Throw", List.of());
    }

    @Override
    public ObjectNode visit(VariableDeclarationStatement node, ConversionContext context) {
        return builder.build(node, "VariableDeclarationStatement", List.of(
            Attribute.of("declarationIDs", references.idList(node.annotation().assignments())),
            Attribute.child("declarations", toJson(node.declarations(), context)),
            Attribute.child("initialValue", toJson(node.initialValue(), context))
        ));
    }

    @Override
    public ObjectNode visit(ExpressionStatement node, ConversionContext context) {
        return builder.build(node, "ExpressionStatement", List.of(
            Attribute.child("expression", toJson(node.expression(), context))
        ));
    }

    // ==================== Expressions ====================

    @Override
    public ObjectNode visit(Conditional node, ConversionContext context) {
        return builder.build(node, "Conditional", List.of(
            Attribute.child("condition", toJson(node.condition(), context)),
            Attribute.child("trueExpression", toJson(node.trueExpression(), context)),
            Attribute.child("falseExpression", toJson(node.falseExpression(), context)),
            Attribute.of("type", type(node))
        ));
    }

    @Override
    public ObjectNode visit(Assignment node, ConversionContext context) {
        return builder.build(node, "Assignment", List.of(
            Attribute.of("operator", node.operator().symbol()),
            Attribute.of("type", type(node)),
            Attribute.child("leftHandSide", toJson(node.leftHandSide(), context)),
            Attribute.child("rightHandSide", toJson(node.rightHandSide(), context))
        ));
    }

    @Override
    public ObjectNode visit(TupleExpression node, ConversionContext context) {
        return builder.build(node, "TupleExpression", List.of(
            Attribute.of("isInlineArray", node.isInlineArray()),
            Attribute.child("components", toJson(node.components(), context)),
            Attribute.of("type", type(node))
        ));
    }

    @Override
    public ObjectNode visit(UnaryOperation node, ConversionContext context) {
        return builder.build(node, "UnaryOperation", List.of(
            Attribute.of("prefix", node.isPrefix()),
            Attribute.of("operator", node.operator().symbol()),
            Attribute.of("type", type(node)),
            Attribute.child("subExpression", toJson(node.subExpression(), context))
        ));
    }

    @Override
    public ObjectNode visit(BinaryOperation node, ConversionContext context) {
        return builder.build(node, "BinaryOperation", List.of(
            Attribute.of("operator", node.operator().symbol()),
            Attribute.of("type", type(node)),
            Attribute.of("commonType", type(node.commonType())),
            Attribute.child("leftExpression", toJson(node.leftExpression(), context)),
            Attribute.child("rightExpression", toJson(node.rightExpression(), context))
        ));
    }

    @Override
    public ObjectNode visit(FunctionCall node, ConversionContext context) {
        ArrayNode names = nodeFactory.arrayNode();
        node.names().forEach(names::add);
        return builder.build(node, "FunctionCall", List.of(
            Attribute.of("type_conversion", node.isTypeConversion()),
            Attribute.of("isStructConstructorCall", node.isStructConstructorCall()),
            Attribute.of("type", type(node)),
            Attribute.child("arguments", toJson(node.arguments(), context)),
            Attribute.child("expression", toJson(node.expression(), context)),
            Attribute.of("names", names)
        ));
    }

    @Override
    public ObjectNode visit(NewExpression node, ConversionContext context) {
        return builder.build(node, "NewExpression", List.of(
            Attribute.of("type", type(node)),
            Attribute.child("typeName", toJson(node.typeName(), context))
        ));
    }

    @Override
    public ObjectNode visit(MemberAccess node, ConversionContext context) {
        return builder.build(node, "MemberAccess", List.of(
            Attribute.of("memberName", node.memberName()),
            Attribute.of("type", type(node)),
            Attribute.child("expression", toJson(node.expression(), context)),
            Attribute.of("referencedDeclaration", references.idOrNull(node.referencedDeclaration()))
        ));
    }

    @Override
    public ObjectNode visit(IndexAccess node, ConversionContext context) {
        return builder.build(node, "IndexAccess", List.of(
            Attribute.of("type", type(node)),
            Attribute.child("baseExpression", toJson(node.baseExpression(), context)),
            Attribute.child("indexExpression", toJson(node.indexExpression(), context))
        ));
    }

    @Override
    public ObjectNode visit(Identifier node, ConversionContext context) {
        return builder.build(node, "Identifier", List.of(
            Attribute.of("value", node.name()),
            Attribute.of("type", type(node)),
            Attribute.of("referencedDeclaration", references.idOrNull(node.referencedDeclaration())),
            Attribute.of("overloadedDeclarations", references.idList(node.overloadedDeclarations()))
        ));
    }

    @Override
    public ObjectNode visit(ElementaryTypeNameExpression node, ConversionContext context) {
        ExpressionAnnotation annotation = node.annotation();
        return builder.build(node, "ElementaryTypeNameExpression", List.of(
            Attribute.of("value", node.typeName()),
            Attribute.of("type", type(node)),
            Attribute.of("isConstant", annotation.isConstant()),
            Attribute.of("isPure", annotation.isPure()),
            Attribute.of("isLValue", annotation.isLValue()),
            Attribute.of("lValueRequested", annotation.lValueRequested())
        ));
    }

    @Override
    public ObjectNode visit(Literal node, ConversionContext context) {
        String value = decodeUtf8(node.value());
        if (value == null) {
            logger.debug("Literal {} is not valid UTF-8, writing only its hex value", node.id());
        }
        return builder.build(node, "Literal", List.of(
            Attribute.of("token", node.token().symbol()),
            Attribute.of("value", value),
            Attribute.of("hexvalue", HexFormat.of().formatHex(node.value())),
            Attribute.of("subdenomination", node.subdenomination() == null ? null : node.subdenomination().label()),
            Attribute.of("type", type(node))
        ));
    }

    // ==================== Helpers ====================

    private JsonNode toJson(Node node, ConversionContext context) {
        return node == null ? nodeFactory.nullNode() : node.accept(this, context);
    }

    private ArrayNode toJson(List<? extends Node> nodes, ConversionContext context) {
        ArrayNode documents = nodeFactory.arrayNode();
        for (Node node : nodes) {
            documents.add(toJson(node, context));
        }
        return documents;
    }

    private static String type(Expression expression) {
        return type(expression.annotation().type());
    }

    private static String type(ResolvedType type) {
        return type == null ? UNKNOWN_TYPE : type.displayName();
    }

    static String visibility(Visibility visibility) {
        switch (visibility) {
            case PRIVATE:
                return "private";
            case INTERNAL:
                return "internal";
            case PUBLIC:
                return "public";
            case EXTERNAL:
                return "external";
            default:
                throw new InternalCompilerError("Unknown declaration visibility.");
        }
    }

    static String location(StorageLocation location) {
        switch (location) {
            case DEFAULT:
                return "default";
            case STORAGE:
                return "storage";
            case MEMORY:
                return "memory";
            default:
                throw new InternalCompilerError("Unknown declaration location.");
        }
    }

    /**
     * Returns the text of the bytes, or null if they are not well-formed UTF-8.
     */
    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
