package com.solast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solast.ast.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.solast.jackson.DocumentTrees.documentFor;
import static com.solast.jackson.DocumentTrees.keys;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Attribute sets of individual node kinds, checked on the kitchen sink tree.
 */
public class SchemaVisitorTest {

    private SampleTrees.KitchenSink sink;
    private ObjectNode root;

    @BeforeEach
    void convert() {
        sink = new SampleTrees.KitchenSink(new SampleTrees.Library());
        root = new AstJsonConverter().toJson(sink.unit, NodeIndex.of(sink.unit, sink.library.unit));
    }

    private JsonNode doc(Node node) {
        return documentFor(root, node.id());
    }

    @Test
    void testSourceUnitExportedSymbolsAreSortedByName() {
        assertEquals("/project/k.sol", root.get("absolutePath").asText());
        JsonNode exported = root.get("exportedSymbols");
        assertEquals(List.of("Base", "K"), keys(exported));
        assertEquals(sink.base.id(), exported.get("Base").get(0).asLong());
        assertEquals(sink.contract.id(), exported.get("K").get(0).asLong());
    }

    @Test
    void testPragmaAndImport() {
        JsonNode pragma = root.get("nodes").get(0);
        assertEquals("PragmaDirective", pragma.get("nodeType").asText());
        assertEquals(4, pragma.get("literals").size());
        assertEquals("solidity", pragma.get("literals").get(0).asText());
        assertEquals(".11", pragma.get("literals").get(3).asText());

        JsonNode importDirective = root.get("nodes").get(1);
        assertEquals(List.of("id", "src", "nodeType", "file", "absolutePath", "SourceUnit", "scope", "unitAlias",
            "symbolAliases"), keys(importDirective));
        assertEquals("./lib.sol", importDirective.get("file").asText());
        assertEquals("L", importDirective.get("unitAlias").asText());
        assertEquals(sink.library.unit.id(), importDirective.get("SourceUnit").asLong());
        assertEquals(sink.unit.id(), importDirective.get("scope").asLong());

        JsonNode alias = importDirective.get("symbolAliases").get(0);
        assertEquals("M", alias.get("local").asText());
        assertEquals("Identifier", alias.get("foreign").get("nodeType").asText());
        assertEquals(sink.library.math.id(), alias.get("foreign").get("referencedDeclaration").asLong());
    }

    @Test
    void testContractDefinition() {
        JsonNode contract = doc(sink.contract);
        assertEquals(List.of("id", "src", "nodeType", "name", "isLibrary", "fullyImplemented",
            "linearizedBaseContracts", "contractDependencies", "baseContracts", "nodes", "scope"), keys(contract));
        assertFalse(contract.get("isLibrary").asBoolean());
        assertFalse(contract.get("fullyImplemented").asBoolean());
        assertEquals(2, contract.get("linearizedBaseContracts").size());
        assertEquals(sink.base.id(), contract.get("contractDependencies").get(0).asLong());

        JsonNode inheritance = contract.get("baseContracts").get(0);
        assertEquals("InheritanceSpecifier", inheritance.get("nodeType").asText());
        assertEquals("Base", inheritance.get("baseName").get("name").asText());
        assertEquals(sink.base.id(), inheritance.get("baseName").get("referencedDeclaration").asLong());
        assertEquals("1", inheritance.get("arguments").get(0).get("value").asText());
    }

    @Test
    void testUsingForWithAndWithoutTypeName() {
        JsonNode members = doc(sink.contract).get("nodes");
        JsonNode usingForUint = members.get(0);
        JsonNode usingForAll = members.get(1);

        assertEquals("UsingForDirective", usingForUint.get("nodeType").asText());
        assertEquals("L.Math", usingForUint.get("libraryName").get("name").asText());
        assertEquals("ElementaryTypeName", usingForUint.get("typeName").get("nodeType").asText());
        assertEquals("uint", usingForUint.get("typeName").get("name").asText());

        assertTrue(usingForAll.get("typeName").isTextual());
        assertEquals("*", usingForAll.get("typeName").asText());
    }

    @Test
    void testWireKeyNames() {
        JsonNode usingFor = doc(sink.contract).get("nodes").get(0);
        assertEquals(List.of("id", "src", "nodeType", "libraryName", "typeName"), keys(usingFor));

        JsonNode structCall = doc(sink.g).get("body").get("statements").get(6).get("initialValue");
        assertEquals(List.of("id", "src", "nodeType", "type_conversion", "isStructConstructorCall", "type",
            "arguments", "expression", "names"), keys(structCall));
    }

    @Test
    void testStructAndEnum() {
        JsonNode members = doc(sink.contract).get("nodes");
        JsonNode struct = members.get(2);
        assertEquals("StructDefinition", struct.get("nodeType").asText());
        assertEquals("K.S", struct.get("canonicalName").asText());
        assertEquals("public", struct.get("visibility").asText());
        assertEquals(sink.contract.id(), struct.get("scope").asLong());
        assertEquals(1, struct.get("members").size());

        JsonNode enumDefinition = members.get(3);
        assertEquals("EnumDefinition", enumDefinition.get("nodeType").asText());
        assertEquals("K.E", enumDefinition.get("canonicalName").asText());
        assertEquals(List.of("id", "src", "nodeType", "name"), keys(enumDefinition.get("members").get(0)));
        assertEquals("B", enumDefinition.get("members").get(1).get("name").asText());
    }

    @Test
    void testTypeNames() {
        JsonNode members = doc(sink.contract).get("nodes");

        JsonNode mapping = members.get(4).get("typeName");
        assertEquals("Mapping", mapping.get("nodeType").asText());
        assertEquals("address", mapping.get("keyType").get("name").asText());
        assertEquals("ArrayTypeName", mapping.get("valueType").get("nodeType").asText());
        assertTrue(mapping.get("valueType").get("length").isNull());

        JsonNode fixedArray = members.get(5).get("typeName");
        assertEquals("3", fixedArray.get("length").get("value").asText());

        JsonNode functionType = members.get(6).get("typeName");
        assertEquals("FunctionTypeName", functionType.get("nodeType").asText());
        assertEquals("external", functionType.get("visibility").asText());
        assertFalse(functionType.get("payable").asBoolean());
        assertEquals("ParameterList", functionType.get("parameterTypes").get("nodeType").asText());
        assertEquals("bool", functionType.get("returnParameterTypes").get("parameters").get(0).get("typeName").get("name").asText());
        assertEquals(functionType.get("id").asLong(),
            functionType.get("parameterTypes").get("parameters").get(0).get("scope").asLong());
    }

    @Test
    void testVariableDeclarationKeys() {
        JsonNode owner = doc(sink.contract).get("nodes").get(7);
        assertEquals(List.of("id", "src", "nodeType", "name", "type", "constant", "storageLocation", "visibility",
            "value", "scope", "typeName"), keys(owner));
        assertTrue(owner.get("constant").asBoolean());
        assertEquals("public", owner.get("visibility").asText());
        assertTrue(owner.get("value").isNull());
    }

    @Test
    void testMissingTypeIsWrittenAsUnknown() {
        JsonNode owner = doc(sink.contract).get("nodes").get(7);
        assertEquals(SchemaVisitor.UNKNOWN_TYPE, owner.get("type").asText());

        JsonNode foreign = root.get("nodes").get(1).get("symbolAliases").get(0).get("foreign");
        assertEquals("Unknown", foreign.get("type").asText());
    }

    @Test
    void testMissingCommonTypeIsWrittenAsUnknown() {
        SourceLocation src = new SourceLocation(0, 5, "u.sol");
        BinaryOperation operation = new BinaryOperation(src,
            new Literal(src, Token.NUMBER, "1", ExpressionAnnotation.of("int_const 1")), Token.ADD,
            new Literal(src, Token.NUMBER, "2", ExpressionAnnotation.of("int_const 2")), null,
            ExpressionAnnotation.unknown());

        ObjectNode document = new AstJsonConverter().toJson(operation);
        assertEquals("Unknown", document.get("commonType").asText());
        assertEquals("Unknown", document.get("type").asText());
        assertEquals("2", document.get("rightExpression").get("value").asText());
    }

    @Test
    void testFunctionDefinitions() {
        JsonNode g = doc(sink.g);
        assertEquals(List.of("id", "src", "nodeType", "name", "constant", "payable", "visibility", "parameters",
            "isConstructor", "returnParameters", "modifiers", "body", "isImplemented", "scope"), keys(g));
        assertTrue(g.get("isImplemented").asBoolean());
        assertEquals("Block", g.get("body").get("nodeType").asText());

        JsonNode invocation = g.get("modifiers").get(0);
        assertEquals("ModifierInvocation", invocation.get("nodeType").asText());
        assertEquals("onlyOwner", invocation.get("name").asText());
        assertEquals(sink.onlyOwner.id(), invocation.get("modifierName").get("referencedDeclaration").asLong());
        assertEquals(1, invocation.get("arguments").size());

        JsonNode abs = doc(sink.abs);
        assertFalse(abs.get("isImplemented").asBoolean());
        assertTrue(abs.has("body"));
        assertTrue(abs.get("body").isNull());
        assertTrue(abs.get("constant").asBoolean());

        JsonNode constructor = doc(sink.contract).get("nodes").get(10);
        assertTrue(constructor.get("isConstructor").asBoolean());
        assertTrue(constructor.get("payable").asBoolean());
    }

    @Test
    void testModifierDefinition() {
        JsonNode modifier = doc(sink.onlyOwner);
        assertEquals("ModifierDefinition", modifier.get("nodeType").asText());
        assertEquals("internal", modifier.get("visibility").asText());
        assertEquals("PlaceholderStatement", modifier.get("body").get("statements").get(0).get("nodeType").asText());
        assertEquals(modifier.get("id").asLong(),
            modifier.get("parameters").get("parameters").get(0).get("scope").asLong());
    }

    @Test
    void testStatements() {
        JsonNode statements = doc(sink.g).get("body").get("statements");

        JsonNode declaration = statements.get(0);
        assertEquals("VariableDeclarationStatement", declaration.get("nodeType").asText());
        assertEquals(declaration.get("declarations").get(0).get("id").asLong(),
            declaration.get("declarationIDs").get(0).asLong());
        assertEquals("BinaryOperation", declaration.get("initialValue").get("nodeType").asText());

        JsonNode tupleDeclaration = statements.get(1);
        assertEquals(2, tupleDeclaration.get("declarations").size());
        assertTrue(tupleDeclaration.get("declarations").get(1).isNull());
        assertTrue(tupleDeclaration.get("declarationIDs").get(1).isNull());
        assertTrue(tupleDeclaration.get("declarations").get(0).get("typeName").isNull());

        JsonNode ifStatement = statements.get(2);
        assertEquals("IfStatement", ifStatement.get("nodeType").asText());
        assertEquals("Throw", ifStatement.get("trueBody").get("statements").get(0).get("nodeType").asText());
        JsonNode returnStatement = ifStatement.get("falseBody").get("statements").get(0);
        assertEquals(doc(sink.g).get("returnParameters").get("id").asLong(),
            returnStatement.get("functionReturnParameters").asLong());

        assertEquals("WhileStatement", statements.get(3).get("nodeType").asText());
        assertEquals("Continue", statements.get(3).get("body").get("statements").get(1).get("nodeType").asText());
        assertEquals("DoWhileStatement", statements.get(4).get("nodeType").asText());
        assertEquals("Break", statements.get(4).get("body").get("statements").get(0).get("nodeType").asText());

        JsonNode forStatement = statements.get(5);
        assertEquals(List.of("id", "src", "nodeType", "initExpression", "condition", "loopExpression", "body"),
            keys(forStatement));
        assertEquals("VariableDeclarationStatement", forStatement.get("initExpression").get("nodeType").asText());
        assertEquals("ExpressionStatement", forStatement.get("loopExpression").get("nodeType").asText());

        JsonNode assembly = statements.get(12);
        assertEquals("InlineAssembly", assembly.get("nodeType").asText());
        assertEquals("{ pop(0) }", assembly.get("operations").asText());
    }

    @Test
    void testOperators() {
        JsonNode statements = doc(sink.g).get("body").get("statements");

        JsonNode addition = statements.get(0).get("initialValue");
        assertEquals("+", addition.get("operator").asText());
        assertEquals("uint256", addition.get("commonType").asText());
        assertEquals(sink.gParam.id(), addition.get("leftExpression").get("referencedDeclaration").asLong());
        assertEquals("1", addition.get("rightExpression").get("value").asText());

        JsonNode not = statements.get(2).get("condition");
        assertEquals("UnaryOperation", not.get("nodeType").asText());
        assertEquals("!", not.get("operator").asText());
        assertTrue(not.get("prefix").asBoolean());
        assertEquals("TupleExpression", not.get("subExpression").get("nodeType").asText());
        assertEquals("bool", not.get("subExpression").get("type").asText());

        JsonNode increment = statements.get(3).get("body").get("statements").get(0).get("expression");
        assertEquals("++", increment.get("operator").asText());
        assertFalse(increment.get("prefix").asBoolean());

        JsonNode compoundAssignment = statements.get(11).get("expression");
        assertEquals("+=", compoundAssignment.get("operator").asText());
        JsonNode inlineArray = compoundAssignment.get("rightHandSide").get("baseExpression");
        assertTrue(inlineArray.get("isInlineArray").asBoolean());
        assertEquals("uint256[2] memory", inlineArray.get("type").asText());
    }

    @Test
    void testCallsAndAccesses() {
        JsonNode statements = doc(sink.g).get("body").get("statements");

        JsonNode structCall = statements.get(6).get("initialValue");
        assertEquals("FunctionCall", structCall.get("nodeType").asText());
        assertTrue(structCall.get("isStructConstructorCall").asBoolean());
        assertFalse(structCall.get("type_conversion").asBoolean());
        assertEquals(0, structCall.get("names").size());
        assertEquals("memory", statements.get(6).get("declarations").get(0).get("storageLocation").asText());

        JsonNode length = statements.get(7).get("expression");
        assertEquals("MemberAccess", length.get("nodeType").asText());
        assertEquals("length", length.get("memberName").asText());
        assertTrue(length.get("referencedDeclaration").isNull());
        JsonNode index = length.get("expression");
        assertEquals("IndexAccess", index.get("nodeType").asText());
        JsonNode msg = index.get("indexExpression").get("expression");
        assertEquals("msg", msg.get("value").asText());
        assertTrue(msg.get("referencedDeclaration").isNull());

        JsonNode newExpression = statements.get(8).get("expression").get("expression");
        assertEquals("NewExpression", newExpression.get("nodeType").asText());
        assertEquals("ArrayTypeName", newExpression.get("typeName").get("nodeType").asText());

        JsonNode conditional = statements.get(9).get("expression").get("rightHandSide");
        assertEquals("Conditional", conditional.get("nodeType").asText());
        assertEquals("uint256", conditional.get("type").asText());

        JsonNode conversion = statements.get(10).get("expression");
        assertTrue(conversion.get("type_conversion").asBoolean());
        JsonNode typeExpression = conversion.get("expression");
        assertEquals("ElementaryTypeNameExpression", typeExpression.get("nodeType").asText());
        assertEquals("uint", typeExpression.get("value").asText());
        assertTrue(typeExpression.get("isConstant").asBoolean());
        assertTrue(typeExpression.get("isPure").asBoolean());
        assertFalse(typeExpression.get("isLValue").asBoolean());
        assertFalse(typeExpression.get("lValueRequested").asBoolean());
    }

    @Test
    void testLiterals() {
        JsonNode ether = doc(sink.etherLiteral);
        assertEquals(List.of("id", "src", "nodeType", "token", "value", "hexvalue", "subdenomination", "type"),
            keys(ether));
        assertEquals("number", ether.get("token").asText());
        assertEquals("1", ether.get("value").asText());
        assertEquals("31", ether.get("hexvalue").asText());
        assertEquals("ether", ether.get("subdenomination").asText());

        JsonNode falseLiteral = doc(sink.g).get("body").get("statements").get(4).get("condition");
        assertEquals("false", falseLiteral.get("token").asText());
        assertTrue(falseLiteral.get("subdenomination").isNull());
    }
}
