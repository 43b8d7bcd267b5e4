package com.solast.jackson;

import com.solast.ast.*;
import com.solast.json.AstJsonException;
import com.solast.json.InternalCompilerError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InternalCompilerErrorTest {

    private final AstJsonConverter converter = new AstJsonConverter();

    private static VariableDeclaration variable(Visibility visibility, StorageLocation location) {
        SourceLocation src = new SourceLocation(0, 6, "e.sol");
        return new VariableDeclaration(src, new ElementaryTypeName(src, "uint"), "v", null, visibility,
            false, false, location, null, ResolvedType.of("uint256"));
    }

    @Test
    void testDefaultVisibilityIsFatal() {
        InternalCompilerError error = assertThrows(InternalCompilerError.class,
            () -> converter.toJson(variable(Visibility.DEFAULT, StorageLocation.DEFAULT)));
        assertEquals("Unknown declaration visibility.", error.getMessage());
    }

    @Test
    void testCalldataLocationIsFatal() {
        InternalCompilerError error = assertThrows(InternalCompilerError.class,
            () -> converter.toJson(variable(Visibility.INTERNAL, StorageLocation.CALLDATA)));
        assertEquals("Unknown declaration location.", error.getMessage());
        assertTrue(error instanceof AstJsonException);
    }

    @Test
    void testFatalDeepInsideTreeAbortsWholeConversion() {
        SourceLocation src = new SourceLocation(0, 30, "e.sol");
        FunctionDefinition f = new FunctionDefinition(src, "f", Visibility.DEFAULT, false, false, false,
            new ParameterList(src, List.of()), new ParameterList(src, List.of()), List.of(),
            new Block(src, List.of()), null);
        ContractDefinition contract = new ContractDefinition(src, "E", false, List.of(), List.of(f), null,
            new ContractAnnotation(true, List.of(), List.of()));

        assertThrows(InternalCompilerError.class, () -> converter.toJson(contract));
    }

    @Test
    void testEveryOtherLabelIsAccepted() {
        assertEquals("private", SchemaVisitor.visibility(Visibility.PRIVATE));
        assertEquals("internal", SchemaVisitor.visibility(Visibility.INTERNAL));
        assertEquals("public", SchemaVisitor.visibility(Visibility.PUBLIC));
        assertEquals("external", SchemaVisitor.visibility(Visibility.EXTERNAL));
        assertEquals("default", SchemaVisitor.location(StorageLocation.DEFAULT));
        assertEquals("storage", SchemaVisitor.location(StorageLocation.STORAGE));
        assertEquals("memory", SchemaVisitor.location(StorageLocation.MEMORY));
    }
}
