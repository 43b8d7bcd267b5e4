package com.solast.ast;

/**
 * A node that introduces a name.
 */
public sealed interface Declaration extends Node permits
    ImportDirective,
    ContractDefinition,
    StructDefinition,
    EnumDefinition,
    EnumValue,
    FunctionDefinition,
    VariableDeclaration,
    ModifierDefinition,
    EventDefinition {

    String name();

    /** The node defining the scope this declaration lives in, or null at file level. */
    NodeRef scope();
}
