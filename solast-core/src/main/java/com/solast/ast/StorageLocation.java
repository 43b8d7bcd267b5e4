package com.solast.ast;

/**
 * Data location of a variable as resolved by analysis.
 */
public enum StorageLocation {
    DEFAULT,
    STORAGE,
    MEMORY,
    CALLDATA
}
