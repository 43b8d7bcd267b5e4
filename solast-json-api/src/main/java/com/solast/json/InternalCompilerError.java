package com.solast.json;

/**
 * Thrown when an analysis result falls outside what the document schema knows,
 * e.g. an enumerator with no output label. Signals a broken contract with the
 * upstream passes rather than bad user input.
 */
public class InternalCompilerError extends AstJsonException {

    public InternalCompilerError(String message) {
        super(message);
    }
}
