package org.templatize.engine;

/**
 * Syntactic shape of an expression node as reported by a {@link SyntaxAdapter}.
 */
public enum NodeKind {
    LITERAL,
    BINARY_ADD,
    OTHER
}
