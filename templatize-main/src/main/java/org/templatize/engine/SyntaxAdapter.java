package org.templatize.engine;

import java.util.Optional;

/**
 * Read-only view of a host syntax tree. A language binding implements this once for its node
 * type; the engine never mutates the nodes it is handed.
 *
 * @param <N> the host's expression node type
 */
public interface SyntaxAdapter<N> {

    NodeKind kind(N node);

    /**
     * The enclosing expression of {@code node}, or empty when the parent is not an expression
     * (a statement, a declaration) or the node is a root.
     */
    Optional<N> parent(N node);

    /**
     * Left operand of a {@link NodeKind#BINARY_ADD} node.
     */
    N leftOperand(N node);

    /**
     * Right operand of a {@link NodeKind#BINARY_ADD} node.
     */
    N rightOperand(N node);

    /**
     * The string value of a {@link NodeKind#LITERAL} node, or empty when the literal is not a
     * string (numbers, characters, booleans, null).
     */
    Optional<LiteralValue> stringLiteral(N node);

    /**
     * The node's own source text, exactly as written.
     */
    String sourceText(N node);

    SourceSpan span(N node);

    boolean isParenthesized(N node);

    /**
     * Whether the node can be embedded in a placeholder without parentheses: names, member
     * access, calls, literals and the like.
     */
    boolean isPrimary(N node);
}
