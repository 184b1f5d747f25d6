package org.templatize.engine;

import java.util.Objects;

/**
 * Three-way classification of expression nodes: string literal, string concatenation or opaque.
 * A "+" node only counts as a concatenation when the type oracle says its result is a string;
 * when the type cannot be resolved the node is opaque.
 */
public final class NodeClassifier<N, T> {

    private final SyntaxAdapter<N> syntax;
    private final TypeOracle<N, T> typeOracle;

    public NodeClassifier(SyntaxAdapter<N> syntax, TypeOracle<N, T> typeOracle) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
        this.typeOracle = Objects.requireNonNull(typeOracle, "typeOracle");
    }

    public Classification classify(N node) {
        return switch (syntax.kind(node)) {
            case LITERAL -> syntax.stringLiteral(node)
                    .<Classification>map(Classification.Literal::new)
                    .orElse(Classification.OPAQUE);
            case BINARY_ADD -> typeOracle.hasStringType(node) ? Classification.CONCAT : Classification.OPAQUE;
            case OTHER -> Classification.OPAQUE;
        };
    }

    public boolean isConcat(N node) {
        return classify(node).isConcat();
    }

    public SyntaxAdapter<N> getSyntax() {
        return syntax;
    }
}
