package org.templatize.engine;

/**
 * Outcome of {@link NodeClassifier#classify(Object)}.
 */
public sealed interface Classification {

    Classification CONCAT = new Concat();
    Classification OPAQUE = new Opaque();

    record Literal(LiteralValue value) implements Classification {
    }

    record Concat() implements Classification {
    }

    record Opaque() implements Classification {
    }

    default boolean isConcat() {
        return this instanceof Concat;
    }
}
