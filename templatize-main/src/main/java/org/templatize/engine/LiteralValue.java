package org.templatize.engine;

import java.util.Objects;

/**
 * The semantic value of a string literal, already unescaped, together with its lexical style.
 */
public record LiteralValue(String value, LiteralStyle style) {

    public LiteralValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(style, "style");
    }
}
