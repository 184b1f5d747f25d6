package org.templatize.syntax;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class TemplateSyntaxes {

    private static final Map<String, TemplateSyntax> BY_NAME = List.of(
            CSharpInterpolatedSyntax.INSTANCE,
            JavaScriptTemplateSyntax.INSTANCE,
            JavaEmbeddedExpressionSyntax.INSTANCE
    ).stream().collect(Collectors.toUnmodifiableMap(TemplateSyntax::name, Function.identity()));

    private TemplateSyntaxes() {
    }

    /**
     * @throws IllegalArgumentException if no syntax is registered under {@code name}
     */
    public static TemplateSyntax forName(String name) {
        TemplateSyntax syntax = BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        if (syntax == null) {
            throw new IllegalArgumentException("Unknown template syntax: " + name + ", expected one of " + BY_NAME.keySet());
        }
        return syntax;
    }
}
