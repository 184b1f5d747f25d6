package org.templatize.syntax;

import com.github.javaparser.utils.StringEscapeUtils;

/**
 * Java string literals with embedded expressions: {@code "text\{expr}text"}. A placeholder can only
 * start after a backslash, so ordinary Java string escaping already protects literal text.
 */
public final class JavaEmbeddedExpressionSyntax implements TemplateSyntax {

    public static final JavaEmbeddedExpressionSyntax INSTANCE = new JavaEmbeddedExpressionSyntax();

    private JavaEmbeddedExpressionSyntax() {
    }

    @Override
    public String name() {
        return "java";
    }

    @Override
    public String open() {
        return "\"";
    }

    @Override
    public String close() {
        return "\"";
    }

    @Override
    public String placeholderOpen() {
        return "\\{";
    }

    @Override
    public String placeholderClose() {
        return "}";
    }

    @Override
    public String escapeText(String text) {
        return StringEscapeUtils.escapeJava(text);
    }

    @Override
    public String toString() {
        return name();
    }
}
