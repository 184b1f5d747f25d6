package org.templatize.syntax;

/**
 * JavaScript template literals: {@code `text${expr}text`}. A {@code $} is escaped only where it
 * would start a placeholder.
 */
public final class JavaScriptTemplateSyntax implements TemplateSyntax {

    public static final JavaScriptTemplateSyntax INSTANCE = new JavaScriptTemplateSyntax();

    private JavaScriptTemplateSyntax() {
    }

    @Override
    public String name() {
        return "javascript";
    }

    @Override
    public String open() {
        return "`";
    }

    @Override
    public String close() {
        return "`";
    }

    @Override
    public String placeholderOpen() {
        return "${";
    }

    @Override
    public String placeholderClose() {
        return "}";
    }

    @Override
    public String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '`' -> sb.append("\\`");
                case '\\' -> sb.append("\\\\");
                case '$' -> sb.append(i + 1 < text.length() && text.charAt(i + 1) == '{' ? "\\$" : "$");
                default -> Escapes.appendControlEscaped(sb, c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name();
    }
}
