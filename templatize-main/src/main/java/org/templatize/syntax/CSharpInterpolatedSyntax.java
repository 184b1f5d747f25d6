package org.templatize.syntax;

/**
 * C# regular interpolated strings: {@code $"text{expr}text"}. Braces are escaped by doubling.
 */
public final class CSharpInterpolatedSyntax implements TemplateSyntax {

    public static final CSharpInterpolatedSyntax INSTANCE = new CSharpInterpolatedSyntax();

    private CSharpInterpolatedSyntax() {
    }

    @Override
    public String name() {
        return "csharp";
    }

    @Override
    public String open() {
        return "$\"";
    }

    @Override
    public String close() {
        return "\"";
    }

    @Override
    public String placeholderOpen() {
        return "{";
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
                case '{' -> sb.append("{{");
                case '}' -> sb.append("}}");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\0' -> sb.append("\\0");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
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
