package org.templatize.syntax;

/**
 * Lexical rules of a target template-string grammar: how the string opens and closes, how an
 * embedded expression is delimited, and how literal text is escaped so that it can never be read
 * as a placeholder or as the end of the string.
 */
public interface TemplateSyntax {

    String name();

    String open();

    String close();

    String placeholderOpen();

    String placeholderClose();

    /**
     * Escapes the semantic value of a literal for use as template text.
     */
    String escapeText(String text);
}
