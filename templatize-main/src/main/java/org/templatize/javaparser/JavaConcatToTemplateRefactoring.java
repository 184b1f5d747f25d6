package org.templatize.javaparser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.resolution.types.ResolvedType;
import org.templatize.TemplatizeConfiguration;
import org.templatize.engine.CancellationSignal;
import org.templatize.engine.ConcatToTemplateEngine;
import org.templatize.engine.ConversionOutcome;
import org.templatize.syntax.JavaEmbeddedExpressionSyntax;

/**
 * The conversion engine bound to JavaParser trees and the symbol solver.
 */
public class JavaConcatToTemplateRefactoring {

    private final JavaSourceParser parser;
    private final ConcatToTemplateEngine<Expression, ResolvedType> engine;

    /**
     * Configured from system properties. Output is Java embedded-expression strings unless
     * {@code templatize.syntax} selects another syntax.
     */
    public JavaConcatToTemplateRefactoring() {
        this(TemplatizeConfiguration.fromSystemProperties(JavaEmbeddedExpressionSyntax.INSTANCE));
    }

    public JavaConcatToTemplateRefactoring(TemplatizeConfiguration configuration) {
        this(new JavaSourceParser(), configuration);
    }

    public JavaConcatToTemplateRefactoring(JavaSourceParser parser, TemplatizeConfiguration configuration) {
        this.parser = parser;
        this.engine = new ConcatToTemplateEngine<>(JavaParserSyntaxAdapter.INSTANCE, SymbolSolverTypeOracle.INSTANCE, configuration);
    }

    /**
     * Parses {@code source} and converts the concatenation under the 1-based {@code line}/{@code column}.
     *
     * @throws org.templatize.SourceParseException if the source does not parse
     */
    public ConversionOutcome<Expression> convertAt(String source, int line, int column) {
        return convertAt(source, line, column, CancellationSignal.NONE);
    }

    public ConversionOutcome<Expression> convertAt(String source, int line, int column, CancellationSignal cancellation) {
        CompilationUnit unit = parser.parse(source);
        return parser.findPlusAt(unit, line, column)
                .map(plus -> engine.convert(plus, cancellation))
                .orElseGet(() -> ConversionOutcome.notApplicable(ConversionOutcome.Reason.NOT_A_STRING_CONCATENATION));
    }

    /**
     * Converts the chain containing {@code node}, which must belong to a unit parsed with a symbol resolver.
     */
    public ConversionOutcome<Expression> convert(Expression node) {
        return engine.convert(node);
    }
}
