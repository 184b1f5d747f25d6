package org.templatize.javaparser;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.resolution.types.ResolvedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.templatize.engine.TypeOracle;

import java.util.Optional;

/**
 * Resolves expression types with the JavaParser symbol solver. The expression must belong to a
 * compilation unit parsed with a symbol resolver configured, see {@link JavaSourceParser}.
 */
public class SymbolSolverTypeOracle implements TypeOracle<Expression, ResolvedType> {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolSolverTypeOracle.class);

    public static final SymbolSolverTypeOracle INSTANCE = new SymbolSolverTypeOracle();

    private static final String JAVA_LANG_STRING = "java.lang.String";

    @Override
    public Optional<ResolvedType> resultType(Expression node) {
        try {
            return Optional.of(node.calculateResolvedType());
        } catch (RuntimeException e) {
            // UnsolvedSymbolException, UnsupportedOperationException and friends: treat as unknown
            LOG.debug("Unable to resolve type of '{}': {}", node, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean isStringType(ResolvedType type) {
        return type.isReferenceType() && JAVA_LANG_STRING.equals(type.asReferenceType().getQualifiedName());
    }
}
