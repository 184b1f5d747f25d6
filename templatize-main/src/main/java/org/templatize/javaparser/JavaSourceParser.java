package org.templatize.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.templatize.SourceParseException;
import org.templatize.javaparser.util.AstUtils;

import java.util.Optional;

/**
 * Parses Java sources with the symbol solver attached, so that expression types can be resolved
 * against the JDK.
 */
public class JavaSourceParser {

    private final ParserConfiguration configuration;

    public JavaSourceParser() {
        this(new ParserConfiguration()
                     .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                     .setSymbolResolver(new JavaSymbolSolver(new ReflectionTypeSolver())));
    }

    public JavaSourceParser(ParserConfiguration configuration) {
        this.configuration = configuration;
    }

    public CompilationUnit parse(String source) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        if (problem == null) {
            throw new SourceParseException("Parse error", source, 0, 0);
        }
        Position position = problem.getLocation()
                .flatMap(location -> location.getBegin().getRange())
                .map(range -> range.begin)
                .orElse(new Position(0, 0));
        throw new SourceParseException("Parse error: " + problem.getMessage(), source, position.line, position.column);
    }

    /**
     * The innermost "+" expression whose range contains the given 1-based position.
     */
    public Optional<BinaryExpr> findPlusAt(CompilationUnit unit, int line, int column) {
        Position position = new Position(line, column);
        return unit.findAll(BinaryExpr.class, binary -> AstUtils.isPlus(binary) && AstUtils.contains(binary, position))
                .stream()
                .reduce((outer, inner) -> inner);
    }
}
