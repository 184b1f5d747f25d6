package org.templatize.javaparser;

import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import org.templatize.engine.LiteralStyle;
import org.templatize.engine.LiteralValue;
import org.templatize.engine.NodeKind;
import org.templatize.engine.SourceSpan;
import org.templatize.engine.SyntaxAdapter;
import org.templatize.javaparser.util.AstUtils;

import java.util.Optional;

/**
 * Describes JavaParser expression trees to the engine. Text blocks are the raw literals of Java.
 */
public class JavaParserSyntaxAdapter implements SyntaxAdapter<Expression> {

    public static final JavaParserSyntaxAdapter INSTANCE = new JavaParserSyntaxAdapter();

    @Override
    public NodeKind kind(Expression node) {
        if (AstUtils.isPlus(node)) {
            return NodeKind.BINARY_ADD;
        }
        if (node.isLiteralExpr()) {
            return NodeKind.LITERAL;
        }
        return NodeKind.OTHER;
    }

    @Override
    public Optional<Expression> parent(Expression node) {
        return node.getParentNode()
                .filter(Expression.class::isInstance)
                .map(Expression.class::cast);
    }

    @Override
    public Expression leftOperand(Expression node) {
        return asPlus(node).getLeft();
    }

    @Override
    public Expression rightOperand(Expression node) {
        return asPlus(node).getRight();
    }

    @Override
    public Optional<LiteralValue> stringLiteral(Expression node) {
        if (node instanceof TextBlockLiteralExpr textBlock) {
            return Optional.of(new LiteralValue(textBlock.asString(), LiteralStyle.RAW));
        }
        if (node instanceof StringLiteralExpr string) {
            return Optional.of(new LiteralValue(string.asString(), LiteralStyle.REGULAR));
        }
        return Optional.empty();
    }

    @Override
    public String sourceText(Expression node) {
        return node.getTokenRange()
                .map(TokenRange::toString)
                .orElseGet(node::toString);
    }

    @Override
    public SourceSpan span(Expression node) {
        Range range = AstUtils.rangeOf(node);
        return new SourceSpan(range.begin.line, range.begin.column, range.end.line, range.end.column);
    }

    @Override
    public boolean isParenthesized(Expression node) {
        return node.isEnclosedExpr();
    }

    @Override
    public boolean isPrimary(Expression node) {
        return AstUtils.isPrimary(node);
    }

    private static BinaryExpr asPlus(Expression node) {
        if (!AstUtils.isPlus(node)) {
            throw new IllegalArgumentException("Not a '+' expression: " + node);
        }
        return node.asBinaryExpr();
    }
}
