package org.templatize.javaparser.util;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.ThisExpr;

public class AstUtils {

    private static final Class<?>[] PRIMARY_EXPRESSIONS = {
            NameExpr.class,
            FieldAccessExpr.class,
            MethodCallExpr.class,
            ArrayAccessExpr.class,
            LiteralExpr.class,
            ThisExpr.class,
            SuperExpr.class,
            ObjectCreationExpr.class,
            ClassExpr.class,
            EnclosedExpr.class
    };

    private AstUtils() {
    }

    public static boolean isPlus(Node node) {
        return node instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS;
    }

    /**
     * True for expressions that bind tighter than any operator and can be embedded as they are.
     */
    public static boolean isPrimary(Expression expr) {
        for (Class<?> type : PRIMARY_EXPRESSIONS) {
            if (type.isInstance(expr)) {
                return true;
            }
        }
        return false;
    }

    public static boolean contains(Node node, Position position) {
        return node.getRange().map(range -> range.contains(position)).orElse(false);
    }

    public static Range rangeOf(Node node) {
        return node.getRange()
                .orElseThrow(() -> new IllegalStateException("Node has no source range: " + node));
    }
}
