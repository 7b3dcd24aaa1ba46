package org.assertflat.rules;

import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.assertflat.parser.util.AstUtils;

/**
 * Ordering and proximity assertions. Numbers compare with operators, anything else through
 * {@code compareTo}.
 */
final class ComparisonRules {

    private static final Set<String> OFFSET_FACTORIES = Set.of("within", "offset", "byLessThan");

    private ComparisonRules() {
    }

    static RewriteRule ordering(String operator) {
        return context -> compare(context, operator, "assertTrue", false);
    }

    static RewriteRule temporal(String operator) {
        return context -> compare(context, operator, "assertTrue", true);
    }

    static RewriteRule notTemporal(String operator) {
        return context -> compare(context, operator, "assertFalse", true);
    }

    static Optional<MethodCallExpr> beCloseTo(RuleContext context) {
        return closeTo(context, "assertTrue");
    }

    static Optional<MethodCallExpr> notBeCloseTo(RuleContext context) {
        return closeTo(context, "assertFalse");
    }

    private static Optional<MethodCallExpr> compare(RuleContext context, String operator, String method, boolean alwaysCompareTo) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        boolean operatorForm = !alwaysCompareTo && !context.classifier().isNumeric(context.classifiedSubject()).isFalse();
        return context.subject().flatMap(subject -> {
            Expression other = context.argument(0).get();
            BinaryExpr comparison = operatorForm
                    ? AstUtils.binary(subject, operator, other)
                    : AstUtils.binary(context.synth().call(subject, "compareTo", other), operator, new IntegerLiteralExpr("0"));
            return context.assertion(method, comparison);
        });
    }

    /**
     * {@code isCloseTo(e, within(p))}: {@code e - p <= s <= e + p}, strict for {@code byLessThan}. The
     * subject appears in both bounds, so subjects with side effects are left alone.
     */
    private static Optional<MethodCallExpr> closeTo(RuleContext context, String method) {
        if (context.argumentCount() != 2 || context.classifier().isNumeric(context.classifiedSubject()).isFalse()) {
            return Optional.empty();
        }
        Expression offset = context.chain().getValueArguments().get(1);
        if (!(offset instanceof MethodCallExpr)) {
            return Optional.empty();
        }
        MethodCallExpr factory = (MethodCallExpr) offset;
        boolean knownScope = factory.getScope()
                .map(scope -> scope.toString().endsWith("Assertions") || scope.toString().endsWith("Offset"))
                .orElse(true);
        if (!OFFSET_FACTORIES.contains(factory.getNameAsString()) || !knownScope || factory.getArguments().size() != 1) {
            return Optional.empty();
        }
        if (!AstUtils.isSideEffectFree(context.classifiedSubject())) {
            return Optional.empty();
        }
        boolean strict = factory.getNameAsString().equals("byLessThan");
        Expression precision = factory.getArgument(0);
        return context.subject().flatMap(subject -> {
            Expression lower = AstUtils.binary(context.argument(0).get(), "-", precision.clone());
            Expression upper = AstUtils.binary(context.argument(0).get(), "+", precision.clone());
            BinaryExpr above = AstUtils.binary(subject, strict ? ">" : ">=", lower);
            BinaryExpr below = AstUtils.binary(subject.clone(), strict ? "<" : "<=", upper);
            return context.assertion(method, AstUtils.binary(above, "&&", below));
        });
    }
}
