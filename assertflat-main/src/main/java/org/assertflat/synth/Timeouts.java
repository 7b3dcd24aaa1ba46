package org.assertflat.synth;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import org.assertflat.parser.util.AstUtils;

/**
 * Turns an AssertJ await timeout ({@code Duration} or {@code long, TimeUnit}) into the
 * {@code amount, unit} pair {@code Future.get} takes.
 */
final class Timeouts {

    private static final Map<String, String> DURATION_FACTORIES = Map.of(
            "ofNanos", "NANOSECONDS",
            "ofMillis", "MILLISECONDS",
            "ofSeconds", "SECONDS",
            "ofMinutes", "MINUTES",
            "ofHours", "HOURS",
            "ofDays", "DAYS");

    private static final Pattern TIME_UNIT_CONSTANT = Pattern.compile("(?:(?:java\\.util\\.concurrent\\.)?TimeUnit\\.)?[A-Z]+");

    private Timeouts() {
    }

    static Optional<List<Expression>> toAmountAndUnit(List<Expression> timeout, ExpressionSynthesizer synth) {
        if (timeout.size() == 2) {
            if (!TIME_UNIT_CONSTANT.matcher(timeout.get(1).toString()).matches()) {
                return Optional.empty();
            }
            return Optional.of(List.of(timeout.get(0).clone(), timeout.get(1).clone()));
        }
        if (timeout.size() != 1) {
            return Optional.empty();
        }
        Expression duration = timeout.get(0);
        if (duration instanceof MethodCallExpr) {
            MethodCallExpr factory = (MethodCallExpr) duration;
            String unit = DURATION_FACTORIES.get(factory.getNameAsString());
            boolean onDuration = factory.getScope().map(scope -> scope.toString().endsWith("Duration")).orElse(false);
            if (unit != null && onDuration && factory.getArguments().size() == 1) {
                return Optional.of(List.of(factory.getArgument(0).clone(), timeUnit(unit, synth)));
            }
        }
        Expression millis = new MethodCallExpr(AstUtils.asScope(duration.clone()), "toMillis");
        return Optional.of(List.of(millis, timeUnit("MILLISECONDS", synth)));
    }

    private static Expression timeUnit(String constant, ExpressionSynthesizer synth) {
        NameExpr type = synth.typeName("java.util.concurrent.TimeUnit");
        return new FieldAccessExpr(type, constant);
    }
}
