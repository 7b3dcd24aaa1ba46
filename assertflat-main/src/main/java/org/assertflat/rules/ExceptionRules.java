package org.assertflat.rules;

import java.util.Optional;

import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.assertflat.synth.ExpressionSynthesizer;

/**
 * Thrown-exception assertions, synchronous and awaited, and runtime-type assertions.
 */
final class ExceptionRules {

    private ExceptionRules() {
    }

    static Optional<MethodCallExpr> throwing(RuleContext context) {
        return thrown(context, "assertThrows");
    }

    static Optional<MethodCallExpr> throwingExactly(RuleContext context) {
        return thrown(context, "assertThrowsExactly");
    }

    static Optional<MethodCallExpr> notThrowing(RuleContext context) {
        if (context.argumentCount() != 0) {
            return Optional.empty();
        }
        return context.assertion("assertDoesNotThrow", context.synth().executable(context.rawSubject()));
    }

    /**
     * {@code failsWithin(t)} and {@code failsWithin(t).withThrowableOfType(E.class)}: waiting on the future
     * throws.
     */
    static Optional<MethodCallExpr> throwingAsync(RuleContext context) {
        ExpressionSynthesizer synth = context.synth();
        Expression type;
        if (context.chain().getAwaitLink().isPresent()) {
            if (context.argumentCount() > 1) {
                return Optional.empty();
            }
            Optional<Expression> asserted = context.assertedType();
            if (asserted.isEmpty()) {
                return Optional.empty();
            }
            type = asserted.get();
        } else {
            type = new ClassExpr(new ClassOrInterfaceType(null, "Exception"));
        }
        return synth.await(context.rawSubject(), context.awaitTimeout())
                .flatMap(get -> context.assertion("assertThrows", type, synth.lambda(get)));
    }

    static Optional<MethodCallExpr> notThrowingAsync(RuleContext context) {
        ExpressionSynthesizer synth = context.synth();
        return synth.await(context.rawSubject(), context.awaitTimeout())
                .flatMap(get -> context.assertion("assertDoesNotThrow", synth.lambda(get)));
    }

    static Optional<MethodCallExpr> beOfType(RuleContext context) {
        return exactType(context, "assertEquals");
    }

    static Optional<MethodCallExpr> notBeOfType(RuleContext context) {
        return exactType(context, "assertNotEquals");
    }

    static Optional<MethodCallExpr> beAssignableTo(RuleContext context) {
        Optional<Expression> type = typeOnly(context);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion("assertInstanceOf", type.get(), subject));
    }

    static Optional<MethodCallExpr> notBeAssignableTo(RuleContext context) {
        Optional<Expression> type = typeOnly(context);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion("assertFalse",
                context.synth().call(type.get(), "isInstance", subject)));
    }

    private static Optional<MethodCallExpr> thrown(RuleContext context, String method) {
        if (context.argumentCount() > 1) {
            return Optional.empty();
        }
        Expression type = context.assertedType()
                .orElseGet(() -> new ClassExpr(new ClassOrInterfaceType(null, "Throwable")));
        return context.assertion(method, type, context.synth().executable(context.rawSubject()));
    }

    private static Optional<MethodCallExpr> exactType(RuleContext context, String method) {
        Optional<Expression> type = typeOnly(context);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion(method, type.get(),
                context.synth().call(subject, "getClass")));
    }

    /**
     * The asserted type of a verb taking nothing but the type.
     */
    private static Optional<Expression> typeOnly(RuleContext context) {
        boolean typeArgument = context.chain().getTypeArgument().isPresent();
        if (context.argumentCount() != (typeArgument ? 0 : 1)) {
            return Optional.empty();
        }
        return context.assertedType();
    }
}
