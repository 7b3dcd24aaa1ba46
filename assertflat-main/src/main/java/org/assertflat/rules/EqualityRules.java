package org.assertflat.rules;

import java.util.Optional;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.assertflat.chain.Wrapping;
import org.assertflat.parser.util.AstUtils;

/**
 * Equality, identity, boolean, null and sign assertions.
 */
final class EqualityRules {

    private EqualityRules() {
    }

    static Optional<MethodCallExpr> be(RuleContext context) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        Expression expected = context.chain().getValueArguments().get(0);
        if (context.chain().getWrapping() == Wrapping.NONE && AstUtils.isIntegerLiteral(expected, 1)) {
            Optional<Expression> sized = sizeAccessorReceiver(context.rawSubject());
            if (sized.isPresent()) {
                return CollectionRules.singleton(context, sized.get(), context.rawSubject());
            }
        }
        String method = context.classifier().isArray(context.classifiedSubject()).isTrue() ? "assertArrayEquals" : "assertEquals";
        return context.subject().flatMap(subject -> context.assertion(method, context.argument(0).get(), subject));
    }

    static Optional<MethodCallExpr> notBe(RuleContext context) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        if (context.classifier().isArray(context.classifiedSubject()).isTrue()) {
            return context.subject().flatMap(subject -> context.assertion("assertFalse",
                    context.synth().staticCall("java.util.Arrays", "equals", context.argument(0).get(), subject)));
        }
        return context.subject().flatMap(subject -> context.assertion("assertNotEquals", context.argument(0).get(), subject));
    }

    static Optional<MethodCallExpr> beSameAs(RuleContext context) {
        return withExpected(context, "assertSame");
    }

    static Optional<MethodCallExpr> notBeSameAs(RuleContext context) {
        return withExpected(context, "assertNotSame");
    }

    static Optional<MethodCallExpr> beTrue(RuleContext context) {
        return unary(context, "assertTrue");
    }

    static Optional<MethodCallExpr> beFalse(RuleContext context) {
        return unary(context, "assertFalse");
    }

    static Optional<MethodCallExpr> beNull(RuleContext context) {
        return unary(context, "assertNull");
    }

    static Optional<MethodCallExpr> notBeNull(RuleContext context) {
        return unary(context, "assertNotNull");
    }

    static Optional<MethodCallExpr> bePositive(RuleContext context) {
        return sign(context, ">");
    }

    static Optional<MethodCallExpr> beNegative(RuleContext context) {
        return sign(context, "<");
    }

    private static Optional<MethodCallExpr> sign(RuleContext context, String operator) {
        if (context.argumentCount() != 0 || context.classifier().isNumeric(context.classifiedSubject()).isFalse()) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion("assertTrue",
                AstUtils.binary(subject, operator, new IntegerLiteralExpr("0"))));
    }

    private static Optional<MethodCallExpr> withExpected(RuleContext context, String method) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion(method, context.argument(0).get(), subject));
    }

    private static Optional<MethodCallExpr> unary(RuleContext context, String method) {
        if (context.argumentCount() != 0) {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion(method, subject));
    }

    /**
     * {@code r} for a subject spelled {@code r.size()} or {@code r.length}.
     */
    private static Optional<Expression> sizeAccessorReceiver(Expression subject) {
        if (subject instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) subject;
            if (call.getNameAsString().equals("size") && call.getArguments().isEmpty()) {
                return call.getScope();
            }
        }
        if (subject instanceof FieldAccessExpr && ((FieldAccessExpr) subject).getNameAsString().equals("length")) {
            return Optional.of(((FieldAccessExpr) subject).getScope());
        }
        return Optional.empty();
    }
}
