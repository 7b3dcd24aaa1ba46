package org.assertflat.rules;

import java.util.Optional;
import java.util.function.UnaryOperator;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.assertflat.chain.Wrapping;
import org.assertflat.parser.util.AstUtils;
import org.assertflat.synth.ExpressionSynthesizer;
import org.assertflat.types.TypeClassifier;

/**
 * Emptiness, size, membership and element-order assertions over collections, arrays, maps and text.
 */
final class CollectionRules {

    private CollectionRules() {
    }

    static Optional<MethodCallExpr> beEmpty(RuleContext context) {
        if (context.argumentCount() != 0) {
            return Optional.empty();
        }
        return empty(context);
    }

    static Optional<MethodCallExpr> notBeEmpty(RuleContext context) {
        if (context.argumentCount() != 0) {
            return Optional.empty();
        }
        UnaryOperator<Expression> emptiness = emptinessTest(context);
        return context.subject().flatMap(subject -> {
            if (context.classifier().isNullable(context.classifiedSubject()).isFalse()) {
                return context.assertion("assertFalse", emptiness.apply(subject));
            }
            return context.assertion("assertTrue",
                    context.synth().nullSafeTest(subject, value -> negate(emptiness.apply(value)), false));
        });
    }

    static Optional<MethodCallExpr> beNullOrEmpty(RuleContext context) {
        if (context.argumentCount() != 0) {
            return Optional.empty();
        }
        UnaryOperator<Expression> emptiness = emptinessTest(context);
        return context.subject().flatMap(subject -> context.assertion("assertTrue",
                context.synth().nullSafeTest(subject, emptiness, true)));
    }

    /**
     * {@code hasSize(n)}: size 0 is an emptiness check, size 1 a singleton check, anything else an
     * equality on the count.
     */
    static Optional<MethodCallExpr> haveCount(RuleContext context) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        Expression expected = context.chain().getValueArguments().get(0);
        if (AstUtils.isIntegerLiteral(expected, 0)) {
            return empty(context);
        }
        if (AstUtils.isIntegerLiteral(expected, 1)) {
            return context.subject().flatMap(subject -> context.assertion("assertEquals",
                    new IntegerLiteralExpr("1"), guardedCount(context, subject)));
        }
        return context.subject().flatMap(subject -> context.assertion("assertEquals",
                context.argument(0).get(), guardedCount(context, subject)));
    }

    /**
     * {@code assertEquals(1, count)} for a subject spelled {@code receiver.size()} or
     * {@code receiver.length} compared to 1.
     */
    static Optional<MethodCallExpr> singleton(RuleContext context, Expression receiver, Expression accessor) {
        Expression count = knownCount(context.classifier(), context.synth(), receiver)
                .orElseGet(accessor::clone);
        return context.assertion("assertEquals", new IntegerLiteralExpr("1"), count);
    }

    static Optional<MethodCallExpr> contain(RuleContext context) {
        return membership(context, "anyMatch", true);
    }

    static Optional<MethodCallExpr> notContain(RuleContext context) {
        return membership(context, "noneMatch", false);
    }

    static Optional<MethodCallExpr> anyMatch(RuleContext context) {
        return streamMatch(context, "anyMatch");
    }

    static Optional<MethodCallExpr> noneMatch(RuleContext context) {
        return streamMatch(context, "noneMatch");
    }

    static Optional<MethodCallExpr> allMatch(RuleContext context) {
        return streamMatch(context, "allMatch");
    }

    /**
     * {@code contains(a, b, ...)}: one assertion per value, grouped with {@code assertAll}. The subject
     * is then evaluated once per value inside a lambda, so it has to be a side-effect-free name that is
     * never reassigned; a collection subject of any other shape is checked with {@code containsAll}.
     */
    static Optional<MethodCallExpr> containAll(RuleContext context) {
        Expression classified = context.classifiedSubject();
        TypeClassifier classifier = context.classifier();
        if (context.argumentCount() < 2 || classifier.isArray(classified).isTrue()
                || classifier.isMap(classified).isTrue() || classifier.isOptional(classified).isTrue()) {
            return Optional.empty();
        }
        ExpressionSynthesizer synth = context.synth();
        Expression raw = context.rawSubject();
        if (context.chain().getWrapping() != Wrapping.NONE || !AstUtils.isSideEffectFree(raw) || !AstUtils.isCapturable(raw)) {
            if (!classifier.isCollection(classified).isTrue()) {
                return Optional.empty();
            }
            return context.subject().flatMap(subject -> context.assertion("assertTrue",
                    synth.call(subject, "containsAll", synth.staticCall("java.util.Arrays", "asList", context.arguments()))));
        }
        String element = synth.freshName(classifier.isText(classified).isTrue() ? "substring" : "element");
        return context.subject().flatMap(subject -> {
            MethodCallExpr check = synth.assertion("assertTrue", synth.call(subject, "contains", new NameExpr(element)));
            MethodCallExpr values = synth.staticCall("java.util.stream.Stream", "of", context.arguments());
            MethodCallExpr executables = new MethodCallExpr(values, "map",
                    NodeList.nodeList(synth.lambda(element, synth.lambda(check))));
            return context.assertion("assertAll", executables);
        });
    }

    static Optional<MethodCallExpr> beOneOf(RuleContext context) {
        return oneOf(context, "assertTrue");
    }

    static Optional<MethodCallExpr> notBeOneOf(RuleContext context) {
        return oneOf(context, "assertFalse");
    }

    /**
     * {@code containsExactlyElementsOf(e)} and {@code containsExactly(a, b, ...)}: same elements in the
     * same order.
     */
    static Optional<MethodCallExpr> beEquivalentTo(RuleContext context) {
        if (context.classifier().isArray(context.classifiedSubject()).isTrue()) {
            return Optional.empty();
        }
        ExpressionSynthesizer synth = context.synth();
        Expression expected;
        if (context.chain().getVerb().equals("containsExactlyElementsOf")) {
            if (context.argumentCount() != 1) {
                return Optional.empty();
            }
            expected = context.argument(0).get();
        } else if (context.argumentCount() == 0) {
            expected = synth.staticCall("java.util.List", "of");
        } else {
            expected = synth.staticCall("java.util.Arrays", "asList", context.arguments());
        }
        return context.subject().flatMap(subject -> context.assertion("assertIterableEquals", expected, subject));
    }

    private static Optional<MethodCallExpr> empty(RuleContext context) {
        UnaryOperator<Expression> emptiness = emptinessTest(context);
        return context.subject().flatMap(subject -> {
            if (context.classifier().isNullable(context.classifiedSubject()).isFalse()) {
                return context.assertion("assertTrue", emptiness.apply(subject));
            }
            return context.assertion("assertTrue", context.synth().nullSafeTest(subject, emptiness, false));
        });
    }

    private static UnaryOperator<Expression> emptinessTest(RuleContext context) {
        if (context.classifier().isArray(context.classifiedSubject()).isTrue()) {
            return value -> AstUtils.binary(new FieldAccessExpr(AstUtils.asScope(value), "length"), "==", new IntegerLiteralExpr("0"));
        }
        return value -> context.synth().call(value, "isEmpty");
    }

    private static Expression guardedCount(RuleContext context, Expression subject) {
        UnaryOperator<Expression> count = value -> count(context, value);
        if (context.classifier().isNullable(context.classifiedSubject()).isFalse()) {
            return count.apply(subject);
        }
        return context.synth().nullSafeValue(subject, count);
    }

    /**
     * Count of the subject's elements. Without type information the subject is taken for a collection;
     * an iterable known to be neither sized nor an array is counted through a stream.
     */
    private static Expression count(RuleContext context, Expression value) {
        Expression classified = context.classifiedSubject();
        return knownCount(context.classifier(), context.synth(), classified, value)
                .orElseGet(() -> {
                    TypeClassifier classifier = context.classifier();
                    if (classifier.isCollection(classified).isUnknown()) {
                        return context.synth().call(value, "size");
                    }
                    MethodCallExpr stream = context.synth().staticCall("java.util.stream.StreamSupport", "stream",
                            context.synth().call(value, "spliterator"), new BooleanLiteralExpr(false));
                    return new MethodCallExpr(stream, "count");
                });
    }

    private static Optional<Expression> knownCount(TypeClassifier classifier, ExpressionSynthesizer synth, Expression receiver) {
        return knownCount(classifier, synth, receiver, receiver.clone());
    }

    private static Optional<Expression> knownCount(TypeClassifier classifier, ExpressionSynthesizer synth,
                                                   Expression classified, Expression value) {
        if (classifier.isArray(classified).isTrue()) {
            return Optional.of(new FieldAccessExpr(AstUtils.asScope(value), "length"));
        }
        if (classifier.isCollection(classified).isTrue()) {
            return Optional.of(synth.call(value, "size"));
        }
        if (classifier.isText(classified).isTrue()) {
            return Optional.of(synth.call(value, "length"));
        }
        return Optional.empty();
    }

    /**
     * {@code contains(x)} and {@code doesNotContain(x)}: {@code contains} on collections and text, a
     * stream match for a predicate argument, and a comparison with {@code Optional.of(x)} for an
     * {@code Optional} subject. Maps and arrays are left alone.
     */
    private static Optional<MethodCallExpr> membership(RuleContext context, String streamMatch, boolean expected) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        Expression subjectForTypes = context.classifiedSubject();
        TypeClassifier classifier = context.classifier();
        if (classifier.isArray(subjectForTypes).isTrue() || classifier.isMap(subjectForTypes).isTrue()) {
            return Optional.empty();
        }
        ExpressionSynthesizer synth = context.synth();
        if (classifier.isOptional(subjectForTypes).isTrue()) {
            return context.subject().flatMap(subject -> context.assertion(expected ? "assertEquals" : "assertNotEquals",
                    synth.staticCall("java.util.Optional", "of", context.argument(0).get()), subject));
        }
        boolean predicate = classifier.isCallableOrPredicate(context.chain().getValueArguments().get(0)).isTrue()
                && !classifier.isText(subjectForTypes).isTrue();
        return context.subject().flatMap(subject -> {
            if (predicate) {
                return context.assertion("assertTrue",
                        synth.call(synth.call(subject, "stream"), streamMatch, context.argument(0).get()));
            }
            return context.assertion(expected ? "assertTrue" : "assertFalse",
                    synth.call(subject, "contains", context.argument(0).get()));
        });
    }

    private static Optional<MethodCallExpr> streamMatch(RuleContext context, String match) {
        if (context.argumentCount() != 1 || context.classifier().isArray(context.classifiedSubject()).isTrue()) {
            return Optional.empty();
        }
        ExpressionSynthesizer synth = context.synth();
        return context.subject().flatMap(subject -> context.assertion("assertTrue",
                synth.call(synth.call(subject, "stream"), match, context.argument(0).get())));
    }

    private static Optional<MethodCallExpr> oneOf(RuleContext context, String method) {
        ExpressionSynthesizer synth = context.synth();
        Expression values;
        if (context.argumentCount() >= 2) {
            values = synth.staticCall("java.util.Arrays", "asList", context.arguments());
        } else if (context.argumentCount() == 1) {
            Expression single = context.chain().getValueArguments().get(0);
            TypeClassifier classifier = context.classifier();
            if (classifier.isCollection(single).isTrue()) {
                values = context.argument(0).get();
            } else if (classifier.isArray(single).isTrue()) {
                values = synth.staticCall("java.util.Arrays", "asList", context.argument(0).get());
            } else {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return context.subject().flatMap(subject -> context.assertion(method, synth.call(values, "contains", subject)));
    }

    private static Expression negate(Expression condition) {
        if (condition instanceof BinaryExpr && ((BinaryExpr) condition).getOperator() == BinaryExpr.Operator.EQUALS) {
            BinaryExpr equality = (BinaryExpr) condition;
            return new BinaryExpr(equality.getLeft(), equality.getRight(), BinaryExpr.Operator.NOT_EQUALS);
        }
        return new UnaryExpr(AstUtils.asOperand(condition), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }
}
