package org.assertflat.rules;

import java.util.Optional;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.assertflat.synth.ExpressionSynthesizer;
import org.assertflat.types.TypeClassifier;

final class TextRules {

    private TextRules() {
    }

    static Optional<MethodCallExpr> startWith(RuleContext context) {
        return affix(context, "startsWith");
    }

    static Optional<MethodCallExpr> endWith(RuleContext context) {
        return affix(context, "endsWith");
    }

    static Optional<MethodCallExpr> containEquivalentOf(RuleContext context) {
        return ignoringCase(context, "assertTrue");
    }

    static Optional<MethodCallExpr> notContainEquivalentOf(RuleContext context) {
        return ignoringCase(context, "assertFalse");
    }

    private static Optional<MethodCallExpr> affix(RuleContext context, String method) {
        TypeClassifier classifier = context.classifier();
        Expression subject = context.classifiedSubject();
        if (context.argumentCount() != 1 || classifier.isCollection(subject).isTrue() || classifier.isArray(subject).isTrue()) {
            return Optional.empty();
        }
        return context.subject().flatMap(value -> context.assertion("assertTrue",
                context.synth().call(value, method, context.argument(0).get())));
    }

    private static Optional<MethodCallExpr> ignoringCase(RuleContext context, String method) {
        if (context.argumentCount() != 1) {
            return Optional.empty();
        }
        ExpressionSynthesizer synth = context.synth();
        return context.subject().flatMap(subject -> {
            Expression haystack = synth.call(subject, "toLowerCase", root(synth));
            Expression needle = synth.call(context.argument(0).get(), "toLowerCase", root(synth));
            return context.assertion(method, synth.call(haystack, "contains", needle));
        });
    }

    private static Expression root(ExpressionSynthesizer synth) {
        return new FieldAccessExpr(synth.typeName("java.util.Locale"), "ROOT");
    }
}
