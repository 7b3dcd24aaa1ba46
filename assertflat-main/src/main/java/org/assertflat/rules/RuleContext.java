package org.assertflat.rules;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.assertflat.chain.AssertionChain;
import org.assertflat.chain.Wrapping;
import org.assertflat.synth.ExpressionSynthesizer;
import org.assertflat.types.TypeClassifier;

/**
 * What a rule sees of one chain: its parts, the classifier to ask about them, and the synthesizer to
 * build the replacement with.
 */
public class RuleContext {

    private final AssertionChain chain;
    private final TypeClassifier classifier;
    private final ExpressionSynthesizer synth;
    private Optional<Expression> subject;

    public RuleContext(AssertionChain chain, TypeClassifier classifier, ExpressionSynthesizer synth) {
        this.chain = chain;
        this.classifier = classifier;
        this.synth = synth;
    }

    public AssertionChain chain() {
        return chain;
    }

    public TypeClassifier classifier() {
        return classifier;
    }

    public ExpressionSynthesizer synth() {
        return synth;
    }

    /**
     * The expression under test as it appears in the original tree. For a chain behind
     * {@code succeedsWithin} this is the future, not the awaited value; see {@link #subject()}.
     */
    public Expression rawSubject() {
        return chain.getSubject();
    }

    /**
     * A fresh copy of the value under test. A chain behind {@code succeedsWithin} receives the awaited
     * value {@code assertDoesNotThrow(() -> future.get(amount, unit))}; empty when its timeout cannot
     * be expressed.
     */
    public Optional<Expression> subject() {
        return builtSubject().map(Expression::clone);
    }

    /**
     * The subject to ask the classifier about: the original expression for plain chains, the rebuilt
     * one otherwise. A rebuilt subject has no resolvable type, so only syntactic answers are known.
     */
    public Expression classifiedSubject() {
        if (chain.getWrapping() == Wrapping.NONE) {
            return chain.getSubject();
        }
        return builtSubject().orElse(chain.getSubject());
    }

    /**
     * False when the subject was navigated from a root that is, or may be, an iterable or an array:
     * {@code extracting} on such a root maps every element.
     */
    public boolean navigatesFromSingleValue() {
        return chain.getNavigationRoot()
                .map(root -> classifier.isIterable(root).isFalse() && classifier.isArray(root).isFalse())
                .orElse(true);
    }

    private Optional<Expression> builtSubject() {
        if (subject == null) {
            if (chain.getWrapping() == Wrapping.AWAITED && chain.getAwaitLink().filter("succeedsWithin"::equals).isPresent()) {
                subject = synth.await(chain.getSubject(), chain.getAwaitTimeout())
                        .map(get -> synth.assertion("assertDoesNotThrow", synth.lambda(get)));
            } else {
                subject = Optional.of(chain.getSubject());
            }
        }
        return subject;
    }

    public Optional<Expression> argument(int index) {
        return chain.getArgument(index).map(Expression::clone);
    }

    public Expression[] arguments() {
        return chain.getValueArguments().stream().map(Expression::clone).toArray(Expression[]::new);
    }

    public int argumentCount() {
        return chain.getArgumentCount();
    }

    /**
     * The asserted type as a class expression: from an explicit type argument or a type-first entry as
     * {@code T.class}, otherwise the verb's first argument when it evaluates to a {@code Class}.
     */
    public Optional<Expression> assertedType() {
        if (chain.getTypeArgument().isPresent()) {
            return Optional.of(synth.classLiteral(chain.getTypeArgument().get()));
        }
        return chain.getArgument(0).map(Expression::clone);
    }

    /**
     * Timeout arguments of the await: the await link's when there is one, otherwise the verb's own
     * (terminal {@code succeedsWithin(t)} and {@code failsWithin(t)}).
     */
    public List<Expression> awaitTimeout() {
        return chain.getAwaitLink().isPresent() ? chain.getAwaitTimeout() : chain.getValueArguments();
    }

    public Optional<MethodCallExpr> assertion(String method, Expression... arguments) {
        return Optional.of(synth.assertion(method, arguments));
    }
}
