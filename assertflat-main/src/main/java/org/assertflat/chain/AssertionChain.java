package org.assertflat.chain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.Type;

/**
 * One recognized AssertJ chain, decomposed into the parts the rewrite rules work with. The
 * expressions held here belong to the original tree (apart from a rebuilt navigation subject) and
 * must be cloned before being placed in a replacement.
 */
public final class AssertionChain {

    private final MethodCallExpr call;
    private final Expression subject;
    private final Expression navigationRoot;
    private final String entry;
    private final String verb;
    private final List<Type> verbTypeArguments;
    private final Type typeArgument;
    private final List<Expression> valueArguments;
    private final Wrapping wrapping;
    private final String awaitLink;
    private final List<Expression> awaitTimeout;
    private final List<Expression> descriptionArguments;
    private final Set<String> requiredImports;

    private AssertionChain(Builder builder) {
        this.call = builder.call;
        this.subject = builder.subject;
        this.navigationRoot = builder.navigationRoot;
        this.entry = builder.entry;
        this.verb = builder.call.getNameAsString();
        this.verbTypeArguments = builder.call.getTypeArguments().map(List::copyOf).orElse(List.of());
        this.typeArgument = builder.typeArgument != null
                ? builder.typeArgument
                : verbTypeArguments.isEmpty() ? null : verbTypeArguments.get(0);
        this.valueArguments = List.copyOf(builder.valueArguments);
        this.wrapping = builder.wrapping;
        this.awaitLink = builder.awaitLink;
        this.awaitTimeout = List.copyOf(builder.awaitTimeout);
        this.descriptionArguments = List.copyOf(builder.descriptionArguments);
        this.requiredImports = Set.copyOf(builder.requiredImports);
    }

    static Builder builder(MethodCallExpr call, String entry, Expression subject) {
        return new Builder(call, entry, subject);
    }

    /**
     * The verb call, which is the node the replacement takes the place of.
     */
    public MethodCallExpr getCall() {
        return call;
    }

    public Expression getSubject() {
        return subject;
    }

    /**
     * The entry argument a navigated subject was rebuilt from; empty unless the wrapping is
     * {@link Wrapping#NULL_CONDITIONAL}.
     */
    public Optional<Expression> getNavigationRoot() {
        return Optional.ofNullable(navigationRoot);
    }

    public String getEntry() {
        return entry;
    }

    public String getVerb() {
        return verb;
    }

    /**
     * The asserted type: the verb's first explicit type argument, or the class a type-first entry was
     * given.
     */
    public Optional<Type> getTypeArgument() {
        return Optional.ofNullable(typeArgument);
    }

    public List<Expression> getValueArguments() {
        return valueArguments;
    }

    public Optional<Expression> getArgument(int index) {
        return index < valueArguments.size() ? Optional.of(valueArguments.get(index)) : Optional.empty();
    }

    public int getArgumentCount() {
        return valueArguments.size();
    }

    public Wrapping getWrapping() {
        return wrapping;
    }

    /**
     * {@code succeedsWithin} or {@code failsWithin} for awaited chains.
     */
    public Optional<String> getAwaitLink() {
        return Optional.ofNullable(awaitLink);
    }

    public List<Expression> getAwaitTimeout() {
        return awaitTimeout;
    }

    /**
     * Arguments of the description link closest to the verb; empty when the chain has none.
     */
    public List<Expression> getDescriptionArguments() {
        return descriptionArguments;
    }

    /**
     * Imports the rebuilt subject or the entry-implied type need, as qualified type names.
     */
    public Set<String> getRequiredImports() {
        return requiredImports;
    }

    /**
     * {@code entry().[awaitLink().]verb[<T,...>]}, the key the rule catalog matches on.
     */
    public String signature() {
        StringBuilder signature = new StringBuilder(entry).append("().");
        if (awaitLink != null) {
            signature.append(awaitLink).append("().");
        }
        signature.append(verb);
        if (!verbTypeArguments.isEmpty()) {
            signature.append(verbTypeArguments.stream().map(Type::asString).collect(Collectors.joining(",", "<", ">")));
        }
        return signature.toString();
    }

    @Override
    public String toString() {
        return signature() + " on " + subject;
    }

    static final class Builder {

        private final MethodCallExpr call;
        private final String entry;
        private final Expression subject;
        private Expression navigationRoot;
        private Type typeArgument;
        private final List<Expression> valueArguments = new ArrayList<>();
        private Wrapping wrapping = Wrapping.NONE;
        private String awaitLink;
        private final List<Expression> awaitTimeout = new ArrayList<>();
        private final List<Expression> descriptionArguments = new ArrayList<>();
        private final Set<String> requiredImports = new LinkedHashSet<>();

        private Builder(MethodCallExpr call, String entry, Expression subject) {
            this.call = call;
            this.entry = entry;
            this.subject = subject;
        }

        Builder typeArgument(Type type) {
            this.typeArgument = type;
            return this;
        }

        Builder valueArguments(List<Expression> arguments) {
            this.valueArguments.addAll(arguments);
            return this;
        }

        Builder wrapping(Wrapping wrapping) {
            this.wrapping = wrapping;
            return this;
        }

        Builder navigationRoot(Expression root) {
            this.navigationRoot = root;
            return this;
        }

        Builder await(String link, List<Expression> timeout) {
            this.wrapping = Wrapping.AWAITED;
            this.awaitLink = link;
            this.awaitTimeout.addAll(timeout);
            return this;
        }

        Builder description(List<Expression> arguments) {
            this.descriptionArguments.addAll(arguments);
            return this;
        }

        Builder requiredImport(String qualifiedName) {
            this.requiredImports.add(qualifiedName);
            return this;
        }

        AssertionChain build() {
            return new AssertionChain(this);
        }
    }
}
