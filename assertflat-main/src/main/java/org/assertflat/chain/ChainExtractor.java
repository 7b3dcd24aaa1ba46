package org.assertflat.chain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.assertflat.parser.util.AstUtils;

/**
 * Recognizes AssertJ chains at a verb call and decomposes them into an {@link AssertionChain}.
 * <p>
 * Only chains in statement position are recognized: a chain whose result is used as a value is
 * left alone, and so are the inner links of a longer chain.
 */
public class ChainExtractor {

    private static final Set<String> DESCRIPTION_LINKS = Set.of("as", "describedAs", "withFailMessage", "overridingErrorMessage");
    private static final Set<String> AWAIT_LINKS = Set.of("succeedsWithin", "failsWithin");
    private static final String OPTIONAL = "java.util.Optional";

    /**
     * Tries the await, navigation and plain shapes in that order.
     */
    public Optional<AssertionChain> extract(MethodCallExpr call) {
        Optional<AssertionChain> chain = extractFromAwait(call);
        if (chain.isEmpty()) {
            chain = extractFromNullConditional(call);
        }
        if (chain.isEmpty()) {
            chain = extractFromInvocation(call);
        }
        return chain;
    }

    /**
     * {@code ENTRY(subject).[description].verb(args)}, including the type-first entries whose subject is
     * the verb's first argument.
     */
    public Optional<AssertionChain> extractFromInvocation(MethodCallExpr call) {
        if (!isInStatementPosition(call)) {
            return Optional.empty();
        }
        Receiver receiver = receiverOf(call);
        if (receiver == null) {
            return Optional.empty();
        }
        MethodCallExpr entryCall = receiver.call;
        Optional<String> entry = EntryPoints.canonicalEntry(entryCall);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        AssertionChain.Builder builder;
        if (EntryPoints.isTypeFirst(entry.get())) {
            if (call.getArguments().isEmpty()) {
                return Optional.empty();
            }
            builder = AssertionChain.builder(call, entry.get(), call.getArgument(0))
                    .valueArguments(call.getArguments().subList(1, call.getArguments().size()));
            if (!applyEntryType(entryCall, builder)) {
                return Optional.empty();
            }
        } else {
            builder = AssertionChain.builder(call, entry.get(), entryCall.getArgument(0))
                    .valueArguments(call.getArguments());
        }
        return Optional.of(builder.description(receiver.description).build());
    }

    /**
     * {@code assertThat(x).[get()].extracting(fn)...verb(args)}: the run of navigation links between the
     * entry and the verb becomes a rebuilt subject that fails like AssertJ does on a missing value.
     * {@code get()} becomes {@code x.orElseThrow()}, every {@code extracting(fn)} but the last
     * {@code Optional.of(v).map(fn).orElseThrow()} and the last one {@code Optional.of(v).map(fn).orElse(null)}.
     * Whether the root is a single object is left to the caller, which has the type information.
     */
    public Optional<AssertionChain> extractFromNullConditional(MethodCallExpr call) {
        if (!isInStatementPosition(call)) {
            return Optional.empty();
        }
        Receiver receiver = receiverOf(call);
        if (receiver == null) {
            return Optional.empty();
        }
        Deque<MethodCallExpr> links = new ArrayDeque<>();
        MethodCallExpr current = receiver.call;
        while (isNavigationLink(current) && current.getScope().filter(Expression::isMethodCallExpr).isPresent()) {
            links.push(current);
            current = current.getScope().get().asMethodCallExpr();
        }
        if (links.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> entry = EntryPoints.canonicalEntry(current);
        if (entry.isEmpty() || !entry.get().equals(EntryPoints.ASSERT_THAT)) {
            return Optional.empty();
        }

        Expression original = current.getArgument(0);
        Expression value = original.clone();
        if (links.peek().getNameAsString().equals("get")) {
            links.pop();
            value = new MethodCallExpr(AstUtils.asScope(value), "orElseThrow");
        }
        boolean needsOptional = !links.isEmpty();
        while (!links.isEmpty()) {
            MethodCallExpr link = links.pop();
            if (!link.getNameAsString().equals("extracting")) {
                return Optional.empty();
            }
            MethodCallExpr mapped = new MethodCallExpr(
                    new MethodCallExpr(new NameExpr("Optional"), "of", NodeList.nodeList(value)),
                    "map", NodeList.nodeList(link.getArgument(0).clone()));
            value = links.isEmpty()
                    ? new MethodCallExpr(mapped, "orElse", NodeList.nodeList(new NullLiteralExpr()))
                    : new MethodCallExpr(mapped, "orElseThrow");
        }

        AssertionChain.Builder builder = AssertionChain.builder(call, entry.get(), value)
                .valueArguments(call.getArguments())
                .wrapping(Wrapping.NULL_CONDITIONAL)
                .navigationRoot(original)
                .description(receiver.description);
        if (needsOptional) {
            builder.requiredImport(OPTIONAL);
        }
        return Optional.of(builder.build());
    }

    /**
     * {@code assertThat(future).succeedsWithin(t).verb(args)} and
     * {@code assertThat(future).failsWithin(t).verb(args)}. The subject stays the future; the await
     * link and its timeout are carried on the chain.
     */
    public Optional<AssertionChain> extractFromAwait(MethodCallExpr call) {
        if (!isInStatementPosition(call)) {
            return Optional.empty();
        }
        Receiver receiver = receiverOf(call);
        if (receiver == null) {
            return Optional.empty();
        }
        MethodCallExpr link = receiver.call;
        if (!AWAIT_LINKS.contains(link.getNameAsString())
                || link.getArguments().isEmpty() || link.getArguments().size() > 2
                || link.getScope().filter(Expression::isMethodCallExpr).isEmpty()) {
            return Optional.empty();
        }
        MethodCallExpr entryCall = link.getScope().get().asMethodCallExpr();
        Optional<String> entry = EntryPoints.canonicalEntry(entryCall);
        if (entry.isEmpty() || !entry.get().equals(EntryPoints.ASSERT_THAT)) {
            return Optional.empty();
        }
        return Optional.of(AssertionChain.builder(call, entry.get(), entryCall.getArgument(0))
                .valueArguments(call.getArguments())
                .await(link.getNameAsString(), link.getArguments())
                .description(receiver.description)
                .build());
    }

    public static boolean isInStatementPosition(MethodCallExpr call) {
        return call.getParentNode().filter(parent -> parent instanceof ExpressionStmt).isPresent();
    }

    private static boolean isNavigationLink(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (name.equals("get")) {
            return call.getArguments().isEmpty();
        }
        if (name.equals("extracting")) {
            return call.getArguments().size() == 1
                    && (call.getArgument(0).isLambdaExpr() || call.getArgument(0).isMethodReferenceExpr());
        }
        return false;
    }

    private static boolean applyEntryType(MethodCallExpr entryCall, AssertionChain.Builder builder) {
        String name = entryCall.getNameAsString();
        if (name.equals(EntryPoints.ASSERT_THAT_NO_EXCEPTION)) {
            return true;
        }
        Optional<String> shorthand = EntryPoints.shorthandExceptionType(name);
        if (shorthand.isPresent()) {
            String qualified = shorthand.get();
            builder.typeArgument(new ClassOrInterfaceType(null, qualified.substring(qualified.lastIndexOf('.') + 1)));
            if (!qualified.startsWith("java.lang.")) {
                builder.requiredImport(qualified);
            }
            return true;
        }
        Expression typeExpression = entryCall.getArgument(0);
        if (typeExpression instanceof ClassExpr) {
            builder.typeArgument(((ClassExpr) typeExpression).getType());
            return true;
        }
        return false;
    }

    /**
     * Skips the description links directly in front of the verb. Returns null when the verb has no
     * method-call receiver or a description link has no message.
     */
    private static Receiver receiverOf(MethodCallExpr verbCall) {
        List<Expression> description = null;
        Optional<Expression> scope = verbCall.getScope();
        while (scope.isPresent() && scope.get().isMethodCallExpr()) {
            MethodCallExpr candidate = scope.get().asMethodCallExpr();
            if (!DESCRIPTION_LINKS.contains(candidate.getNameAsString())) {
                return new Receiver(candidate, description == null ? List.of() : description);
            }
            if (candidate.getArguments().isEmpty()) {
                return null;
            }
            if (description == null) {
                description = new ArrayList<>(candidate.getArguments());
            }
            scope = candidate.getScope();
        }
        return null;
    }

    private static final class Receiver {

        private final MethodCallExpr call;
        private final List<Expression> description;

        private Receiver(MethodCallExpr call, List<Expression> description) {
            this.call = call;
            this.description = description;
        }
    }
}
