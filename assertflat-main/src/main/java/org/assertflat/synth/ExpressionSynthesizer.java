package org.assertflat.synth;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnknownType;
import org.assertflat.chain.AssertionChain;
import org.assertflat.parser.util.AstUtils;

/**
 * Builds the replacement for one chain. Every operand taken from the original tree is cloned, and the
 * imports the replacement needs are recorded here until the rewrite is committed.
 */
public class ExpressionSynthesizer {

    public static final String JUNIT_ASSERTIONS = "org.junit.jupiter.api.Assertions";

    private final Node anchor;
    private final NameAllocator names;
    private final Set<String> staticImports = new TreeSet<>();
    private final Set<String> typeImports = new TreeSet<>();

    /**
     * @param anchor node of the original tree the replacement is built for; fresh names are checked
     *               against the declaration enclosing it
     */
    public ExpressionSynthesizer(Node anchor, NameAllocator names) {
        this.anchor = anchor;
        this.names = names;
    }

    /**
     * An unqualified call of a JUnit Jupiter assertion, e.g. {@code assertEquals(expected, actual)}.
     */
    public MethodCallExpr assertion(String method, Expression... arguments) {
        staticImports.add(method);
        return new MethodCallExpr(null, method, NodeList.nodeList(arguments));
    }

    public NameExpr typeName(String qualifiedName) {
        String simpleName = qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
        if (!qualifiedName.equals("java.lang." + simpleName)) {
            typeImports.add(qualifiedName);
        }
        return new NameExpr(simpleName);
    }

    public MethodCallExpr staticCall(String qualifiedType, String method, Expression... arguments) {
        return new MethodCallExpr(typeName(qualifiedType), method, NodeList.nodeList(arguments));
    }

    public MethodCallExpr call(Expression receiver, String method, Expression... arguments) {
        return new MethodCallExpr(AstUtils.asScope(receiver), method, NodeList.nodeList(arguments));
    }

    /**
     * {@code T.class} for the erasure of the given type.
     */
    public ClassExpr classLiteral(Type type) {
        Type erased = type.clone();
        if (erased instanceof ClassOrInterfaceType) {
            ((ClassOrInterfaceType) erased).removeTypeArguments();
        }
        return new ClassExpr(erased);
    }

    /**
     * The subject of an exception assertion as a JUnit {@code Executable}: lambdas and method references
     * are taken as they are, anything else is assumed to be a {@code ThrowingCallable} and referenced
     * through its {@code call} method.
     */
    public Expression executable(Expression callable) {
        Expression unwrapped = AstUtils.unwrapEnclosed(callable);
        if (unwrapped.isLambdaExpr() || unwrapped.isMethodReferenceExpr()) {
            return unwrapped.clone();
        }
        return new MethodReferenceExpr(AstUtils.asScope(callable.clone()), null, "call");
    }

    /**
     * {@code () -> body}.
     */
    public LambdaExpr lambda(Expression body) {
        return new LambdaExpr(new NodeList<>(), body).setEnclosingParameters(true);
    }

    public LambdaExpr lambda(String parameter, Expression body) {
        return new LambdaExpr(new Parameter(new UnknownType(), parameter), body);
    }

    public String freshName(String preferred) {
        return names.allocate(anchor, preferred);
    }

    /**
     * A boolean test of {@code subject} that does not dereference {@code null}: side-effect-free subjects
     * are tested twice ({@code s != null && test(s)}), others are evaluated once through
     * {@code Optional.ofNullable(s).map(v -> test(v)).orElse(whenNull)}.
     */
    public Expression nullSafeTest(Expression subject, UnaryOperator<Expression> test, boolean whenNull) {
        if (AstUtils.isSideEffectFree(subject)) {
            Expression guard = AstUtils.binary(subject.clone(), whenNull ? "==" : "!=", new NullLiteralExpr());
            return AstUtils.binary(guard, whenNull ? "||" : "&&", test.apply(subject.clone()));
        }
        String parameter = freshName("actual");
        return optionalPipeline(subject, parameter, test.apply(new NameExpr(parameter)), new BooleanLiteralExpr(whenNull));
    }

    /**
     * A value derived from {@code subject} that is {@code null} when the subject is.
     */
    public Expression nullSafeValue(Expression subject, UnaryOperator<Expression> access) {
        if (AstUtils.isSideEffectFree(subject)) {
            Expression guard = AstUtils.binary(subject.clone(), "==", new NullLiteralExpr());
            return new ConditionalExpr(guard, new NullLiteralExpr(), access.apply(subject.clone()));
        }
        String parameter = freshName("actual");
        return optionalPipeline(subject, parameter, access.apply(new NameExpr(parameter)), new NullLiteralExpr());
    }

    private Expression optionalPipeline(Expression subject, String parameter, Expression body, Expression fallback) {
        MethodCallExpr ofNullable = staticCall("java.util.Optional", "ofNullable", subject.clone());
        MethodCallExpr mapped = new MethodCallExpr(ofNullable, "map", NodeList.nodeList(lambda(parameter, body)));
        return new MethodCallExpr(mapped, "orElse", NodeList.nodeList(fallback));
    }

    /**
     * {@code future.get(amount, unit)} for the timeout of an await link, or empty when the timeout has
     * a shape that cannot be expressed as an amount and a {@code TimeUnit}, or when the future or the
     * timeout cannot be captured by the lambda the call ends up in.
     */
    public Optional<MethodCallExpr> await(Expression future, List<Expression> timeout) {
        if (!AstUtils.isCapturable(future) || !timeout.stream().allMatch(AstUtils::isCapturable)) {
            return Optional.empty();
        }
        return Timeouts.toAmountAndUnit(timeout, this)
                .map(amountAndUnit -> call(future.clone(), "get", amountAndUnit.toArray(new Expression[0])));
    }

    /**
     * Appends the chain's description as the assertion message ({@code assertAll} takes it as leading
     * heading instead), records the chain's own imports and moves the verb call's comment onto the
     * replacement.
     */
    public Expression finish(MethodCallExpr assertion, AssertionChain chain) {
        List<Expression> description = chain.getDescriptionArguments();
        if (!description.isEmpty()) {
            Expression message = description.size() == 1
                    ? description.get(0).clone()
                    : staticCall("java.lang.String", "format", description.stream().map(Expression::clone).toArray(Expression[]::new));
            if (assertion.getNameAsString().equals("assertAll")) {
                assertion.getArguments().add(0, message);
            } else {
                assertion.addArgument(message);
            }
        }
        chain.getRequiredImports().forEach(typeImports::add);
        chain.getCall().getComment().ifPresent(comment -> assertion.setComment(comment.clone()));
        return assertion;
    }

    public Set<String> getStaticImports() {
        return Collections.unmodifiableSet(staticImports);
    }

    public Set<String> getTypeImports() {
        return Collections.unmodifiableSet(typeImports);
    }
}
