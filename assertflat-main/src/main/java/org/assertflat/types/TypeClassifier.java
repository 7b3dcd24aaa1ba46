package org.assertflat.types;

import java.util.Set;
import java.util.function.Function;

import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedPrimitiveType;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import org.assertflat.parser.util.AstUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers the structural questions the rewrite rules ask about an expression. Every query degrades
 * to {@link TriState#UNKNOWN} when resolution is unavailable or the symbol solver cannot type the
 * expression; nothing here throws.
 */
public class TypeClassifier {

    private static final Logger log = LoggerFactory.getLogger(TypeClassifier.class);

    private static final Set<String> SIZED_TYPES = Set.of("java.util.Collection", "java.util.Map");
    private static final Set<String> ELEMENT_WISE_TYPES = Set.of(
            "java.lang.Iterable",
            "java.util.Iterator",
            "java.util.Map",
            "java.util.stream.BaseStream");
    private static final Set<String> CALLABLE_TYPES = Set.of(
            "java.lang.Runnable",
            "java.util.concurrent.Callable",
            "org.assertj.core.api.ThrowableAssert.ThrowingCallable",
            "org.junit.jupiter.api.function.Executable");
    private static final Set<String> BOXED_NUMBERS = Set.of(
            "java.lang.Byte",
            "java.lang.Short",
            "java.lang.Integer",
            "java.lang.Long",
            "java.lang.Float",
            "java.lang.Double",
            "java.lang.Character");

    private final TypeResolution resolution;

    public TypeClassifier(TypeResolution resolution) {
        this.resolution = resolution;
    }

    public TriState isNullable(Expression expression) {
        Expression unwrapped = AstUtils.unwrapEnclosed(expression);
        if (isNullPropagating(unwrapped)) {
            return TriState.TRUE;
        }
        if (isPresenceChecked(unwrapped)) {
            return TriState.FALSE;
        }
        return query(expression, type -> {
            if (type.isPrimitive()) {
                return TriState.FALSE;
            }
            if (type.isNull()) {
                return TriState.TRUE;
            }
            return TriState.of(NullabilityAnnotations.isDeclaredNullable(unwrapped));
        });
    }

    public TriState isArray(Expression expression) {
        return query(expression, type -> TriState.of(type.isArray()));
    }

    /**
     * Sized and countable: assignable to {@code java.util.Collection} or {@code java.util.Map}.
     */
    public TriState isCollection(Expression expression) {
        return query(expression, type -> TriState.of(isAssignableToAny(type, SIZED_TYPES)));
    }

    public TriState isMap(Expression expression) {
        return query(expression, type -> TriState.of(isAssignableToAny(type, Set.of("java.util.Map"))));
    }

    /**
     * Values AssertJ asserts on element by element: iterables, iterators, maps and streams.
     */
    public TriState isIterable(Expression expression) {
        return query(expression, type -> TriState.of(isAssignableToAny(type, ELEMENT_WISE_TYPES)));
    }

    public TriState isOptional(Expression expression) {
        return query(expression, type -> TriState.of(type.isReferenceType()
                && type.asReferenceType().getQualifiedName().equals("java.util.Optional")));
    }

    public TriState isCallableOrPredicate(Expression expression) {
        Expression unwrapped = AstUtils.unwrapEnclosed(expression);
        if (unwrapped.isLambdaExpr() || unwrapped.isMethodReferenceExpr()) {
            return TriState.TRUE;
        }
        return query(expression, type -> {
            if (!type.isReferenceType()) {
                return TriState.FALSE;
            }
            ResolvedReferenceType reference = type.asReferenceType();
            String name = reference.getQualifiedName();
            if (name.startsWith("java.util.function.") || CALLABLE_TYPES.contains(name)) {
                return TriState.TRUE;
            }
            return TriState.of(reference.getTypeDeclaration()
                    .filter(ResolvedReferenceTypeDeclaration::isInterface)
                    .map(ResolvedReferenceTypeDeclaration::isFunctionalInterface)
                    .orElse(false));
        });
    }

    /**
     * Assignable to {@code java.lang.CharSequence}.
     */
    public TriState isText(Expression expression) {
        return query(expression, type -> TriState.of(isAssignableToAny(type, Set.of("java.lang.CharSequence"))));
    }

    /**
     * A primitive other than {@code boolean}, or one of the boxed {@code java.lang} number types.
     */
    public TriState isNumeric(Expression expression) {
        return query(expression, type -> {
            if (type.isPrimitive()) {
                return TriState.of(type.asPrimitive() != ResolvedPrimitiveType.BOOLEAN);
            }
            return TriState.of(type.isReferenceType() && BOXED_NUMBERS.contains(type.asReferenceType().getQualifiedName()));
        });
    }

    private TriState query(Expression expression, Function<ResolvedType, TriState> question) {
        if (!resolution.isAvailable()) {
            return TriState.UNKNOWN;
        }
        try {
            return question.apply(resolution.resolve(expression));
        } catch (RuntimeException e) {
            log.trace("Cannot classify '{}': {}", expression, e.toString());
            return TriState.UNKNOWN;
        }
    }

    private static boolean isAssignableToAny(ResolvedType type, Set<String> qualifiedNames) {
        if (!type.isReferenceType()) {
            return false;
        }
        ResolvedReferenceType reference = type.asReferenceType();
        if (qualifiedNames.contains(reference.getQualifiedName())) {
            return true;
        }
        return reference.getAllAncestors().stream()
                .anyMatch(ancestor -> qualifiedNames.contains(ancestor.getQualifiedName()));
    }

    private static boolean isPresenceChecked(Expression expression) {
        return expression instanceof MethodCallExpr
                && ((MethodCallExpr) expression).getNameAsString().equals("orElseThrow")
                && ((MethodCallExpr) expression).getArguments().isEmpty();
    }

    private static boolean isNullPropagating(Expression expression) {
        if (expression.isNullLiteralExpr()) {
            return true;
        }
        if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            return AstUtils.unwrapEnclosed(conditional.getThenExpr()).isNullLiteralExpr()
                    || AstUtils.unwrapEnclosed(conditional.getElseExpr()).isNullLiteralExpr();
        }
        if (expression instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) expression;
            return call.getNameAsString().equals("orElse")
                    && call.getArguments().size() == 1
                    && call.getArgument(0).isNullLiteralExpr();
        }
        return false;
    }
}
