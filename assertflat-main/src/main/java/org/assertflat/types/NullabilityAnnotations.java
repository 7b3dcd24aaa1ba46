package org.assertflat.types;

import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;

/**
 * Finds, within the same document, whether the declaration an expression refers to carries a
 * nullability annotation ({@code @Nullable} or {@code @CheckForNull} from any package).
 */
final class NullabilityAnnotations {

    private static final Set<String> NULLABLE_NAMES = Set.of("Nullable", "CheckForNull");

    private NullabilityAnnotations() {
    }

    static boolean isDeclaredNullable(Expression expression) {
        if (expression instanceof NameExpr) {
            return isNameNullable(expression, ((NameExpr) expression).getNameAsString());
        }
        if (expression instanceof FieldAccessExpr) {
            FieldAccessExpr fieldAccess = (FieldAccessExpr) expression;
            return fieldAccess.getScope().isThisExpr()
                    && fieldIn(expression, fieldAccess.getNameAsString()).map(NullabilityAnnotations::hasNullable).orElse(false);
        }
        if (expression instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) expression;
            boolean ownMethod = call.getScope().map(Expression::isThisExpr).orElse(true);
            return ownMethod && expression.findAncestor(TypeDeclaration.class)
                    .map(type -> ((TypeDeclaration<?>) type).getMethodsByName(call.getNameAsString()).stream()
                            .filter(method -> method.getParameters().size() == call.getArguments().size())
                            .anyMatch(NullabilityAnnotations::hasNullable))
                    .orElse(false);
        }
        return false;
    }

    private static boolean isNameNullable(Node reference, String name) {
        Node current = reference;
        while (current.getParentNode().isPresent()) {
            current = current.getParentNode().get();
            if (current instanceof LambdaExpr) {
                for (Parameter parameter : ((LambdaExpr) current).getParameters()) {
                    if (parameter.getNameAsString().equals(name)) {
                        return hasNullable(parameter);
                    }
                }
            }
            if (current instanceof CallableDeclaration) {
                CallableDeclaration<?> callable = (CallableDeclaration<?>) current;
                Optional<VariableDeclarator> local = callable.findFirst(VariableDeclarator.class,
                        declarator -> declarator.getNameAsString().equals(name));
                if (local.isPresent()) {
                    return local.get().getParentNode()
                            .filter(parent -> parent instanceof VariableDeclarationExpr)
                            .map(parent -> hasNullable((VariableDeclarationExpr) parent))
                            .orElse(false);
                }
                for (Parameter parameter : callable.getParameters()) {
                    if (parameter.getNameAsString().equals(name)) {
                        return hasNullable(parameter);
                    }
                }
            }
            if (current instanceof TypeDeclaration) {
                Optional<FieldDeclaration> field = ((TypeDeclaration<?>) current).getFieldByName(name);
                if (field.isPresent()) {
                    return hasNullable(field.get());
                }
            }
        }
        return false;
    }

    private static Optional<FieldDeclaration> fieldIn(Node reference, String name) {
        return reference.findAncestor(TypeDeclaration.class)
                .flatMap(type -> ((TypeDeclaration<?>) type).getFieldByName(name));
    }

    private static boolean hasNullable(NodeWithAnnotations<?> declaration) {
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            if (NULLABLE_NAMES.contains(annotation.getName().getIdentifier())) {
                return true;
            }
        }
        return false;
    }
}
