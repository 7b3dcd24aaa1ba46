package org.assertflat.rules;

import java.util.Optional;

import com.github.javaparser.ast.expr.MethodCallExpr;

/**
 * Produces the JUnit assertion replacing one chain, or nothing when the chain's shape is not safely
 * expressible; the chain then stays as it is.
 */
@FunctionalInterface
public interface RewriteRule {

    Optional<MethodCallExpr> apply(RuleContext context);
}
