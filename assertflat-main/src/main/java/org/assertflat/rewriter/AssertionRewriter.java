package org.assertflat.rewriter;

import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import org.assertflat.chain.AssertionChain;
import org.assertflat.chain.ChainExtractor;
import org.assertflat.rules.RuleCatalog;
import org.assertflat.rules.RuleContext;
import org.assertflat.synth.ExpressionSynthesizer;

/**
 * Walks a compilation unit and replaces every recognized AssertJ chain with the JUnit assertion its
 * rule produces.
 * <p>
 * Children are visited before their parent, so chains nested in lambdas or arguments are rewritten
 * first and the outer chain is matched against the already rewritten children. A failure while
 * rewriting one chain leaves that chain unchanged and does not stop the walk.
 */
public class AssertionRewriter extends ModifierVisitor<RewriteContext> {

    private final ChainExtractor extractor;
    private final RuleCatalog catalog;

    public AssertionRewriter() {
        this(new ChainExtractor(), RuleCatalog.standard());
    }

    public AssertionRewriter(ChainExtractor extractor, RuleCatalog catalog) {
        this.extractor = extractor;
        this.catalog = catalog;
    }

    public void rewrite(CompilationUnit compilationUnit, RewriteContext context) {
        compilationUnit.accept(this, context);
    }

    @Override
    public Visitable visit(MethodCallExpr n, RewriteContext context) {
        super.visit(n, context);
        Optional<AssertionChain> chain = extractor.extract(n);
        if (chain.isEmpty()) {
            return n;
        }
        return rewrite(chain.get(), n, context);
    }

    private Expression rewrite(AssertionChain chain, MethodCallExpr call, RewriteContext context) {
        String signature = chain.signature();
        int line = call.getBegin().map(position -> position.line).orElse(-1);
        Optional<RuleCatalog.Entry> entry = catalog.lookup(chain);
        if (entry.isEmpty()) {
            context.report(RewriteEvent.Kind.REJECTED, null, signature, line, null);
            return call;
        }
        String ruleName = entry.get().getName();
        ExpressionSynthesizer synth = new ExpressionSynthesizer(call, context.getNames());
        RuleContext ruleContext = new RuleContext(chain, context.getClassifier(), synth);
        try {
            if (!ruleContext.navigatesFromSingleValue()) {
                context.report(RewriteEvent.Kind.REJECTED, ruleName, signature, line, null);
                return call;
            }
            Optional<MethodCallExpr> replacement = entry.get().getRule().apply(ruleContext);
            if (replacement.isEmpty()) {
                context.report(RewriteEvent.Kind.REJECTED, ruleName, signature, line, null);
                return call;
            }
            Expression result = synth.finish(replacement.get(), chain);
            context.commit(synth);
            context.report(RewriteEvent.Kind.APPLIED, ruleName, signature, line, null);
            return result;
        } catch (RuntimeException e) {
            context.report(RewriteEvent.Kind.FAILED, ruleName, signature, line, e);
            return call;
        }
    }
}
