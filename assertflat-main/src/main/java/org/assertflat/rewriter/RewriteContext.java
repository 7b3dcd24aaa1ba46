package org.assertflat.rewriter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.assertflat.synth.ExpressionSynthesizer;
import org.assertflat.synth.NameAllocator;
import org.assertflat.types.TypeClassifier;

/**
 * Per-document state of one rewrite pass: the classifier, fresh-name bookkeeping, the imports the
 * committed replacements need and the event counts.
 */
public class RewriteContext {

    private final String documentName;
    private final TypeClassifier classifier;
    private final RewriteListener listener;
    private final NameAllocator names = new NameAllocator();
    private final Set<String> staticImports = new TreeSet<>();
    private final Set<String> typeImports = new TreeSet<>();

    private int applied;
    private int rejected;
    private int failed;

    public RewriteContext(String documentName, TypeClassifier classifier, RewriteListener listener) {
        this.documentName = documentName;
        this.classifier = classifier;
        this.listener = listener;
    }

    public String getDocumentName() {
        return documentName;
    }

    public TypeClassifier getClassifier() {
        return classifier;
    }

    public NameAllocator getNames() {
        return names;
    }

    /**
     * Simple names of the JUnit {@code Assertions} methods the replacements call.
     */
    public Set<String> getStaticImports() {
        return Collections.unmodifiableSet(staticImports);
    }

    /**
     * Qualified names of the types the replacements reference.
     */
    public Set<String> getTypeImports() {
        return Collections.unmodifiableSet(typeImports);
    }

    public int getApplied() {
        return applied;
    }

    public int getRejected() {
        return rejected;
    }

    public int getFailed() {
        return failed;
    }

    void commit(ExpressionSynthesizer synth) {
        staticImports.addAll(synth.getStaticImports());
        typeImports.addAll(synth.getTypeImports());
    }

    void report(RewriteEvent.Kind kind, String ruleName, String signature, int line, Throwable failure) {
        switch (kind) {
            case APPLIED:
                applied++;
                break;
            case REJECTED:
                rejected++;
                break;
            default:
                failed++;
                break;
        }
        listener.onRewrite(new RewriteEvent(kind, documentName, ruleName, signature, line, failure));
    }
}
