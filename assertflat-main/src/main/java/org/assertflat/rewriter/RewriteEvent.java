package org.assertflat.rewriter;

import java.util.Objects;

/**
 * Outcome of offering one recognized chain to the rule catalog.
 */
public final class RewriteEvent {

    public enum Kind {
        /** A rule produced the replacement. */
        APPLIED,
        /** A rule matched but declined the chain's shape, or no rule knows the verb. */
        REJECTED,
        /** Classifying or synthesizing raised an exception; the chain was left unchanged. */
        FAILED
    }

    private final Kind kind;
    private final String documentName;
    private final String ruleName;
    private final String signature;
    private final int line;
    private final Throwable failure;

    public RewriteEvent(Kind kind, String documentName, String ruleName, String signature, int line, Throwable failure) {
        this.kind = Objects.requireNonNull(kind);
        this.documentName = documentName;
        this.ruleName = ruleName;
        this.signature = signature;
        this.line = line;
        this.failure = failure;
    }

    public Kind getKind() {
        return kind;
    }

    public String getDocumentName() {
        return documentName;
    }

    /**
     * @return the matched rule's name, or null when no rule knows the verb
     */
    public String getRuleName() {
        return ruleName;
    }

    public String getSignature() {
        return signature;
    }

    /**
     * @return 1-based line of the chain in the original document, or -1 when unknown
     */
    public int getLine() {
        return line;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return kind + " " + (ruleName == null ? "<no rule>" : ruleName) + " for " + signature + " at " + documentName + ":" + line;
    }
}
