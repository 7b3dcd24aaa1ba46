package org.assertflat.migration;

public final class DocumentResult {

    private final String documentName;
    private final String original;
    private final String migrated;
    private final int applied;
    private final int rejected;
    private final int failed;

    public DocumentResult(String documentName, String original, String migrated, int applied, int rejected, int failed) {
        this.documentName = documentName;
        this.original = original;
        this.migrated = migrated;
        this.applied = applied;
        this.rejected = rejected;
        this.failed = failed;
    }

    static DocumentResult unchanged(String documentName, String source) {
        return new DocumentResult(documentName, source, source, 0, 0, 0);
    }

    public String getDocumentName() {
        return documentName;
    }

    public String getOriginal() {
        return original;
    }

    public String getMigrated() {
        return migrated;
    }

    public boolean isChanged() {
        return !original.equals(migrated);
    }

    /** Number of chains rewritten. */
    public int getApplied() {
        return applied;
    }

    /** Number of recognized chains left unchanged because no rule accepted them. */
    public int getRejected() {
        return rejected;
    }

    /** Number of chains left unchanged because rewriting them raised an exception. */
    public int getFailed() {
        return failed;
    }
}
