package org.assertflat.migration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Totals of a project run.
 */
public final class MigrationReport {

    private final boolean dryRun;
    private final int filesScanned;
    private final List<Path> changedFiles;
    private final Map<Path, String> failures;
    private final int rewritesApplied;
    private final int rewritesRejected;
    private final int rewritesFailed;

    private MigrationReport(Builder builder) {
        this.dryRun = builder.dryRun;
        this.filesScanned = builder.filesScanned;
        List<Path> changed = new ArrayList<>(builder.changedFiles);
        Collections.sort(changed);
        this.changedFiles = Collections.unmodifiableList(changed);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.failures));
        this.rewritesApplied = builder.rewritesApplied;
        this.rewritesRejected = builder.rewritesRejected;
        this.rewritesFailed = builder.rewritesFailed;
    }

    static Builder builder(boolean dryRun) {
        return new Builder(dryRun);
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int getFilesScanned() {
        return filesScanned;
    }

    public int getFilesChanged() {
        return changedFiles.size();
    }

    public int getFilesFailed() {
        return failures.size();
    }

    /**
     * Files that were rewritten, or in a dry run would have been.
     */
    public List<Path> getChangedFiles() {
        return changedFiles;
    }

    /**
     * Failure message per file that could not be parsed, read or written.
     */
    public Map<Path, String> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int getRewritesApplied() {
        return rewritesApplied;
    }

    public int getRewritesRejected() {
        return rewritesRejected;
    }

    public int getRewritesFailed() {
        return rewritesFailed;
    }

    @Override
    public String toString() {
        return String.format("%d file(s) scanned, %d %s, %d failed; %d assertion(s) rewritten, %d left unchanged, %d failed",
                filesScanned, getFilesChanged(), dryRun ? "would change" : "changed", getFilesFailed(),
                rewritesApplied, rewritesRejected, rewritesFailed);
    }

    static final class Builder {

        private final boolean dryRun;
        private int filesScanned;
        private final List<Path> changedFiles = new ArrayList<>();
        private final Map<Path, String> failures = new LinkedHashMap<>();
        private int rewritesApplied;
        private int rewritesRejected;
        private int rewritesFailed;

        private Builder(boolean dryRun) {
            this.dryRun = dryRun;
        }

        synchronized Builder add(Path file, DocumentResult result) {
            filesScanned++;
            if (result.isChanged()) {
                changedFiles.add(file);
            }
            rewritesApplied += result.getApplied();
            rewritesRejected += result.getRejected();
            rewritesFailed += result.getFailed();
            return this;
        }

        synchronized Builder failed(Path file, String message) {
            filesScanned++;
            failures.put(file, message);
            return this;
        }

        synchronized MigrationReport build() {
            return new MigrationReport(this);
        }
    }
}
