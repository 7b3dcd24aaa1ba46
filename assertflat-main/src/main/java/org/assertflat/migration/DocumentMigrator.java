package org.assertflat.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.github.javaparser.resolution.TypeSolver;
import org.assertflat.AssertFlatException;
import org.assertflat.DocumentParseException;
import org.assertflat.MigrationException;
import org.assertflat.rewriter.AssertionRewriter;
import org.assertflat.rewriter.LoggingRewriteListener;
import org.assertflat.rewriter.RewriteContext;
import org.assertflat.rewriter.RewriteListener;
import org.assertflat.types.TypeClassifier;
import org.assertflat.types.TypeResolution;
import org.assertflat.types.TypeSolvers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Migrates one Java source document. Code outside the rewritten chains keeps its exact formatting.
 */
public class DocumentMigrator {

    private static final Logger log = LoggerFactory.getLogger(DocumentMigrator.class);

    private static final String ASSERTJ_MARKER = "org.assertj";

    private final Supplier<? extends TypeSolver> typeSolvers;
    private final RewriteListener listener;
    private final AssertionRewriter rewriter = new AssertionRewriter();
    private final ImportMigrator importMigrator = new ImportMigrator();

    /**
     * Resolves types against the JDK only.
     */
    public DocumentMigrator() {
        this(TypeSolvers.jdkOnly(), new LoggingRewriteListener());
    }

    /**
     * @param typeSolvers supplies the type solver of the calling thread, or null to migrate without
     *                    type resolution
     */
    public DocumentMigrator(Supplier<? extends TypeSolver> typeSolvers, RewriteListener listener) {
        this.typeSolvers = typeSolvers;
        this.listener = listener;
    }

    public static DocumentMigrator withoutTypeResolution() {
        return new DocumentMigrator(null, new LoggingRewriteListener());
    }

    public DocumentResult migrate(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationException("Unable to read source file", file, e);
        }
        return migrate(file.toString(), source);
    }

    /**
     * @throws DocumentParseException when the source is not valid Java
     * @throws AssertFlatException when the rewritten document cannot be printed
     */
    public DocumentResult migrate(String documentName, String source) {
        if (!source.contains(ASSERTJ_MARKER)) {
            log.debug("{} does not use AssertJ, skipped", documentName);
            return DocumentResult.unchanged(documentName, source);
        }
        CompilationUnit compilationUnit = parse(documentName, source);
        TypeResolution resolution = typeSolvers == null
                ? TypeResolution.unavailable(compilationUnit)
                : new TypeResolution(compilationUnit, typeSolvers);
        RewriteContext context = new RewriteContext(documentName, new TypeClassifier(resolution), listener);
        rewriter.rewrite(compilationUnit, context);

        if (context.getApplied() == 0) {
            log.debug("{}: nothing rewritten ({} left unchanged, {} failed)", documentName, context.getRejected(), context.getFailed());
            return new DocumentResult(documentName, source, source, 0, context.getRejected(), context.getFailed());
        }
        importMigrator.apply(compilationUnit, context.getStaticImports(), context.getTypeImports());
        String migrated;
        try {
            migrated = LexicalPreservingPrinter.print(compilationUnit);
        } catch (RuntimeException e) {
            throw new AssertFlatException("Unable to print migrated " + documentName, e);
        }
        log.debug("{}: {} assertion(s) rewritten, {} left unchanged, {} failed", documentName,
                context.getApplied(), context.getRejected(), context.getFailed());
        return new DocumentResult(documentName, source, migrated, context.getApplied(), context.getRejected(), context.getFailed());
    }

    private static CompilationUnit parse(String documentName, String source) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setLexicalPreservationEnabled(true);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        Problem problem = result.getProblems().isEmpty() ? null : result.getProblem(0);
        Position position = problem == null ? null : problem.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin)
                .orElse(null);
        String message = "Parse error in " + documentName + (problem == null ? "" : ": " + problem.getMessage());
        throw new DocumentParseException(message, documentName,
                position == null ? -1 : position.line,
                position == null ? -1 : position.column);
    }
}
