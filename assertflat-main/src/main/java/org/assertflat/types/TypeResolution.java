package org.assertflat.types;

import java.util.function.Supplier;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily initialized type-resolution handle for one document.
 * <p>
 * The symbol solver is built and injected into the compilation unit on the first query, at most once.
 * When the type solver cannot be obtained the handle stays unavailable for the rest of the document.
 */
public final class TypeResolution {

    private static final Logger log = LoggerFactory.getLogger(TypeResolution.class);

    private final CompilationUnit compilationUnit;
    private final Supplier<? extends TypeSolver> typeSolverSupplier;

    private volatile boolean initialized;
    private boolean available;

    public TypeResolution(CompilationUnit compilationUnit, Supplier<? extends TypeSolver> typeSolverSupplier) {
        this.compilationUnit = compilationUnit;
        this.typeSolverSupplier = typeSolverSupplier;
    }

    /**
     * A handle that never resolves anything; every query against it answers unknown.
     */
    public static TypeResolution unavailable(CompilationUnit compilationUnit) {
        return new TypeResolution(compilationUnit, null);
    }

    public boolean isAvailable() {
        if (!initialized) {
            synchronized (this) {
                if (!initialized) {
                    available = initialize();
                    initialized = true;
                }
            }
        }
        return available;
    }

    /**
     * @throws IllegalStateException when resolution is unavailable
     * @throws RuntimeException whatever the symbol solver raises for an expression it cannot type
     */
    public ResolvedType resolve(Expression expression) {
        if (!isAvailable()) {
            throw new IllegalStateException("Type resolution is not available");
        }
        return expression.calculateResolvedType();
    }

    private boolean initialize() {
        if (typeSolverSupplier == null) {
            return false;
        }
        try {
            TypeSolver typeSolver = typeSolverSupplier.get();
            new JavaSymbolSolver(typeSolver).inject(compilationUnit);
            return true;
        } catch (RuntimeException e) {
            log.debug("Type resolution unavailable for {}: {}", describe(), e.getMessage());
            return false;
        }
    }

    private String describe() {
        return compilationUnit.getStorage()
                .map(storage -> storage.getPath().toString())
                .or(() -> compilationUnit.getPrimaryTypeName())
                .orElse("<document>");
    }
}
