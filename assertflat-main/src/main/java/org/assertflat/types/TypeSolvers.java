package org.assertflat.types;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.assertflat.TypeResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factories for the type solvers that back {@link TypeResolution}. Type solvers cache what they load
 * and are not safe for concurrent use, so project-wide suppliers hand each thread its own instance.
 */
public final class TypeSolvers {

    private static final Logger log = LoggerFactory.getLogger(TypeSolvers.class);

    private TypeSolvers() {
    }

    /**
     * JDK classes only.
     */
    public static Supplier<TypeSolver> jdkOnly() {
        return perThread(ReflectionTypeSolver::new);
    }

    /**
     * JDK classes, the given source roots and the jars of the given classpath. Directories on the
     * classpath are skipped. A jar that cannot be read surfaces as a {@link TypeResolutionException}
     * from the supplier.
     */
    public static Supplier<TypeSolver> forProject(List<Path> sourceRoots, List<Path> classpath) {
        List<Path> roots = List.copyOf(sourceRoots);
        List<Path> jars = List.copyOf(classpath);
        return perThread(() -> build(roots, jars));
    }

    static TypeSolver build(List<Path> sourceRoots, List<Path> classpath) {
        CombinedTypeSolver combined = new CombinedTypeSolver(new ReflectionTypeSolver());
        for (Path root : sourceRoots) {
            if (Files.isDirectory(root)) {
                combined.add(new JavaParserTypeSolver(root));
            }
        }
        for (Path entry : classpath) {
            if (Files.isDirectory(entry)) {
                log.debug("Skipping classpath directory {}", entry);
                continue;
            }
            try {
                combined.add(new JarTypeSolver(entry));
            } catch (IOException | RuntimeException e) {
                throw new TypeResolutionException("Unable to read classpath entry " + entry, e);
            }
        }
        return combined;
    }

    private static Supplier<TypeSolver> perThread(Supplier<TypeSolver> factory) {
        ThreadLocal<TypeSolver> solvers = ThreadLocal.withInitial(factory);
        return solvers::get;
    }
}
