package org.assertflat.test;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Compiles migrated sources with the system Java compiler against the test classpath, and runs
 * methods of the compiled classes.
 */
public final class CompiledSources {

    private CompiledSources() {
    }

    /**
     * Compiles one source file into {@code directory/classes}.
     *
     * @return the compiler's error messages, empty when the source compiled
     */
    public static List<String> compile(Path directory, String qualifiedName, String source) throws IOException {
        Path file = directory.resolve("src").resolve(qualifiedName.replace('.', File.separatorChar) + ".java");
        Files.createDirectories(file.getParent());
        Files.writeString(file, source);
        Path classes = Files.createDirectories(directory.resolve("classes"));

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(diagnostics, null, null)) {
            List<String> options = List.of("-proc:none", "-d", classes.toString(), "-classpath", classpath());
            compiler.getTask(null, fileManager, diagnostics, options, null, fileManager.getJavaFileObjects(file.toFile()))
                    .call();
        }
        return diagnostics.getDiagnostics().stream()
                .filter(diagnostic -> diagnostic.getKind() == Diagnostic.Kind.ERROR)
                .map(diagnostic -> "line " + diagnostic.getLineNumber() + ": " + diagnostic.getMessage(null))
                .collect(Collectors.toList());
    }

    /**
     * Instantiates a class compiled by {@link #compile} and calls one of its no-argument methods.
     * Whatever the method throws is rethrown as it is.
     */
    public static void invoke(Path directory, String qualifiedName, String methodName) throws Throwable {
        URL[] urls = {directory.resolve("classes").toUri().toURL()};
        try (URLClassLoader loader = new URLClassLoader(urls, CompiledSources.class.getClassLoader())) {
            Class<?> type = loader.loadClass(qualifiedName);
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            Method method = type.getDeclaredMethod(methodName);
            method.setAccessible(true);
            try {
                method.invoke(constructor.newInstance());
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }
    }

    /**
     * The test classpath, with the assertion libraries named explicitly in case it is hidden behind a
     * manifest-only jar.
     */
    private static String classpath() {
        Set<String> entries = new LinkedHashSet<>();
        entries.add(location(org.junit.jupiter.api.Assertions.class));
        entries.add(location(org.assertj.core.api.Assertions.class));
        entries.addAll(List.of(System.getProperty("java.class.path").split(File.pathSeparator)));
        return String.join(File.pathSeparator, entries);
    }

    private static String location(Class<?> type) {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Cannot locate " + type.getName(), e);
        }
    }
}
