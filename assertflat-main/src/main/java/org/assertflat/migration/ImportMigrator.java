package org.assertflat.migration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.assertflat.synth.ExpressionSynthesizer;

/**
 * Brings the imports of a rewritten document in line with its code: adds the JUnit assertions and
 * helper types the replacements use, and drops AssertJ imports nothing refers to any more.
 */
public class ImportMigrator {

    private static final String ASSERTJ_PREFIX = "org.assertj.";

    private static final Set<String> ASSERTJ_STATIC_NAMES = Set.of(
            "within", "withinPercentage", "offset", "byLessThan", "entry", "tuple", "atIndex", "fail",
            "failBecauseExceptionWasNotThrown", "shouldHaveThrown", "filter", "allOf", "anyOf", "not", "in",
            "notIn", "contentOf", "linesOf", "from", "extractProperty", "assertWith", "condition");

    public void apply(CompilationUnit compilationUnit, Set<String> assertions, Set<String> types) {
        removeUnusedAssertJImports(compilationUnit);
        addAssertionImports(compilationUnit, assertions);
        addTypeImports(compilationUnit, types);
    }

    void removeUnusedAssertJImports(CompilationUnit compilationUnit) {
        Set<String> unscopedCalls = new HashSet<>();
        for (MethodCallExpr call : compilationUnit.findAll(MethodCallExpr.class, call -> call.getScope().isEmpty())) {
            unscopedCalls.add(call.getNameAsString());
        }
        Set<String> declaredMethods = new HashSet<>();
        for (MethodDeclaration method : compilationUnit.findAll(MethodDeclaration.class)) {
            declaredMethods.add(method.getNameAsString());
        }
        Set<String> referencedNames = new HashSet<>();
        for (NameExpr name : compilationUnit.findAll(NameExpr.class)) {
            referencedNames.add(name.getNameAsString());
        }
        for (ClassOrInterfaceType type : compilationUnit.findAll(ClassOrInterfaceType.class)) {
            referencedNames.add(type.getNameAsString());
        }
        boolean usesAssertJStatics = unscopedCalls.stream()
                .filter(name -> !declaredMethods.contains(name))
                .anyMatch(ImportMigrator::isAssertJStaticName);

        List<ImportDeclaration> unused = new ArrayList<>();
        for (ImportDeclaration declaration : compilationUnit.getImports()) {
            String name = declaration.getNameAsString();
            if (!name.startsWith(ASSERTJ_PREFIX)) {
                continue;
            }
            String simpleName = name.substring(name.lastIndexOf('.') + 1);
            if (declaration.isStatic() && declaration.isAsterisk()) {
                if (!usesAssertJStatics) {
                    unused.add(declaration);
                }
            } else if (declaration.isStatic()) {
                if (!unscopedCalls.contains(simpleName) && !referencedNames.contains(simpleName)) {
                    unused.add(declaration);
                }
            } else if (!declaration.isAsterisk() && !referencedNames.contains(simpleName)) {
                unused.add(declaration);
            }
        }
        unused.forEach(ImportDeclaration::remove);
    }

    void addAssertionImports(CompilationUnit compilationUnit, Set<String> assertions) {
        boolean wildcard = compilationUnit.getImports().stream()
                .anyMatch(declaration -> declaration.isStatic() && declaration.isAsterisk()
                        && declaration.getNameAsString().equals(ExpressionSynthesizer.JUNIT_ASSERTIONS));
        if (wildcard) {
            return;
        }
        for (String assertion : assertions) {
            String qualified = ExpressionSynthesizer.JUNIT_ASSERTIONS + "." + assertion;
            if (!isImported(compilationUnit, qualified, true)) {
                compilationUnit.addImport(new ImportDeclaration(qualified, true, false));
            }
        }
    }

    void addTypeImports(CompilationUnit compilationUnit, Set<String> types) {
        for (String type : types) {
            String packageName = type.substring(0, type.lastIndexOf('.'));
            boolean packageImported = compilationUnit.getImports().stream()
                    .anyMatch(declaration -> !declaration.isStatic() && declaration.isAsterisk()
                            && declaration.getNameAsString().equals(packageName));
            boolean samePackage = compilationUnit.getPackageDeclaration()
                    .map(declaration -> declaration.getNameAsString().equals(packageName))
                    .orElse(false);
            if (!packageImported && !samePackage && !isImported(compilationUnit, type, false)) {
                compilationUnit.addImport(new ImportDeclaration(type, false, false));
            }
        }
    }

    private static boolean isImported(CompilationUnit compilationUnit, String qualifiedName, boolean isStatic) {
        return compilationUnit.getImports().stream()
                .anyMatch(declaration -> declaration.isStatic() == isStatic && !declaration.isAsterisk()
                        && declaration.getNameAsString().equals(qualifiedName));
    }

    private static boolean isAssertJStaticName(String name) {
        return name.startsWith("assertThat") || name.startsWith("catchThrowable") || name.startsWith("then")
                || ASSERTJ_STATIC_NAMES.contains(name);
    }
}
