package org.assertflat.chain;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;

/**
 * The AssertJ entry calls a chain can start with.
 */
public final class EntryPoints {

    /** Canonical entry of value assertions in a chain signature. */
    public static final String ASSERT_THAT = "assertThat";
    public static final String ASSERT_THAT_THROWN_BY = "assertThatThrownBy";
    public static final String ASSERT_THAT_CODE = "assertThatCode";
    public static final String ASSERT_THAT_EXCEPTION_OF_TYPE = "assertThatExceptionOfType";
    public static final String ASSERT_THAT_NO_EXCEPTION = "assertThatNoException";

    private static final Set<String> VALUE_ENTRIES = Set.of(
            "assertThat", "assertThatObject", "assertThatIterable", "assertThatCollection", "assertThatList");

    private static final Map<String, String> SHORTHAND_EXCEPTION_ENTRIES = Map.of(
            "assertThatIllegalArgumentException", "java.lang.IllegalArgumentException",
            "assertThatIllegalStateException", "java.lang.IllegalStateException",
            "assertThatNullPointerException", "java.lang.NullPointerException",
            "assertThatIOException", "java.io.IOException");

    private static final Set<String> ENTRY_SCOPES = Set.of(
            "Assertions",
            "AssertionsForClassTypes",
            "AssertionsForInterfaceTypes",
            "org.assertj.core.api.Assertions",
            "org.assertj.core.api.AssertionsForClassTypes",
            "org.assertj.core.api.AssertionsForInterfaceTypes");

    private EntryPoints() {
    }

    /**
     * The canonical signature name of the entry this call starts, if it is one: value entries all map
     * to {@link #ASSERT_THAT}, shorthand exception entries to {@link #ASSERT_THAT_EXCEPTION_OF_TYPE}.
     */
    public static Optional<String> canonicalEntry(MethodCallExpr call) {
        if (!isEntryScope(call)) {
            return Optional.empty();
        }
        String name = call.getNameAsString();
        int arguments = call.getArguments().size();
        if (VALUE_ENTRIES.contains(name) && arguments == 1) {
            return Optional.of(ASSERT_THAT);
        }
        if ((name.equals(ASSERT_THAT_THROWN_BY) || name.equals(ASSERT_THAT_CODE)) && arguments == 1) {
            return Optional.of(name);
        }
        if (name.equals(ASSERT_THAT_EXCEPTION_OF_TYPE) && arguments == 1) {
            return Optional.of(name);
        }
        if (SHORTHAND_EXCEPTION_ENTRIES.containsKey(name) && arguments == 0) {
            return Optional.of(ASSERT_THAT_EXCEPTION_OF_TYPE);
        }
        if (name.equals(ASSERT_THAT_NO_EXCEPTION) && arguments == 0) {
            return Optional.of(name);
        }
        return Optional.empty();
    }

    /**
     * True for entries whose subject is the verb's first argument rather than the entry's argument.
     */
    public static boolean isTypeFirst(String canonicalEntry) {
        return canonicalEntry.equals(ASSERT_THAT_EXCEPTION_OF_TYPE) || canonicalEntry.equals(ASSERT_THAT_NO_EXCEPTION);
    }

    /**
     * Qualified exception type implied by a shorthand entry name such as
     * {@code assertThatIllegalStateException}.
     */
    public static Optional<String> shorthandExceptionType(String entryName) {
        return Optional.ofNullable(SHORTHAND_EXCEPTION_ENTRIES.get(entryName));
    }

    private static boolean isEntryScope(MethodCallExpr call) {
        Optional<Expression> scope = call.getScope();
        return scope.isEmpty() || ENTRY_SCOPES.contains(scope.get().toString());
    }
}
