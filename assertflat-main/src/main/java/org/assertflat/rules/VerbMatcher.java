package org.assertflat.rules;

import java.util.function.IntPredicate;
import java.util.regex.Pattern;

import org.assertflat.chain.AssertionChain;
import org.assertflat.chain.EntryPoints;

/**
 * Decides whether a rule applies to a chain, by its signature and, where one AssertJ verb stands for
 * several rules, by its argument count.
 */
@FunctionalInterface
public interface VerbMatcher {

    boolean matches(AssertionChain chain);

    /**
     * Value assertion ending in exactly {@code verb}, with or without an await link in front of it.
     */
    static VerbMatcher verb(String verb) {
        String prefix = EntryPoints.ASSERT_THAT + "().";
        String suffix = "." + verb;
        return chain -> {
            String signature = chain.signature();
            return signature.startsWith(prefix) && signature.endsWith(suffix);
        };
    }

    /**
     * Anchored regular expression over the whole signature.
     */
    static VerbMatcher pattern(String regex) {
        Pattern pattern = Pattern.compile("^" + regex + "$");
        return chain -> pattern.matcher(chain.signature()).matches();
    }

    /**
     * Value assertion ending in {@code verb}, optionally with explicit type arguments.
     */
    static VerbMatcher typedVerb(String verb) {
        return pattern(Pattern.quote(EntryPoints.ASSERT_THAT + "().") + "(?:succeedsWithin\\(\\)\\.)?"
                + Pattern.quote(verb) + "(?:<.+>)?");
    }

    default VerbMatcher withArity(IntPredicate arity) {
        return chain -> matches(chain) && arity.test(chain.getArgumentCount());
    }

    default VerbMatcher or(VerbMatcher other) {
        return chain -> matches(chain) || other.matches(chain);
    }
}
