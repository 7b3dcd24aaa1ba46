package org.assertflat.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.assertflat.chain.AssertionChain;

import static org.assertflat.rules.VerbMatcher.pattern;
import static org.assertflat.rules.VerbMatcher.typedVerb;
import static org.assertflat.rules.VerbMatcher.verb;

/**
 * Ordered list of rewrite rules. The first entry whose matcher accepts a chain's signature is the
 * only one applied to it, so entries sharing a verb are ordered most specific first.
 */
public final class RuleCatalog {

    private static final String THROWING_ENTRY = "(?:assertThatThrownBy|assertThatCode)\\(\\)\\.";
    private static final String TYPE_ARGUMENTS = "(?:<.+>)?";

    private static final RuleCatalog STANDARD = builder()
            .rule("BePositive", verb("isPositive"), EqualityRules::bePositive)
            .rule("BeNegative", verb("isNegative"), EqualityRules::beNegative)
            .rule("Be", verb("isEqualTo"), EqualityRules::be)
            .rule("NotBe", verb("isNotEqualTo"), EqualityRules::notBe)
            .rule("BeSameAs", verb("isSameAs"), EqualityRules::beSameAs)
            .rule("NotBeSameAs", verb("isNotSameAs"), EqualityRules::notBeSameAs)
            .rule("BeTrue", verb("isTrue"), EqualityRules::beTrue)
            .rule("BeFalse", verb("isFalse"), EqualityRules::beFalse)
            .rule("BeNull", verb("isNull"), EqualityRules::beNull)
            .rule("NotBeNull", verb("isNotNull"), EqualityRules::notBeNull)
            .rule("BeEmpty", verb("isEmpty"), CollectionRules::beEmpty)
            .rule("NotBeEmpty", verb("isNotEmpty"), CollectionRules::notBeEmpty)
            .rule("BeNullOrEmpty", verb("isNullOrEmpty"), CollectionRules::beNullOrEmpty)
            .rule("Throw", pattern(THROWING_ENTRY + "isInstanceOf" + TYPE_ARGUMENTS)
                    .or(pattern("assertThatExceptionOfType\\(\\)\\.isThrownBy" + TYPE_ARGUMENTS)), ExceptionRules::throwing)
            .rule("ThrowExactly", pattern(THROWING_ENTRY + "isExactlyInstanceOf" + TYPE_ARGUMENTS), ExceptionRules::throwingExactly)
            .rule("NotThrow", pattern("assertThatCode\\(\\)\\.doesNotThrowAnyException")
                    .or(pattern("assertThatNoException\\(\\)\\.isThrownBy" + TYPE_ARGUMENTS)), ExceptionRules::notThrowing)
            .rule("ThrowAsync", pattern("assertThat\\(\\)\\.failsWithin\\(\\)\\.withThrowableOfType" + TYPE_ARGUMENTS)
                    .or(pattern("assertThat\\(\\)\\.failsWithin")), ExceptionRules::throwingAsync)
            .rule("NotThrowAsync", pattern("assertThat\\(\\)\\.succeedsWithin"), ExceptionRules::notThrowingAsync)
            .rule("BeOfType", typedVerb("isExactlyInstanceOf"), ExceptionRules::beOfType)
            .rule("NotBeOfType", typedVerb("isNotExactlyInstanceOf"), ExceptionRules::notBeOfType)
            .rule("BeAssignableTo", typedVerb("isInstanceOf"), ExceptionRules::beAssignableTo)
            .rule("NotBeAssignableTo", typedVerb("isNotInstanceOf"), ExceptionRules::notBeAssignableTo)
            .rule("BeEquivalentTo", verb("containsExactlyElementsOf").or(verb("containsExactly")), CollectionRules::beEquivalentTo)
            .rule("ContainAll", verb("contains").withArity(count -> count >= 2), CollectionRules::containAll)
            .rule("Contain", verb("contains").withArity(count -> count == 1), CollectionRules::contain)
            .rule("NotContain", verb("doesNotContain").withArity(count -> count == 1), CollectionRules::notContain)
            .rule("AnyMatch", verb("anyMatch"), CollectionRules::anyMatch)
            .rule("NoneMatch", verb("noneMatch"), CollectionRules::noneMatch)
            .rule("AllMatch", verb("allMatch"), CollectionRules::allMatch)
            .rule("HaveCount", verb("hasSize"), CollectionRules::haveCount)
            .rule("StartWith", verb("startsWith"), TextRules::startWith)
            .rule("EndWith", verb("endsWith"), TextRules::endWith)
            .rule("BeGreaterThan", verb("isGreaterThan"), ComparisonRules.ordering(">"))
            .rule("BeLessThan", verb("isLessThan"), ComparisonRules.ordering("<"))
            .rule("BeGreaterOrEqualTo", verb("isGreaterThanOrEqualTo"), ComparisonRules.ordering(">="))
            .rule("BeLessOrEqualTo", verb("isLessThanOrEqualTo"), ComparisonRules.ordering("<="))
            .rule("BeBefore", verb("isBefore"), ComparisonRules.temporal("<"))
            .rule("BeAfter", verb("isAfter"), ComparisonRules.temporal(">"))
            .rule("BeOnOrBefore", verb("isBeforeOrEqualTo"), ComparisonRules.temporal("<="))
            .rule("BeOnOrAfter", verb("isAfterOrEqualTo"), ComparisonRules.temporal(">="))
            .rule("NotBeBefore", verb("isNotBefore"), ComparisonRules.notTemporal("<"))
            .rule("NotBeAfter", verb("isNotAfter"), ComparisonRules.notTemporal(">"))
            .rule("NotBeOnOrBefore", verb("isNotBeforeOrEqualTo"), ComparisonRules.notTemporal("<="))
            .rule("NotBeOnOrAfter", verb("isNotAfterOrEqualTo"), ComparisonRules.notTemporal(">="))
            .rule("BeCloseTo", verb("isCloseTo"), ComparisonRules::beCloseTo)
            .rule("NotBeCloseTo", verb("isNotCloseTo"), ComparisonRules::notBeCloseTo)
            .rule("BeOneOf", verb("isIn"), CollectionRules::beOneOf)
            .rule("NotBeOneOf", verb("isNotIn"), CollectionRules::notBeOneOf)
            .rule("ContainEquivalentOf", verb("containsIgnoringCase"), TextRules::containEquivalentOf)
            .rule("NotContainEquivalentOf", verb("doesNotContainIgnoringCase"), TextRules::notContainEquivalentOf)
            .build();

    private final List<Entry> entries;

    private RuleCatalog(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static RuleCatalog standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Entry> lookup(AssertionChain chain) {
        for (Entry entry : entries) {
            if (entry.getMatcher().matches(chain)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public static final class Entry {

        private final String name;
        private final VerbMatcher matcher;
        private final RewriteRule rule;

        private Entry(String name, VerbMatcher matcher, RewriteRule rule) {
            this.name = name;
            this.matcher = matcher;
            this.rule = rule;
        }

        public String getName() {
            return name;
        }

        public VerbMatcher getMatcher() {
            return matcher;
        }

        public RewriteRule getRule() {
            return rule;
        }
    }

    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder rule(String name, VerbMatcher matcher, RewriteRule rule) {
            entries.add(new Entry(name, matcher, rule));
            return this;
        }

        public RuleCatalog build() {
            return new RuleCatalog(entries);
        }
    }
}
