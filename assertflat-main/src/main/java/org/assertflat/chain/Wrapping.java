package org.assertflat.chain;

/**
 * How the assertion chain is embedded between its entry call and its verb.
 */
public enum Wrapping {

    /** {@code assertThat(x).verb(...)} */
    NONE,

    /** {@code assertThat(x).extracting(fn).verb(...)}: the subject is navigated from a non-null root. */
    NULL_CONDITIONAL,

    /** {@code assertThat(future).succeedsWithin(t).verb(...)}: the subject is awaited first. */
    AWAITED
}
