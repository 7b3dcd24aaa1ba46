package org.assertflat.rules;

import org.assertflat.migration.DocumentResult;
import org.junit.jupiter.api.Test;

import static org.assertflat.test.SourceFixtures.assertRewritten;
import static org.assertflat.test.SourceFixtures.assertUnchanged;
import static org.assertflat.test.SourceFixtures.migrate;
import static org.assertflat.test.SourceFixtures.migrateWithoutTypes;
import static org.assertj.core.api.Assertions.assertThat;

class EqualityRulesTest {

    @Test
    void isEqualTo_becomesAssertEqualsWithExpectedFirst() {
        assertRewritten(migrate("int answer = 42;\n"
                        + "assertThat(answer).isEqualTo(42);"),
                "assertEquals(42, answer);");
    }

    @Test
    void isEqualTo_onArrayComparesElements() {
        assertRewritten(migrate("int[] values = {1, 2};\n"
                        + "assertThat(values).isEqualTo(new int[] {1, 2});"),
                "assertArrayEquals(new int[] {1, 2}, values);");
    }

    @Test
    void isEqualTo_withoutTypesKeepsAssertEquals() {
        assertRewritten(migrateWithoutTypes("int[] values = {1, 2};\n"
                        + "assertThat(values).isEqualTo(new int[] {1, 2});"),
                "assertEquals(new int[] {1, 2}, values);");
    }

    @Test
    void sizeEqualToOne_isSingletonCount() {
        assertRewritten(migrate("List<String> names = List.of(\"a\");\n"
                        + "assertThat(names.size()).isEqualTo(1);"),
                "assertEquals(1, names.size());");
    }

    @Test
    void arrayLengthEqualToOne_isSingletonCount() {
        assertRewritten(migrate("String[] names = {\"a\"};\n"
                        + "assertThat(names.length).isEqualTo(1);"),
                "assertEquals(1, names.length);");
    }

    @Test
    void isNotEqualTo_becomesAssertNotEquals() {
        assertRewritten(migrate("int answer = 42;\n"
                        + "assertThat(answer).isNotEqualTo(7);"),
                "assertNotEquals(7, answer);");
    }

    @Test
    void isNotEqualTo_onArrayNegatesArraysEquals() {
        DocumentResult result = migrate("int[] values = {1, 2};\n"
                + "assertThat(values).isNotEqualTo(new int[] {2, 1});");

        assertRewritten(result, "assertFalse(Arrays.equals(new int[] {2, 1}, values));");
        assertThat(result.getMigrated()).contains("import java.util.Arrays;");
    }

    @Test
    void identity_becomesAssertSameAndAssertNotSame() {
        assertRewritten(migrate("Object first = new Object();\n"
                        + "Object second = first;\n"
                        + "assertThat(second).isSameAs(first);"),
                "assertSame(first, second);");
        assertRewritten(migrate("Object first = new Object();\n"
                        + "Object second = new Object();\n"
                        + "assertThat(second).isNotSameAs(first);"),
                "assertNotSame(first, second);");
    }

    @Test
    void booleans_becomeAssertTrueAndAssertFalse() {
        assertRewritten(migrate("boolean ready = true;\n"
                        + "assertThat(ready).isTrue();"),
                "assertTrue(ready);");
        assertRewritten(migrate("boolean ready = false;\n"
                        + "assertThat(ready).isFalse();"),
                "assertFalse(ready);");
    }

    @Test
    void nullChecks_becomeAssertNullAndAssertNotNull() {
        assertRewritten(migrate("String missing = null;\n"
                        + "assertThat(missing).isNull();"),
                "assertNull(missing);");
        assertRewritten(migrate("String present = \"x\";\n"
                        + "assertThat(present).isNotNull();"),
                "assertNotNull(present);");
    }

    @Test
    void sign_comparesWithZero() {
        assertRewritten(migrate("int count = 3;\n"
                        + "assertThat(count).isPositive();"),
                "assertTrue(count > 0);");
        assertRewritten(migrate("long balance = -3L;\n"
                        + "assertThat(balance).isNegative();"),
                "assertTrue(balance < 0);");
    }

    @Test
    void sign_onNonNumericSubjectIsLeftUnchanged() {
        assertUnchanged(migrate("java.math.BigDecimal amount = java.math.BigDecimal.ONE;\n"
                + "assertThat(amount).isPositive();"));
    }

    @Test
    void isEqualTo_withExtraArgumentsIsLeftUnchanged() {
        assertUnchanged(migrate("int answer = 42;\n"
                + "assertThat(answer).isEqualTo(42, 43);"));
    }
}
