package org.assertflat.benchmark;

/**
 * Test classes the benchmarks migrate.
 */
final class BenchmarkSources {

    static final String SMALL_TEST = String.join("\n",
            "package com.example;",
            "",
            "import static org.assertj.core.api.Assertions.assertThat;",
            "",
            "import java.util.List;",
            "import org.junit.jupiter.api.Test;",
            "",
            "class SmallTest {",
            "",
            "    @Test",
            "    void values() {",
            "        int answer = 42;",
            "        List<String> names = List.of(\"a\", \"b\");",
            "        assertThat(answer).isEqualTo(42);",
            "        assertThat(names).hasSize(2);",
            "        assertThat(names).contains(\"a\");",
            "    }",
            "}",
            "");

    static final String LARGE_TEST = largeTest(50);

    private BenchmarkSources() {
    }

    private static String largeTest(int methods) {
        StringBuilder source = new StringBuilder(String.join("\n",
                "package com.example;",
                "",
                "import static org.assertj.core.api.Assertions.assertThat;",
                "import static org.assertj.core.api.Assertions.assertThatThrownBy;",
                "import static org.assertj.core.api.Assertions.within;",
                "",
                "import java.util.ArrayList;",
                "import java.util.List;",
                "import org.junit.jupiter.api.Test;",
                "",
                "class LargeTest {",
                ""));
        for (int i = 0; i < methods; i++) {
            source.append(String.join("\n",
                    "    @Test",
                    "    void case" + i + "() {",
                    "        List<String> items = new ArrayList<>();",
                    "        String text = \"value" + i + "\";",
                    "        double ratio = " + i + " / 10.0;",
                    "        assertThat(items).isEmpty();",
                    "        assertThat(text).startsWith(\"value\");",
                    "        assertThat(text).contains(\"val\", \"ue\");",
                    "        assertThat(ratio).isCloseTo(" + i + " / 10.0, within(0.001));",
                    "        assertThat(ratio).isGreaterThanOrEqualTo(0.0);",
                    "        assertThatThrownBy(() -> items.get(1)).isInstanceOf(IndexOutOfBoundsException.class);",
                    "    }",
                    ""));
        }
        return source.append("}\n").toString();
    }
}
