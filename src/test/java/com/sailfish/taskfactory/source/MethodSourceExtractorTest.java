package com.sailfish.taskfactory.source;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class MethodSourceExtractorTest {

    private static final List<String> JOBS = Collections.singletonList("Jobs");
    private static final List<String> INT = Collections.singletonList("int");

    private static final String UNIT = String.join("\n",
            "package demo;",
            "",
            "public class Jobs {",
            "    /* run() { not this one } */",
            "    static String label = \"run() {\";",
            "",
            "    public static int total(int a) {",
            "        if (run(a)) {",
            "            return a;",
            "        }",
            "        return 0;",
            "    }",
            "",
            "    static boolean run(int a) throws java.io.IOException {",
            "        String s = \"}\"; // }",
            "        char c = '{';",
            "        return a > 0;",
            "    }",
            "",
            "    static int scale(int x) {",
            "        return x + 1;",
            "    }",
            "",
            "    static int scale(long x) {",
            "        return (int) x + 2;",
            "    }",
            "",
            "    static int scale(int x, int y) {",
            "        return x * y;",
            "    }",
            "",
            "    abstract void pending();",
            "",
            "    static class Worker {",
            "        static int scale(int x) {",
            "            return x * 1000;",
            "        }",
            "",
            "        interface Step {",
            "            default int scale(int x) {",
            "                return -x;",
            "            }",
            "        }",
            "    }",
            "}");

    @Test
    void extractsFromDeclarationLineToClosingBrace() {
        Optional<String> source = MethodSourceExtractor.extract(UNIT, JOBS, "run", INT);

        assertThat(source).hasValue(String.join("\n",
                "    static boolean run(int a) throws java.io.IOException {",
                "        String s = \"}\"; // }",
                "        char c = '{';",
                "        return a > 0;",
                "    }"));
    }

    @Test
    void skipsCallSitesAndBracesInLiterals() {
        Optional<String> source = MethodSourceExtractor.extract(UNIT, JOBS, "total", INT);

        assertThat(source).isPresent();
        assertThat(source.get()).startsWith("    public static int total(int a) {").endsWith("return 0;\n    }");
    }

    @Test
    void picksTheOverloadMatchingTheParameterList() {
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "scale", INT))
                .hasValueSatisfying(s -> assertThat(s).contains("return x + 1;"));
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "scale", Collections.singletonList("long")))
                .hasValueSatisfying(s -> assertThat(s).contains("return (int) x + 2;"));
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "scale", Arrays.asList("int", "int")))
                .hasValueSatisfying(s -> assertThat(s).contains("return x * y;"));
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "scale", Collections.singletonList("String"))).isEmpty();
    }

    @Test
    void confinesTheSearchToTheDeclaringClass() {
        assertThat(MethodSourceExtractor.extract(UNIT, Arrays.asList("Jobs", "Worker"), "scale", INT))
                .hasValue("        static int scale(int x) {\n            return x * 1000;\n        }");
        assertThat(MethodSourceExtractor.extract(UNIT, Arrays.asList("Jobs", "Worker", "Step"), "scale", INT))
                .hasValueSatisfying(s -> assertThat(s).contains("return -x;"));
        assertThat(MethodSourceExtractor.extract(UNIT, Arrays.asList("Jobs", "Worker"), "total", INT)).isEmpty();
        assertThat(MethodSourceExtractor.extract(UNIT, Arrays.asList("Jobs", "Missing"), "scale", INT)).isEmpty();
    }

    @Test
    void returnsEmptyForBodilessOrMissingMethods() {
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "pending", Collections.emptyList())).isEmpty();
        assertThat(MethodSourceExtractor.extract(UNIT, JOBS, "absent", Collections.emptyList())).isEmpty();
        assertThat(MethodSourceExtractor.extract(null, JOBS, "run", INT)).isEmpty();
    }

    @Test
    void declaredTypesAreErasedSimpleNames() {
        assertThat(MethodSourceExtractor.declaredTypes("final java.util.Map.Entry<K, List<V>> e, @Deprecated int... xs"))
                .containsExactly("Entry", "int[]");
        assertThat(MethodSourceExtractor.declaredTypes("String[] parts, long matrix[][]"))
                .containsExactly("String[]", "long[][]");
        assertThat(MethodSourceExtractor.declaredTypes("  ")).isEmpty();
    }

    @Test
    void maskKeepsOffsetsAndLineBreaks() {
        String text = "a /* x\ny */ \"s\" b";

        String masked = MethodSourceExtractor.mask(text);

        assertThat(masked).hasSameSizeAs(text);
        assertThat(masked).isEqualTo("a     \n" + " ".repeat(9) + "b");
    }
}
