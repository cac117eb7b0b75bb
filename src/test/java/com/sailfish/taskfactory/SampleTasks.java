package com.sailfish.taskfactory;

/**
 * Task methods used across the tests. Their source is read back from {@code src/test/java}.
 */
public final class SampleTasks {

    private SampleTasks() {
    }

    public static int add(int x, int y) {
        return x + y;
    }

    public static String join(String separator, String... parts) {
        return String.join(separator, parts);
    }

    public static String braces() {
        // a stray } in a comment
        return "}{";
    }

    public static String echo(String message) {
        return "echo " + message;
    }

    public static String exitWith(int code) {
        return "exit " + code;
    }

    public static Object notACommand() {
        return 42;
    }

    public static String fail(String reason) {
        throw new IllegalStateException(reason);
    }

    public static int compute(int x) {
        return x + 1;
    }

    public static int compute(int x, int y) {
        return x + y + 1;
    }

    public static class Other {

        public static int compute(int x) {
            return x * 1000;
        }
    }

    public static class Nested {

        public String shout(String word) {
            return word.toUpperCase();
        }
    }
}
