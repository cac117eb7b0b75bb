package com.sailfish.taskfactory.source;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts the declaration of a method out of a Java compilation unit.
 * <p>
 * The scan works on a masked copy of the text in which comments, string, char and text-block
 * literals are blanked out, so braces and names inside them are ignored. The search is confined
 * to the direct members of the declaring class, located through its nesting path of simple names.
 * Overloads are told apart by parameter count, then by the erased simple names of the parameter
 * types. The extracted text runs from the start of the declaring line to the matching closing
 * brace of the body.
 */
public final class MethodSourceExtractor {

    private static final Pattern THROWS_CLAUSE = Pattern.compile("\\s*(throws\\s+[\\w.$<>,\\s]+)?\\s*");
    private static final Pattern ANNOTATION = Pattern.compile("@[\\w.$]+(\\s*\\([^)]*\\))?");
    private static final Pattern TYPE_ARGUMENTS = Pattern.compile("<[^<>]*>");

    private MethodSourceExtractor() {
    }

    /**
     * Extracts the source of a reflected method. Methods of anonymous and local classes have none.
     */
    public static Optional<String> extract(String compilationUnit, Method method) {
        List<String> nesting = new ArrayList<>();
        for (Class<?> type = method.getDeclaringClass(); type != null; type = type.getEnclosingClass()) {
            if (type.isAnonymousClass() || type.isLocalClass()) {
                return Optional.empty();
            }
            nesting.add(type.getSimpleName());
        }
        Collections.reverse(nesting);
        List<String> parameterTypes = new ArrayList<>();
        for (Class<?> parameterType : method.getParameterTypes()) {
            parameterTypes.add(parameterType.getSimpleName());
        }
        return extract(compilationUnit, nesting, method.getName(), parameterTypes);
    }

    /**
     * @param compilationUnit Text of a {@code .java} file.
     * @param classNesting Simple names from the top-level class down to the declaring class.
     * @param methodName Name of the method.
     * @param parameterTypes Erased simple names of the parameter types, e.g. {@code String[]}.
     * @return the declaration text, or empty if the class or a matching method with a body is not found.
     */
    public static Optional<String> extract(String compilationUnit,
                                           List<String> classNesting,
                                           String methodName,
                                           List<String> parameterTypes) {
        if (compilationUnit == null || methodName == null || methodName.isEmpty()
                || classNesting == null || classNesting.isEmpty()) {
            return Optional.empty();
        }
        String masked = mask(compilationUnit);
        int from = 0;
        int to = masked.length();
        for (String simpleName : classNesting) {
            int open = findClassBody(masked, from, to, simpleName);
            if (open < 0) {
                return Optional.empty();
            }
            int close = matching(masked, open, '{', '}');
            if (close < 0) {
                return Optional.empty();
            }
            from = open + 1;
            to = close;
        }

        List<int[]> candidates = new ArrayList<>();
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(methodName) + "\\s*\\(").matcher(masked);
        matcher.region(from, to);
        while (matcher.find()) {
            if (depth(masked, from, matcher.start()) != 0 || !precededByType(masked, matcher.start())) {
                continue;
            }
            int open = matcher.end() - 1;
            int close = matching(masked, open, '(', ')');
            if (close < 0 || close >= to) {
                return Optional.empty();
            }
            int body = masked.indexOf('{', close);
            if (body < 0 || body >= to) {
                continue;
            }
            if (!THROWS_CLAUSE.matcher(masked.substring(close + 1, body)).matches()) {
                continue;
            }
            int end = matching(masked, body, '{', '}');
            if (end < 0) {
                return Optional.empty();
            }
            candidates.add(new int[]{matcher.start(), open, close, end});
        }

        List<int[]> sameArity = new ArrayList<>();
        for (int[] candidate : candidates) {
            if (declaredTypes(masked.substring(candidate[1] + 1, candidate[2])).size() == parameterTypes.size()) {
                sameArity.add(candidate);
            }
        }
        int[] chosen = null;
        if (sameArity.size() == 1) {
            chosen = sameArity.get(0);
        } else {
            for (int[] candidate : sameArity) {
                if (declaredTypes(masked.substring(candidate[1] + 1, candidate[2])).equals(parameterTypes)) {
                    chosen = candidate;
                    break;
                }
            }
        }
        if (chosen == null) {
            return Optional.empty();
        }
        int lineStart = masked.lastIndexOf('\n', chosen[0]) + 1;
        return Optional.of(compilationUnit.substring(lineStart, chosen[3] + 1));
    }

    /**
     * Index of the opening brace of a type declared directly in the given range, or -1.
     */
    private static int findClassBody(String masked, int from, int to, String simpleName) {
        Matcher matcher = Pattern.compile("\\b(class|interface|enum|record)\\s+" + Pattern.quote(simpleName) + "\\b")
                .matcher(masked);
        matcher.region(from, to);
        while (matcher.find()) {
            if (depth(masked, from, matcher.start()) != 0) {
                continue;
            }
            int open = masked.indexOf('{', matcher.end());
            return open < to ? open : -1;
        }
        return -1;
    }

    /**
     * Brace depth at {@code position}, counted from {@code from}.
     */
    private static int depth(String masked, int from, int position) {
        int depth = 0;
        for (int i = from; i < position; i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth;
    }

    /**
     * Erased simple type names of a parameter list, e.g. {@code (final Map.Entry<K, V> e, int... xs)}
     * gives {@code [Entry, int[]]}.
     */
    static List<String> declaredTypes(String parameterList) {
        List<String> types = new ArrayList<>();
        for (String parameter : splitTopLevel(parameterList)) {
            String text = ANNOTATION.matcher(parameter).replaceAll(" ");
            String previous;
            do {
                previous = text;
                text = TYPE_ARGUMENTS.matcher(text).replaceAll("");
            } while (!text.equals(previous));
            text = text.replaceAll("\\bfinal\\b", " ").replace("...", "[]").trim();

            String dims = "";
            while (text.endsWith("[]")) {
                dims += "[]";
                text = text.substring(0, text.length() - 2).trim();
            }
            int nameStart = text.length();
            while (nameStart > 0 && Character.isJavaIdentifierPart(text.charAt(nameStart - 1))) {
                nameStart--;
            }
            String type = text.substring(0, nameStart).replaceAll("\\s+", "");
            int arrays = type.indexOf('[');
            String base = arrays < 0 ? type : type.substring(0, arrays);
            String suffix = arrays < 0 ? "" : type.substring(arrays);
            types.add(base.substring(base.lastIndexOf('.') + 1) + suffix + dims);
        }
        return types;
    }

    private static List<String> splitTopLevel(String parameterList) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < parameterList.length(); i++) {
            char c = parameterList.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(parameterList.substring(start, i));
                start = i + 1;
            }
        }
        String last = parameterList.substring(start);
        if (!parts.isEmpty() || !last.trim().isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    /**
     * A declaration has a return type (or a generic/array suffix) right before its name.
     */
    private static boolean precededByType(String masked, int nameStart) {
        int i = nameStart - 1;
        while (i >= 0 && Character.isWhitespace(masked.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        char c = masked.charAt(i);
        if (c == '>' || c == ']') {
            return true;
        }
        if (!Character.isJavaIdentifierPart(c)) {
            return false;
        }
        int wordEnd = i + 1;
        while (i >= 0 && Character.isJavaIdentifierPart(masked.charAt(i))) {
            i--;
        }
        String word = masked.substring(i + 1, wordEnd);
        return !word.equals("new") && !word.equals("return") && !word.equals("throw") && !word.equals("else");
    }

    private static int matching(String masked, int openIndex, char open, char close) {
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Replaces comments and literals with spaces, keeping line breaks and offsets intact.
     */
    static String mask(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int n = source.length();
        int i = 0;
        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                blank(source, i, stop, out);
                i = stop;
            } else if (source.startsWith("\"\"\"", i)) {
                int end = source.indexOf("\"\"\"", i + 3);
                int stop = end < 0 ? n : end + 3;
                blank(source, i, stop, out);
                i = stop;
            } else if (c == '"' || c == '\'') {
                int j = i + 1;
                while (j < n && source.charAt(j) != c && source.charAt(j) != '\n') {
                    j += source.charAt(j) == '\\' ? 2 : 1;
                }
                int stop = Math.min(n, j + 1);
                blank(source, i, stop, out);
                i = stop;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static void blank(String source, int from, int to, StringBuilder out) {
        for (int k = from; k < to; k++) {
            out.append(source.charAt(k) == '\n' ? '\n' : ' ');
        }
    }
}
