package com.protorpc.generator.codegen.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.protorpc.generator.codegen.GenerationException;

/**
 * Maps schema identifiers and dotted paths onto generated Java names.
 */
public class NamingUtil {

    public static final char NAMESPACE_SEPARATOR = '.';

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "_");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts GetUnary, getUnary or get-unary to snake_case.
     * Used for method identifiers and output module names.
     */
    public static String identifierCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return splitWords(name).stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }

    /**
     * Converts get_request or HTTPRequest to UpperCamelCase.
     */
    public static String typeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return splitWords(name).stream()
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts a name to SCREAMING_SNAKE_CASE for constants.
     */
    public static String toScreamingSnakeCase(String name) {
        String snake = identifierCase(name);
        return snake == null ? null : snake.toUpperCase(Locale.ROOT);
    }

    /**
     * Appends an underscore to identifiers that are reserved in Java.
     */
    public static String escapeKeyword(String identifier) {
        return JAVA_KEYWORDS.contains(identifier) ? identifier + "_" : identifier;
    }

    /**
     * Returns the last segment of a dotted package path.
     *
     * ".package_1.package_2.package_3" -> "package_3". Intermediate levels are dropped,
     * so two packages ending in the same segment resolve to the same namespace.
     */
    public static String namespaceOf(String path) {
        if (path == null) {
            return "";
        }
        int lastDot = path.lastIndexOf(NAMESPACE_SEPARATOR);
        return lastDot < 0 ? path : path.substring(lastDot + 1);
    }

    /**
     * Builds a fully qualified type reference from a dotted schema type path.
     *
     * ".package.Message" and "package.Message" both become {@code protoRoot + ".package.Message"}.
     * Namespace segments are copied verbatim, only the type name is case-converted.
     * A leading empty segment marks the schema root and is skipped. An empty
     * {@code protoRoot} yields a reference without a leading separator.
     *
     * @throws GenerationException if the path is empty or ends with a separator
     */
    public static String qualifyType(String path, String protoRoot) {
        if (path == null || path.isBlank()) {
            throw new GenerationException("Type path must not be empty");
        }
        String[] parts = path.split("\\.", -1);
        String typeName = parts[parts.length - 1];
        if (typeName.isEmpty()) {
            throw new GenerationException("Type path has no type name: '" + path + "'");
        }

        StringBuilder sb = new StringBuilder(protoRoot == null ? "" : protoRoot);
        int first = parts[0].isEmpty() ? 1 : 0;
        for (int i = first; i < parts.length - 1; i++) {
            appendSegment(sb, parts[i]);
        }
        appendSegment(sb, typeCase(typeName));
        return sb.toString();
    }

    private static void appendSegment(StringBuilder sb, String segment) {
        if (sb.length() > 0) {
            sb.append(NAMESPACE_SEPARATOR);
        }
        sb.append(segment);
    }

    /**
     * Splits an identifier into words at separators, lower-to-upper transitions and the
     * end of an acronym ("HTTPRequest" -> HTTP, Request).
     */
    static List<String> splitWords(String name) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = name.length();

        for (int i = 0; i < length; i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(words, current);
                continue;
            }
            if (Character.isUpperCase(c) && current.length() > 0) {
                char prev = current.charAt(current.length() - 1);
                boolean nextIsLower = i + 1 < length && Character.isLowerCase(name.charAt(i + 1));
                if (!Character.isUpperCase(prev) || nextIsLower) {
                    flush(words, current);
                }
            }
            current.append(c);
        }
        flush(words, current);
        return words;
    }

    private static void flush(List<String> words, StringBuilder current) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
