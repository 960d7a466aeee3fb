package com.hubframe.core.dependency;

import java.util.ArrayList;
import java.util.List;

/**
 * 版本约束
 * <p>
 * 逗号分隔的多个条件同时满足，例如 {@code >=1.0.0,<2.0.0}。
 * 支持 {@code >= <= > < == = !=}，不带运算符表示相等；空串或 {@code *} 匹配任意版本。
 * 版本按点分段的数字比较，段内只取前导数字，缺失的段视为 0。
 */
public final class VersionSpec {

    private static final VersionSpec ANY = new VersionSpec("*", List.of());

    private static final String[] OPERATORS = {">=", "<=", "==", "!=", ">", "<", "="};

    private final String text;
    private final List<Clause> clauses;

    private VersionSpec(String text, List<Clause> clauses) {
        this.text = text;
        this.clauses = clauses;
    }

    /**
     * @throws IllegalArgumentException 无法解析的约束
     */
    public static VersionSpec parse(String spec) {
        if (spec == null || spec.isBlank() || spec.trim().equals("*")) {
            return ANY;
        }
        List<Clause> clauses = new ArrayList<>();
        for (String part : spec.split(",")) {
            String clause = part.trim();
            if (clause.isEmpty()) {
                throw new IllegalArgumentException("Empty clause in version spec '" + spec + "'");
            }
            String operator = "=";
            for (String candidate : OPERATORS) {
                if (clause.startsWith(candidate)) {
                    operator = candidate;
                    clause = clause.substring(candidate.length()).trim();
                    break;
                }
            }
            int[] version = segments(clause);
            if (version.length == 0) {
                throw new IllegalArgumentException("Invalid version '" + clause + "' in spec '" + spec + "'");
            }
            clauses.add(new Clause(operator, version));
        }
        return new VersionSpec(spec.trim(), List.copyOf(clauses));
    }

    public boolean isAny() {
        return clauses.isEmpty();
    }

    /**
     * 版本为空时只有任意约束匹配
     */
    public boolean matches(String version) {
        if (isAny()) {
            return true;
        }
        if (version == null) {
            return false;
        }
        int[] actual = segments(version);
        for (Clause clause : clauses) {
            if (!clause.accepts(compare(actual, clause.version))) {
                return false;
            }
        }
        return true;
    }

    public static int compare(String v1, String v2) {
        return compare(segments(v1), segments(v2));
    }

    private static int compare(int[] a, int[] b) {
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            int x = i < a.length ? a[i] : 0;
            int y = i < b.length ? b[i] : 0;
            if (x != y) {
                return Integer.compare(x, y);
            }
        }
        return 0;
    }

    private static int[] segments(String version) {
        if (version == null || version.isBlank()) {
            return new int[0];
        }
        String[] parts = version.trim().split("\\.");
        List<Integer> numbers = new ArrayList<>();
        for (String part : parts) {
            int end = 0;
            while (end < part.length() && Character.isDigit(part.charAt(end))) {
                end++;
            }
            if (end == 0) {
                break;
            }
            numbers.add(Integer.parseInt(part.substring(0, end)));
            if (end < part.length()) {
                // 1.2.0-beta 之类，后缀之后的段不再比较
                break;
            }
        }
        return numbers.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return text;
    }

    private record Clause(String operator, int[] version) {

        boolean accepts(int comparison) {
            return switch (operator) {
                case ">=" -> comparison >= 0;
                case "<=" -> comparison <= 0;
                case ">" -> comparison > 0;
                case "<" -> comparison < 0;
                case "!=" -> comparison != 0;
                default -> comparison == 0;
            };
        }
    }
}
