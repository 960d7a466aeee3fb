package com.hubframe.core.event;

import java.util.Arrays;
import java.util.Objects;

/**
 * 主题模式
 * 以点分段，{@code *} 恰好匹配一个段；段数必须相同。
 */
public final class TopicPattern {

    private static final String WILDCARD = "*";

    private final String pattern;
    private final String[] segments;

    private TopicPattern(String pattern) {
        this.pattern = pattern;
        this.segments = pattern.split("\\.", -1);
    }

    public static TopicPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("Topic pattern must not be blank");
        }
        TopicPattern compiled = new TopicPattern(pattern.trim());
        if (Arrays.stream(compiled.segments).anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Topic pattern has an empty segment: " + pattern);
        }
        return compiled;
    }

    public boolean matches(String topic) {
        if (topic == null) {
            return false;
        }
        String[] parts = topic.split("\\.", -1);
        if (parts.length != segments.length) {
            return false;
        }
        for (int i = 0; i < segments.length; i++) {
            if (!WILDCARD.equals(segments[i]) && !segments[i].equals(parts[i])) {
                return false;
            }
        }
        return true;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
