package com.hubframe.core.device;

import com.hubframe.api.device.Device;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 设备选择器
 * <p>
 * 语法 {@code key=value[,key=value]*}，所有条件同时满足才匹配；值可含 {@code *} 通配。
 * 单独的 {@code *} 匹配所有设备。键 {@code id} 匹配设备ID，其余键匹配设备属性。
 */
public final class DeviceSelector {

    public static final String MATCH_ALL = "*";

    private final String expression;
    private final List<Criterion> criteria;

    private DeviceSelector(String expression, List<Criterion> criteria) {
        this.expression = expression;
        this.criteria = criteria;
    }

    public static DeviceSelector parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Device selector must not be blank");
        }
        String trimmed = expression.trim();
        if (MATCH_ALL.equals(trimmed)) {
            return new DeviceSelector(trimmed, Collections.emptyList());
        }
        List<Criterion> criteria = new ArrayList<>();
        for (String part : trimmed.split(",")) {
            int eq = part.indexOf('=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new IllegalArgumentException("Malformed selector term '" + part + "' in: " + expression);
            }
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                throw new IllegalArgumentException("Malformed selector term '" + part + "' in: " + expression);
            }
            criteria.add(new Criterion(key, globToRegex(value)));
        }
        return new DeviceSelector(trimmed, List.copyOf(criteria));
    }

    public boolean matches(Device device) {
        if (device == null) {
            return false;
        }
        for (Criterion criterion : criteria) {
            String actual = "id".equals(criterion.key())
                    ? device.getId()
                    : device.getAttributes().get(criterion.key());
            if (actual == null || !criterion.value().matcher(actual).matches()) {
                return false;
            }
        }
        return true;
    }

    public boolean matchesAll() {
        return criteria.isEmpty();
    }

    public String expression() {
        return expression;
    }

    /**
     * 条件（按键的只读视图，便于调试）
     */
    public Map<String, String> terms() {
        Map<String, String> terms = new LinkedHashMap<>();
        criteria.forEach(c -> terms.put(c.key(), c.value().pattern()));
        return terms;
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(glob.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return expression;
    }

    private record Criterion(String key, Pattern value) {
    }
}
