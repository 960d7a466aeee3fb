package com.hubframe.core.dependency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VersionSpec 单元测试")
public class VersionSpecTest {

    @ParameterizedTest(name = "{1} 匹配 {0} = {2}")
    @CsvSource(delimiter = '|', value = {
            ">=1.0.0,<2.0.0 | 1.4.2      | true",
            ">=1.0.0,<2.0.0 | 2.0.0      | false",
            ">=1.0.0,<2.0.0 | 0.9        | false",
            "1.2            | 1.2.0      | true",
            "==1.2.0        | 1.2.1      | false",
            "!=1.2.0        | 1.2.1      | true",
            ">1.2           | 1.10.0     | true",
            "<=1.2.0        | 1.2.0-beta | true"
    })
    void matches(String spec, String version, boolean expected) {
        assertEquals(expected, VersionSpec.parse(spec).matches(version));
    }

    @Test
    @DisplayName("空约束和 * 匹配任意版本，包括缺失的版本")
    void anyMatchesEverything() {
        assertTrue(VersionSpec.parse(null).matches(null));
        assertTrue(VersionSpec.parse(" * ").matches("0.0.1"));
        assertFalse(VersionSpec.parse(">=1.0").matches(null));
    }

    @Test
    @DisplayName("按数字而非字典序比较")
    void comparesNumerically() {
        assertTrue(VersionSpec.compare("1.10.0", "1.9.9") > 0);
        assertEquals(0, VersionSpec.compare("2", "2.0.0"));
    }

    @Test
    @DisplayName("无法解析的约束被拒绝")
    void invalidSpecIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> VersionSpec.parse(">=abc"));
        assertThrows(IllegalArgumentException.class, () -> VersionSpec.parse(">=1.0,,<2.0"));
    }
}
