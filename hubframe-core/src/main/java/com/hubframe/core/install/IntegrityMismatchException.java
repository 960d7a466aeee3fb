package com.hubframe.core.install;

import com.hubframe.api.exception.HubException;
import lombok.Getter;

/**
 * 下载内容的摘要与声明不一致
 */
@Getter
public class IntegrityMismatchException extends HubException {

    private final String expected;
    private final String actual;

    public IntegrityMismatchException(String source, String expected, String actual) {
        super("SHA-256 mismatch for " + source + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
