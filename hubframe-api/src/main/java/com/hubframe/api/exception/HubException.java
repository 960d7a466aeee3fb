package com.hubframe.api.exception;

/**
 * HubFrame 基础异常
 *
 * @author HubFrame
 */
public class HubException extends RuntimeException {

    public HubException(String message) {
        super(message);
    }

    public HubException(String message, Throwable cause) {
        super(message, cause);
    }
}
