package com.hubframe.api.exception;

/**
 * 权限拒绝异常
 * 当沙箱中的插件尝试越权操作（超出订阅上限、向未授权主题发事件、访问令牌服务等）时抛出。
 *
 * @author HubFrame
 */
public class PermissionDeniedException extends HubException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
