package com.notifywheel.exception;

/**
 * 远端请求失败（网络/鉴权/非 2xx/解析）
 */
public class NotificationFetchException extends RuntimeException {

    public NotificationFetchException(String message) {
        super(message);
    }

    public NotificationFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
