package com.notifywheel.exception.guard;

public class RemoteRateLimitedException extends RuntimeException {
    public RemoteRateLimitedException(Throwable cause) { super("remote api rate limited", cause); }
}
