package com.notifywheel.exception.guard;

public class RemoteBulkheadFullException extends RuntimeException {
    public RemoteBulkheadFullException(Throwable cause) { super("remote api bulkhead full", cause); }
}
