package com.example.asyncdemo.exception;

/**
 * Raised by the combined handler when either concurrent branch fails.
 * No partial result is ever produced alongside it.
 */
public class UpstreamException extends RuntimeException {

    private final int requestId;

    public UpstreamException(int requestId, Throwable cause) {
        super("Combined lookup failed for id=" + requestId + ": " + cause.getMessage(), cause);
        this.requestId = requestId;
    }

    public int getRequestId() {
        return requestId;
    }
}
