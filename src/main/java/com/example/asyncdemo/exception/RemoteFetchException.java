package com.example.asyncdemo.exception;

/**
 * Thrown when the external todo API cannot produce a {@code RemoteItem}:
 * transport failure, non-2xx status, or a body that does not decode.
 */
public class RemoteFetchException extends RuntimeException {

    private final int itemId;

    public RemoteFetchException(int itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public RemoteFetchException(int itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    public int getItemId() {
        return itemId;
    }
}
