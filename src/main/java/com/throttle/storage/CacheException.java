package com.throttle.storage;

/**
 * Raised when the backing cache cannot complete a write or delete.
 */
public class CacheException extends RuntimeException {
    
    public CacheException(String message) {
        super(message);
    }
    
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
