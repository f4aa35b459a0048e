package org.smileyface.linkarchive.error;

/**
 * The archive or the failure ledger could not be read or written. Signals an environment
 * problem (disk, permissions, unreachable Redis) rather than a problem with one URL, so it
 * aborts the run instead of being recorded per URL.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
