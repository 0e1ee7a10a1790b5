package org.statussaver.storage;

/**
 * {@code listFiles} 未传入目录句柄。
 */
public class MissingHandleException extends StorageAccessException {

    public static final String CODE = "INVALID_URI";

    public MissingHandleException() {
        super(CODE, "URI is null");
    }
}
