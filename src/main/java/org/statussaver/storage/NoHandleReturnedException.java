package org.statussaver.storage;

/**
 * 用户在目录选择器中确认了，但没有得到可以转换为目录句柄的选择结果。
 */
public class NoHandleReturnedException extends StorageAccessException {

    public static final String CODE = "NO_URI";

    public NoHandleReturnedException() {
        super(CODE, "No URI returned");
    }
}
