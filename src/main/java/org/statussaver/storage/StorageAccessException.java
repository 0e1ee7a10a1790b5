package org.statussaver.storage;

/**
 * 受限存储访问失败的基类，携带跨边界调用时返回给调用方的错误码。
 */
public class StorageAccessException extends RuntimeException {

    private final String code;

    public StorageAccessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
