package org.statussaver.storage;

/**
 * 已有一个目录授权请求在等待用户响应（{@link PendingRequestPolicy#REJECT}）。
 */
public class RequestPendingException extends StorageAccessException {

    public static final String CODE = "ALREADY_ACTIVE";

    public RequestPendingException() {
        super(CODE, "A directory access request is already waiting for the user");
    }
}
