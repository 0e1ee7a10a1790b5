package org.statussaver.storage.dto;

import java.util.List;

/**
 * 目录枚举结果（非递归，只包含普通文件）。
 * <p>
 * 区分“空目录”和“授权失效/IO 失败”；只关心文件列表的调用方直接使用 {@link #entries()}，失败时为空列表。
 *
 * @param status  枚举结果状态
 * @param entries 文件引用（文档 URI 字符串），按显示名排序
 * @param message 失败原因（成功时为 null）
 */
public record DocumentListResult(Status status, List<String> entries, String message) {

    public enum Status {
        OK,
        INVALID_HANDLE,
        ACCESS_DENIED,
        NOT_FOUND,
        NOT_A_DIRECTORY,
        IO_ERROR
    }

    public DocumentListResult {
        entries = (entries == null) ? List.of() : List.copyOf(entries);
    }

    public static DocumentListResult ok(List<String> entries) {
        return new DocumentListResult(Status.OK, entries, null);
    }

    public static DocumentListResult failure(Status status, String message) {
        return new DocumentListResult(status, List.of(), message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
