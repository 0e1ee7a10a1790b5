package org.statussaver.storage;

/**
 * 授权请求尚未完成时，再次发起 {@code openDocumentTree} 的处理策略。
 */
public enum PendingRequestPolicy {

    /**
     * 直接拒绝新的请求（{@link RequestPendingException}），先发起的调用方不受影响。
     */
    REJECT,

    /**
     * 新请求覆盖等待槽位：先发起的调用方永远收不到结果。
     * <p>
     * 仅为兼容旧行为保留。
     */
    REPLACE
}
