package org.statussaver.storage.dto;

/**
 * 持久化的目录树授权（进程重启后依然有效）。
 *
 * @param uri           目录句柄字符串
 * @param read          是否包含读权限
 * @param persistedTime 授权持久化的时间（epoch 毫秒）
 */
public record PersistedGrant(String uri, boolean read, long persistedTime) {
}
