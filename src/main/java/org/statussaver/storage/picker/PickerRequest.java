package org.statussaver.storage.picker;

import java.nio.file.Path;

/**
 * 一次目录选择请求。
 *
 * @param requestCode      请求码，选择结果原样带回
 * @param initialDirectory 初始位置提示（可能为 null；仅为尽力而为，选择器不支持或目录不存在时忽略）
 */
public record PickerRequest(int requestCode, Path initialDirectory) {
}
