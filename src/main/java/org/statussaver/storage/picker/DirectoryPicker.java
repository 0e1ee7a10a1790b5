package org.statussaver.storage.picker;

/**
 * 平台目录选择器。
 * <p>
 * {@link #launch} 只负责弹出选择界面并立即返回；用户作出选择后，实现方通过
 * {@link PickerResultListener#onPickerResult} 异步回传结果（带上请求码），没有超时。
 */
public interface DirectoryPicker {

    void launch(PickerRequest request, PickerResultListener listener);
}
