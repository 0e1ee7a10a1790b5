package org.statussaver.storage.picker;

import java.nio.file.Path;

/**
 * 目录选择器的返回结果。
 *
 * @param approved          用户是否确认
 * @param selectedDirectory 用户选中的目录（确认但没有选中任何目录时为 null）
 */
public record PickerResult(boolean approved, Path selectedDirectory) {

    public static PickerResult approved(Path selectedDirectory) {
        return new PickerResult(true, selectedDirectory);
    }

    public static PickerResult cancelled() {
        return new PickerResult(false, null);
    }
}
