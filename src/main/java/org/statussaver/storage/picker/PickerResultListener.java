package org.statussaver.storage.picker;

@FunctionalInterface
public interface PickerResultListener {

    void onPickerResult(int requestCode, PickerResult result);
}
