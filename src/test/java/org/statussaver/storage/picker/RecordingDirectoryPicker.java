package org.statussaver.storage.picker;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用目录选择器：记录每次弹出请求，由测试代码决定何时、以什么结果回传。
 */
public class RecordingDirectoryPicker implements DirectoryPicker {

    private final List<PickerRequest> requests = new ArrayList<>();
    private PickerResultListener listener;
    private PickerResult immediateAnswer;

    @Override
    public void launch(PickerRequest request, PickerResultListener listener) {
        requests.add(request);
        this.listener = listener;
        if (immediateAnswer != null) {
            listener.onPickerResult(request.requestCode(), immediateAnswer);
        }
    }

    /**
     * 之后每次弹出都立即以给定结果回传（模拟用户马上作出选择）。
     */
    public RecordingDirectoryPicker answerImmediately(PickerResult result) {
        this.immediateAnswer = result;
        return this;
    }

    /**
     * 以最近一次请求的请求码回传结果。
     */
    public void answer(PickerResult result) {
        answer(lastRequest().requestCode(), result);
    }

    public void answer(int requestCode, PickerResult result) {
        if (listener == null) {
            throw new IllegalStateException("选择器尚未弹出");
        }
        listener.onPickerResult(requestCode, result);
    }

    public PickerRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("选择器尚未弹出");
        }
        return requests.get(requests.size() - 1);
    }

    public int launchCount() {
        return requests.size();
    }
}
