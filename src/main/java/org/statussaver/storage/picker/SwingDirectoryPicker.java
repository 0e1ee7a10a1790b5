package org.statussaver.storage.picker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JFileChooser;
import javax.swing.SwingUtilities;
import java.awt.GraphicsEnvironment;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 桌面环境下的目录选择器：在事件分发线程上弹出只允许选择目录的 {@link JFileChooser}。
 * <p>
 * 说明：
 * <ul>
 *   <li>初始位置提示存在且是目录时才会使用，否则保持选择器默认位置。</li>
 *   <li>没有图形界面（headless）时无法征得用户同意，直接按“用户取消”回传。</li>
 * </ul>
 */
public class SwingDirectoryPicker implements DirectoryPicker {

    private static final Logger log = LoggerFactory.getLogger(SwingDirectoryPicker.class);

    private final String title;

    public SwingDirectoryPicker(String title) {
        this.title = title;
    }

    @Override
    public void launch(PickerRequest request, PickerResultListener listener) {
        if (GraphicsEnvironment.isHeadless()) {
            log.warn("当前环境没有图形界面，目录选择请求按取消处理（requestCode={}）", request.requestCode());
            listener.onPickerResult(request.requestCode(), PickerResult.cancelled());
            return;
        }
        SwingUtilities.invokeLater(() -> deliver(request, listener));
    }

    /**
     * 弹出选择器并回传结果；选择器抛出任何异常都按取消回传，保证等待槽位会被清空。
     */
    void deliver(PickerRequest request, PickerResultListener listener) {
        PickerResult result;
        try {
            result = showChooser(request);
        } catch (RuntimeException e) {
            log.warn("目录选择器异常，按取消处理（requestCode={}）", request.requestCode(), e);
            result = PickerResult.cancelled();
        }
        listener.onPickerResult(request.requestCode(), result);
    }

    PickerResult showChooser(PickerRequest request) {
        JFileChooser chooser = new JFileChooser();
        chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        chooser.setAcceptAllFileFilterUsed(false);
        chooser.setDialogTitle(title);
        Path initial = request.initialDirectory();
        if (initial != null && Files.isDirectory(initial)) {
            chooser.setCurrentDirectory(initial.toFile());
        }
        if (chooser.showOpenDialog(null) != JFileChooser.APPROVE_OPTION) {
            return PickerResult.cancelled();
        }
        File selected = chooser.getSelectedFile();
        return PickerResult.approved(selected == null ? null : selected.toPath());
    }
}
