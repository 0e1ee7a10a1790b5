package org.statussaver.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.statussaver.storage.dto.DocumentListResult;
import org.statussaver.storage.dto.DocumentTreeHandle;
import org.statussaver.storage.dto.PersistedGrant;
import org.statussaver.storage.picker.DirectoryPicker;
import org.statussaver.storage.picker.PickerRequest;
import org.statussaver.storage.picker.PickerResult;
import org.statussaver.storage.picker.PickerResultListener;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 受限存储访问代理。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>{@link #openDocumentTree()}：弹出目录选择器，请求用户授权一个目录，返回持久化授权后的目录句柄。</li>
 *   <li>{@link #listFiles(String)}：列出已授权目录下的普通文件（非递归），返回文件引用而不是本地路径。</li>
 * </ul>
 * <p>
 * 同一时间只有一个等待用户响应的授权请求（等待槽位）；选择器回传结果时无论成功与否都会清空槽位。
 */
public class StorageAccessBroker implements PickerResultListener {

    private static final Logger log = LoggerFactory.getLogger(StorageAccessBroker.class);

    public static final int REQUEST_CODE_OPEN_DOCUMENT_TREE = 42;

    private final StorageAccessProperties properties;
    private final DocumentPathResolver pathResolver;
    private final PersistedGrantStore grantStore;
    private final DirectoryPicker picker;

    private final AtomicReference<CompletableFuture<String>> pendingRequest = new AtomicReference<>();

    public StorageAccessBroker(StorageAccessProperties properties, DocumentPathResolver pathResolver, PersistedGrantStore grantStore, DirectoryPicker picker) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.grantStore = grantStore;
        this.picker = picker;
    }

    /**
     * 请求用户授权一个目录。
     * <p>
     * 返回的 future 在用户作出选择后完成，没有超时：
     * <ul>
     *   <li>确认：持久化读授权后以目录句柄字符串完成。</li>
     *   <li>确认但选择结果无法转换为句柄：以 {@link NoHandleReturnedException} 异常完成。</li>
     *   <li>取消/拒绝：以 {@code null} 正常完成。</li>
     *   <li>已有请求在等待且策略为 {@link PendingRequestPolicy#REJECT}：立即以 {@link RequestPendingException} 异常完成。</li>
     * </ul>
     */
    public CompletableFuture<String> openDocumentTree() {
        CompletableFuture<String> request = new CompletableFuture<>();
        if (properties.getPendingRequestPolicy() == PendingRequestPolicy.REPLACE) {
            CompletableFuture<String> dropped = pendingRequest.getAndSet(request);
            if (dropped != null) {
                log.warn("上一个目录授权请求尚未完成，已被新的请求覆盖，其调用方将收不到结果");
            }
        } else if (!pendingRequest.compareAndSet(null, request)) {
            log.info("已有目录授权请求在等待用户响应，拒绝新的请求");
            return CompletableFuture.failedFuture(new RequestPendingException());
        }

        PickerRequest pickerRequest = new PickerRequest(REQUEST_CODE_OPEN_DOCUMENT_TREE, initialDirectory());
        log.debug("弹出目录选择器（initialDirectory={}）", pickerRequest.initialDirectory());
        try {
            picker.launch(pickerRequest, this);
        } catch (RuntimeException e) {
            pendingRequest.compareAndSet(request, null);
            log.error("目录选择器启动失败", e);
            request.completeExceptionally(e);
        }
        return request;
    }

    /**
     * 目录选择器的回调。请求码不匹配的结果直接忽略。
     */
    @Override
    public void onPickerResult(int requestCode, PickerResult result) {
        if (requestCode != REQUEST_CODE_OPEN_DOCUMENT_TREE) {
            log.debug("忽略未知请求码的选择结果：{}", requestCode);
            return;
        }
        CompletableFuture<String> request = pendingRequest.getAndSet(null);
        if (request == null) {
            log.warn("收到目录选择结果，但没有等待中的授权请求");
        }

        if (result == null || !result.approved()) {
            log.info("用户取消了目录授权");
            complete(request, null);
            return;
        }

        Optional<String> documentId = toTreeDocumentId(result.selectedDirectory());
        if (documentId.isEmpty()) {
            log.warn("用户已确认，但选择结果无法转换为目录句柄：{}", result.selectedDirectory());
            fail(request, new NoHandleReturnedException());
            return;
        }

        DocumentTreeHandle handle = DocumentTreeHandle.ofTree(properties.getAuthority(), documentId.get());
        try {
            grantStore.takePersistableReadPermission(handle);
        } catch (IllegalStateException e) {
            log.error("目录授权持久化失败：{}", handle, e);
            fail(request, e);
            return;
        }
        complete(request, handle.toUriString());
    }

    /**
     * 列出目录句柄下的普通文件引用（非递归，不含子目录）。
     * <p>
     * 句柄非法、未授权、目录不存在或读取失败时返回空列表（只记录日志），需要区分原因请使用 {@link #enumerate(String)}。
     *
     * @throws MissingHandleException 未传入句柄
     */
    public List<String> listFiles(String uri) {
        return enumerate(uri).entries();
    }

    /**
     * 枚举目录句柄下的普通文件，失败原因通过 {@link DocumentListResult.Status} 区分。
     *
     * @throws MissingHandleException 未传入句柄
     */
    public DocumentListResult enumerate(String uri) {
        if (uri == null) {
            throw new MissingHandleException();
        }
        DocumentListResult result;
        try {
            result = doEnumerate(uri);
        } catch (RuntimeException e) {
            result = DocumentListResult.failure(DocumentListResult.Status.IO_ERROR, String.valueOf(e.getMessage()));
        }
        if (result.isOk()) {
            log.debug("目录 {} 下共有 {} 个文件", uri, result.entries().size());
        } else {
            log.warn("列出目录文件失败，按空列表返回：{}（{}：{}）", uri, result.status(), result.message());
        }
        return result;
    }

    public List<PersistedGrant> listPersistedGrants() {
        return grantStore.list();
    }

    /**
     * 是否有授权请求在等待用户响应。
     */
    public boolean hasPendingRequest() {
        return pendingRequest.get() != null;
    }

    private DocumentListResult doEnumerate(String uri) {
        DocumentTreeHandle handle;
        try {
            handle = DocumentTreeHandle.parse(uri);
        } catch (IllegalArgumentException e) {
            return DocumentListResult.failure(DocumentListResult.Status.INVALID_HANDLE, e.getMessage());
        }
        if (!properties.getAuthority().equals(handle.authority())) {
            return DocumentListResult.failure(DocumentListResult.Status.INVALID_HANDLE, "未知的 authority：" + handle.authority());
        }
        if (!grantStore.hasReadGrant(handle)) {
            return DocumentListResult.failure(DocumentListResult.Status.ACCESS_DENIED, "目录树没有有效的读授权");
        }

        String parentId = handle.targetDocumentId();
        Path dir;
        try {
            dir = pathResolver.resolve(parentId);
        } catch (IllegalArgumentException e) {
            return DocumentListResult.failure(DocumentListResult.Status.INVALID_HANDLE, e.getMessage());
        } catch (IllegalStateException e) {
            return DocumentListResult.failure(DocumentListResult.Status.NOT_FOUND, e.getMessage());
        }
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return DocumentListResult.failure(DocumentListResult.Status.NOT_FOUND, "目录不存在：" + parentId);
        }
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return DocumentListResult.failure(DocumentListResult.Status.NOT_A_DIRECTORY, "不是目录：" + parentId);
        }

        LinkOption[] linkOptions = properties.isAllowSymlink() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (Files.isRegularFile(child, linkOptions)) {
                    names.add(child.getFileName().toString());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            return DocumentListResult.failure(DocumentListResult.Status.IO_ERROR, e.getMessage());
        } catch (SecurityException e) {
            return DocumentListResult.failure(DocumentListResult.Status.ACCESS_DENIED, e.getMessage());
        }
        names.sort(null);

        List<String> entries = new ArrayList<>(names.size());
        for (String name : names) {
            entries.add(handle.document(DocumentPathResolver.childDocumentId(parentId, name)).toUriString());
        }
        return DocumentListResult.ok(entries);
    }

    private Optional<String> toTreeDocumentId(Path selected) {
        if (selected == null || !Files.isDirectory(selected)) {
            return Optional.empty();
        }
        return pathResolver.toDocumentId(selected);
    }

    private Path initialDirectory() {
        String documentId = properties.getInitialDocumentId();
        if (!properties.isInitialLocationHintEnabled() || documentId == null || documentId.isBlank()) {
            return null;
        }
        try {
            Path path = pathResolver.resolve(documentId);
            return Files.isDirectory(path) ? path : null;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("初始位置提示不可用，使用选择器默认位置：{}", e.getMessage());
            return null;
        }
    }

    private static void complete(CompletableFuture<String> request, String value) {
        if (request != null) {
            request.complete(value);
        }
    }

    private static void fail(CompletableFuture<String> request, Throwable error) {
        if (request != null) {
            request.completeExceptionally(error);
        }
    }
}
