package org.statussaver.storage;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 受限存储访问代理的配置（{@code app.saf.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 声明可供目录选择器授权的存储卷（rootId -> 本地目录），只有这些卷内的目录能变成目录句柄。</li>
 *   <li>通过 {@link #grantStoreFile} 指定持久化授权的存储位置，授权在进程重启后依然有效。</li>
 *   <li>通过 {@link #pendingRequestPolicy} 控制“已有授权请求未完成时再次请求”的处理方式。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.saf")
public class StorageAccessProperties {

    /**
     * 存储卷白名单：key 为 rootId（例如 {@code primary}），value 为本地目录。
     * <p>
     * 文档 id 的格式为 {@code rootId:相对路径}，例如 {@code primary:DCIM/Camera}。
     */
    @NotEmpty
    private Map<String, String> roots = new LinkedHashMap<>(Map.of("primary", "."));

    /**
     * 目录句柄（content URI）中使用的 authority。
     */
    @NotBlank
    private String authority = "com.android.externalstorage.documents";

    /**
     * 目录选择器的初始位置提示（文档 id）。
     * <p>
     * 默认指向聊天应用的状态媒体目录；目录不存在时选择器回退到默认位置，不视为错误。
     */
    private String initialDocumentId = "primary:Android/media/com.whatsapp/WhatsApp/Media/.Statuses";

    /**
     * 是否向目录选择器传递初始位置提示。
     */
    private boolean initialLocationHintEnabled = true;

    /**
     * 持久化授权的存储文件（JSON）。
     */
    @NotBlank
    private String grantStoreFile = "data/persisted-grants.json";

    /**
     * 授权请求未完成时再次发起请求的处理策略。
     */
    @NotNull
    private PendingRequestPolicy pendingRequestPolicy = PendingRequestPolicy.REJECT;

    /**
     * 是否允许访问符号链接（symlink）。
     * <p>
     * 安全建议：默认 false；若开启请确保 {@link #roots} 已经非常严格。
     */
    private boolean allowSymlink = false;

    public Map<String, String> getRoots() {
        return roots;
    }

    public void setRoots(Map<String, String> roots) {
        this.roots = roots;
    }

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }

    public String getInitialDocumentId() {
        return initialDocumentId;
    }

    public void setInitialDocumentId(String initialDocumentId) {
        this.initialDocumentId = initialDocumentId;
    }

    public boolean isInitialLocationHintEnabled() {
        return initialLocationHintEnabled;
    }

    public void setInitialLocationHintEnabled(boolean initialLocationHintEnabled) {
        this.initialLocationHintEnabled = initialLocationHintEnabled;
    }

    public String getGrantStoreFile() {
        return grantStoreFile;
    }

    public void setGrantStoreFile(String grantStoreFile) {
        this.grantStoreFile = grantStoreFile;
    }

    public PendingRequestPolicy getPendingRequestPolicy() {
        return pendingRequestPolicy;
    }

    public void setPendingRequestPolicy(PendingRequestPolicy pendingRequestPolicy) {
        this.pendingRequestPolicy = pendingRequestPolicy;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }
}
