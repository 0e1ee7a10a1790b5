package org.statussaver.mcp;

import org.statussaver.storage.MissingHandleException;
import org.statussaver.storage.StorageAccessBroker;
import org.statussaver.storage.StorageAccessException;
import org.statussaver.storage.dto.PersistedGrant;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * 受限存储访问的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>请求用户授权目录（{@code openDocumentTree}）。</li>
 *   <li>列出已授权目录下的文件引用（{@code listFiles}）。</li>
 *   <li>查看已持久化的目录授权（{@code listPersistedGrants}）。</li>
 * </ul>
 * <p>
 * 错误以 {@code 错误码: 描述} 的形式返回给调用方，例如 {@code INVALID_URI: URI is null}。
 */
@Component
public class StorageAccessTools {

    private final StorageAccessBroker broker;

    public StorageAccessTools(StorageAccessBroker broker) {
        this.broker = broker;
    }

    @Tool(
            name = "openDocumentTree",
            description = "弹出目录选择器请求用户授权一个目录；返回持久化授权后的目录句柄（content URI），用户取消时返回 null。"
    )
    /**
     * 阻塞等待用户在目录选择器中作出选择（没有超时）。
     */
    public String openDocumentTree() {
        try {
            return broker.openDocumentTree().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待用户授权目录时被中断", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }
    }

    @Tool(
            name = "listFiles",
            description = "列出目录句柄下的普通文件（非递归，不含子目录），返回每个文件的 content URI；句柄无效或授权失效时返回空列表。"
    )
    public List<String> listFiles(
            @ToolParam(required = false, description = "openDocumentTree 返回的目录句柄") String uri
    ) {
        try {
            return broker.listFiles(uri);
        } catch (MissingHandleException e) {
            throw new IllegalArgumentException(e.getCode() + ": " + e.getMessage(), e);
        }
    }

    @Tool(
            name = "listPersistedGrants",
            description = "列出已持久化的目录授权（uri、是否可读、授权时间）。"
    )
    public List<PersistedGrant> listPersistedGrants() {
        return broker.listPersistedGrants();
    }

    private static RuntimeException translate(Throwable cause) {
        if (cause instanceof StorageAccessException accessException) {
            return new IllegalStateException(accessException.getCode() + ": " + accessException.getMessage(), accessException);
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalStateException("目录授权失败", cause);
    }
}
