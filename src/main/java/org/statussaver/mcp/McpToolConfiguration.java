package org.statussaver.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 把 {@link StorageAccessTools} 上的 {@code @Tool} 方法登记为 MCP 工具
 * （{@code openDocumentTree} / {@code listFiles} / {@code listPersistedGrants}）。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> storageAccessToolCallbacks(StorageAccessTools storageAccessTools) {
        return List.of(ToolCallbacks.from(storageAccessTools));
    }
}
