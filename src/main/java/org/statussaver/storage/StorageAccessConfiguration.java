package org.statussaver.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.statussaver.storage.picker.DirectoryPicker;
import org.statussaver.storage.picker.SwingDirectoryPicker;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 受限存储访问代理的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link StorageAccessProperties} 注入到文档 id 解析器与持久化授权存储中。</li>
 *   <li>默认使用桌面 Swing 目录选择器；其他平台可自行提供 {@link DirectoryPicker} Bean 覆盖。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class StorageAccessConfiguration {

    @Bean
    public DocumentPathResolver documentPathResolver(StorageAccessProperties properties) {
        return new DocumentPathResolver(properties);
    }

    @Bean
    public PersistedGrantStore persistedGrantStore(StorageAccessProperties properties) {
        return new PersistedGrantStore(Path.of(properties.getGrantStoreFile()), new ObjectMapper(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public DirectoryPicker directoryPicker() {
        return new SwingDirectoryPicker("选择状态媒体目录");
    }

    @Bean
    public StorageAccessBroker storageAccessBroker(
            StorageAccessProperties properties,
            DocumentPathResolver pathResolver,
            PersistedGrantStore grantStore,
            DirectoryPicker picker
    ) {
        return new StorageAccessBroker(properties, pathResolver, grantStore, picker);
    }
}
