package org.statussaver.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.statussaver.storage.dto.DocumentTreeHandle;
import org.statussaver.storage.dto.PersistedGrant;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 持久化授权存储（JSON 文件版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>用户在目录选择器中确认后，{@link #takePersistableReadPermission} 记录目录树的读授权并立即落盘。</li>
 *   <li>枚举目录前通过 {@link #hasReadGrant} 校验授权；未授权的目录树一律视为无权访问。</li>
 * </ol>
 * <p>
 * 说明：
 * <ul>
 *   <li>启动时加载已有授权；文件缺失或损坏时按“没有任何授权”处理并记录日志。</li>
 *   <li>落盘采用“写临时文件 + 原子替换”，避免进程中断导致授权文件半写。</li>
 *   <li>仅用于单进程场景；多个进程共享授权时请替换为外部存储。</li>
 * </ul>
 */
public class PersistedGrantStore {

    private static final Logger log = LoggerFactory.getLogger(PersistedGrantStore.class);

    private static final TypeReference<List<PersistedGrant>> GRANT_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConcurrentHashMap<String, PersistedGrant> grants = new ConcurrentHashMap<>();

    public PersistedGrantStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
        load();
    }

    /**
     * 持久化目录树的读授权（重复授权只刷新时间）。
     *
     * @throws IllegalStateException 授权无法写入存储文件
     */
    public synchronized PersistedGrant takePersistableReadPermission(DocumentTreeHandle handle) {
        String uri = handle.tree().toUriString();
        PersistedGrant grant = new PersistedGrant(uri, true, clock.millis());
        // 先落盘再生效：写入失败时内存中不能出现这条授权
        Map<String, PersistedGrant> next = new HashMap<>(grants);
        next.put(uri, grant);
        save(sorted(next.values()));
        grants.put(uri, grant);
        log.info("已持久化目录授权：{}", uri);
        return grant;
    }

    public boolean hasReadGrant(DocumentTreeHandle handle) {
        PersistedGrant grant = grants.get(handle.tree().toUriString());
        return grant != null && grant.read();
    }

    /**
     * 当前所有持久化授权，按授权时间升序。
     */
    public List<PersistedGrant> list() {
        return sorted(grants.values());
    }

    private static List<PersistedGrant> sorted(Collection<PersistedGrant> values) {
        List<PersistedGrant> result = new ArrayList<>(values);
        result.sort(Comparator.comparingLong(PersistedGrant::persistedTime).thenComparing(PersistedGrant::uri));
        return result;
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try {
            List<PersistedGrant> loaded = objectMapper.readValue(file.toFile(), GRANT_LIST);
            for (PersistedGrant grant : loaded) {
                if (grant != null && grant.uri() != null) {
                    grants.put(grant.uri(), grant);
                }
            }
            log.debug("已加载 {} 条持久化授权：{}", grants.size(), file);
        } catch (IOException e) {
            log.warn("持久化授权文件无法读取，按无授权处理：{}", file, e);
        }
    }

    private void save(List<PersistedGrant> snapshot) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("持久化授权写入失败：" + file, e);
        }
    }
}
