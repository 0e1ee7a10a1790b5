package org.statussaver.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 文档 id 解析器：在“文档 id（{@code rootId:相对路径}）”与“受控的本地绝对路径”之间转换，
 * 并确保解析结果不会逃逸出配置的存储卷。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>仅允许访问 {@code app.saf.roots} 配置的存储卷。</li>
 *   <li>阻止路径穿越（例如 {@code ../}）导致访问存储卷之外的文件。</li>
 *   <li>默认禁止符号链接（symlink）/junction 造成的“路径逃逸”。</li>
 * </ul>
 * <p>
 * 注意：本地路径只在进程内部使用，不会出现在返回给调用方的结果中。
 */
public class DocumentPathResolver {

    private final StorageAccessProperties properties;
    private final List<Root> roots;

    public DocumentPathResolver(StorageAccessProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    /**
     * 把文档 id 解析为本地绝对路径（目标可以不存在）。
     *
     * @throws IllegalArgumentException 文档 id 非法、存储卷未知或路径逃逸
     */
    public Path resolve(String documentId) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置存储卷（app.saf.roots）");
        }
        if (documentId == null || documentId.indexOf(':') <= 0) {
            throw new IllegalArgumentException("文档 id 格式应为 rootId:path：" + documentId);
        }
        int colon = documentId.indexOf(':');
        Root root = findRootById(documentId.substring(0, colon));
        String relative = documentId.substring(colon + 1);

        for (String segment : relative.split("/")) {
            if ("..".equals(segment) || ".".equals(segment)) {
                throw new IllegalArgumentException("文档 id 中不允许出现相对路径片段：" + documentId);
            }
        }

        Path absolute = relative.isEmpty() ? root.rootPath() : root.rootPath().resolve(relative).normalize();
        // normalize 之后仍需落在卷内
        if (!absolute.startsWith(root.rootPath())) {
            throw new IllegalArgumentException("路径不在存储卷范围内：" + documentId);
        }
        checkConfinedToVolume(root, absolute);
        return absolute;
    }

    /**
     * 把本地目录反查为文档 id（选择器返回的是本地目录）。
     * <p>
     * 多个存储卷嵌套时选择路径层级最长的那个；不在任何存储卷内时返回空。
     */
    public Optional<String> toDocumentId(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        Path absolute = path.toAbsolutePath().normalize();
        Optional<Root> best = roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()));
        if (best.isEmpty()) {
            return Optional.empty();
        }
        Root root = best.get();
        String relative = root.rootPath().relativize(absolute).toString().replace('\\', '/');
        String documentId = root.id() + ":" + relative;
        try {
            checkConfinedToVolume(root, absolute);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return Optional.of(documentId);
    }

    /**
     * 拼出子文档的 id。
     */
    public static String childDocumentId(String parentDocumentId, String childName) {
        if (parentDocumentId.endsWith(":") || parentDocumentId.endsWith("/")) {
            return parentDocumentId + childName;
        }
        return parentDocumentId + "/" + childName;
    }

    /**
     * 检查目标路径始终留在存储卷内：沿文档 id 的每一级向下走，已存在的每一级都按真实路径比对，
     * 中间任何一级是链接或指向卷外都拒绝。不存在的尾部只做字符串层面的检查。
     */
    private void checkConfinedToVolume(Root volume, Path target) {
        Path volumeReal;
        try {
            volumeReal = volume.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("存储卷不存在或无法解析：" + volume.rootPath(), e);
        }

        Path step = volume.rootPath();
        for (Path name : volume.rootPath().relativize(target)) {
            if (name.toString().isEmpty()) {
                continue;
            }
            step = step.resolve(name);
            if (!Files.exists(step, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            if (Files.isSymbolicLink(step) && !properties.isAllowSymlink()) {
                throw new IllegalArgumentException("文档路径中包含符号链接：" + volume.id() + ":" + volume.rootPath().relativize(step));
            }
            Path stepReal;
            try {
                stepReal = step.toRealPath();
            } catch (IOException e) {
                throw new IllegalArgumentException("文档路径无法解析：" + step, e);
            }
            if (!stepReal.startsWith(volumeReal)) {
                throw new IllegalArgumentException("文档路径指向存储卷 " + volume.id() + " 之外：" + step);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的存储卷：" + rootId);
    }

    private static List<Root> normalizeRoots(StorageAccessProperties properties) {
        Map<String, String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (Map.Entry<String, String> entry : configured.entrySet()) {
            String value = Objects.requireNonNull(entry.getValue(), "配置项 app.saf.roots." + entry.getKey() + " 不能为空");
            Path path = Path.of(value).toAbsolutePath().normalize();
            result.add(new Root(entry.getKey(), path));
        }
        return result;
    }

    private record Root(String id, Path rootPath) {
    }
}
