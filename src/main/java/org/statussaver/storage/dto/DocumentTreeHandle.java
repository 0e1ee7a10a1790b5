package org.statussaver.storage.dto;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 目录句柄：用户通过目录选择器授权的目录树能力令牌。
 * <p>
 * 字符串形式：
 * <ul>
 *   <li>目录树：{@code content://<authority>/tree/<treeDocumentId>}</li>
 *   <li>树内文档：{@code content://<authority>/tree/<treeDocumentId>/document/<documentId>}</li>
 * </ul>
 * 文档 id 形如 {@code primary:Android/media}，写入 URI 时除 RFC 3986 非保留字符外全部做百分号编码。
 * <p>
 * 句柄只能通过同一套受限访问方式使用，不会被转换成本地文件路径返回给调用方。
 *
 * @param authority      文档提供方 authority
 * @param treeDocumentId 被授权目录树的根文档 id
 * @param documentId     树内的具体文档 id（为 null 表示目录树本身）
 */
public record DocumentTreeHandle(String authority, String treeDocumentId, String documentId) {

    public static final String SCHEME_PREFIX = "content://";

    private static final String TREE = "tree";
    private static final String DOCUMENT = "document";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public DocumentTreeHandle {
        if (authority == null || authority.isBlank()) {
            throw new IllegalArgumentException("authority 不能为空");
        }
        requireDocumentId(treeDocumentId);
        if (documentId != null) {
            requireDocumentId(documentId);
            if (!isWithinTree(treeDocumentId, documentId)) {
                throw new IllegalArgumentException("文档不在授权目录树内：" + documentId);
            }
        }
    }

    public static DocumentTreeHandle ofTree(String authority, String treeDocumentId) {
        return new DocumentTreeHandle(authority, treeDocumentId, null);
    }

    /**
     * 解析句柄字符串。
     *
     * @throws IllegalArgumentException 字符串不是合法的目录树/文档 URI
     */
    public static DocumentTreeHandle parse(String value) {
        Objects.requireNonNull(value, "value");
        if (!value.startsWith(SCHEME_PREFIX)) {
            throw new IllegalArgumentException("不是 content URI：" + value);
        }
        String[] segments = value.substring(SCHEME_PREFIX.length()).split("/", -1);
        if (segments.length == 3 && TREE.equals(segments[1])) {
            return new DocumentTreeHandle(segments[0], decode(segments[2]), null);
        }
        if (segments.length == 5 && TREE.equals(segments[1]) && DOCUMENT.equals(segments[3])) {
            return new DocumentTreeHandle(segments[0], decode(segments[2]), decode(segments[4]));
        }
        throw new IllegalArgumentException("无法识别的目录句柄：" + value);
    }

    /**
     * 树内某个文档的引用（共享同一棵授权树）。
     */
    public DocumentTreeHandle document(String childDocumentId) {
        return new DocumentTreeHandle(authority, treeDocumentId, childDocumentId);
    }

    /**
     * 该句柄实际指向的文档 id。
     */
    public String targetDocumentId() {
        return (documentId != null) ? documentId : treeDocumentId;
    }

    public boolean isTree() {
        return documentId == null;
    }

    /**
     * 只保留目录树部分的句柄（授权检查以目录树为单位）。
     */
    public DocumentTreeHandle tree() {
        return isTree() ? this : ofTree(authority, treeDocumentId);
    }

    public String toUriString() {
        StringBuilder sb = new StringBuilder(SCHEME_PREFIX)
                .append(authority)
                .append('/').append(TREE)
                .append('/').append(encode(treeDocumentId));
        if (documentId != null) {
            sb.append('/').append(DOCUMENT).append('/').append(encode(documentId));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toUriString();
    }

    static String encode(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    static String decode(String value) {
        // URLDecoder 会把 '+' 当成空格，先转义掉；非法的 % 序列会抛 IllegalArgumentException
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~';
    }

    private static void requireDocumentId(String id) {
        if (id == null || id.indexOf(':') <= 0) {
            throw new IllegalArgumentException("文档 id 格式应为 rootId:path：" + id);
        }
    }

    private static boolean isWithinTree(String treeId, String documentId) {
        if (documentId.equals(treeId)) {
            return true;
        }
        String prefix = treeId.endsWith(":") || treeId.endsWith("/") ? treeId : treeId + "/";
        return documentId.startsWith(prefix);
    }
}
