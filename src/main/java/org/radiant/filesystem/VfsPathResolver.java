package org.radiant.filesystem;

import org.radiant.error.NotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 路径解析器：把 {@code /a/b/c} 形式的路径逐级解析为 {@link Entry}。
 * <p>
 * 规则：
 * <ul>
 *   <li>统一使用 / 分隔；空串或 {@code /} 表示根目录。</li>
 *   <li>连续的 / 与 {@code .} 段会被忽略；不支持 {@code ..}（直接拒绝）。</li>
 *   <li>经过挂载点（{@link ExternDirectory}）时自然转发到目标文件系统的根目录。</li>
 * </ul>
 */
public class VfsPathResolver {

    private final FileSystem root;

    public VfsPathResolver(FileSystem root) {
        this.root = Objects.requireNonNull(root, "root 不能为空");
    }

    public ResolvedEntry resolve(String path) {
        List<String> segments = split(path);
        Entry<?> current = root.getRoot()
                .orElseThrow(() -> new NotFoundException("文件系统 " + root.getName() + " 未设置根目录"));
        StringBuilder walked = new StringBuilder();
        for (String segment : segments) {
            Directory directory = asDirectory(current, walked);
            walked.append('/').append(segment);
            if (!directory.containsEntry(segment)) {
                throw new NotFoundException("路径不存在：" + walked);
            }
            current = directory.getEntry(segment);
        }
        return new ResolvedEntry(join(segments), current);
    }

    /**
     * 解析“待创建路径”的父目录与末级名称（末级条目可以不存在）。
     */
    public ResolvedParent resolveParent(String path) {
        List<String> segments = split(path);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("根目录没有父目录");
        }
        String name = segments.get(segments.size() - 1);
        List<String> parentSegments = segments.subList(0, segments.size() - 1);
        ResolvedEntry parent = resolve(join(parentSegments));
        Directory directory = asDirectory(parent.entry(), new StringBuilder(parent.path()));
        return new ResolvedParent(join(segments), directory, name);
    }

    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null || path.isBlank()) {
            return segments;
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                throw new IllegalArgumentException("不支持 .. 路径段：" + path);
            }
            segments.add(segment);
        }
        return segments;
    }

    public static String join(List<String> segments) {
        return segments.isEmpty() ? "/" : "/" + String.join("/", segments);
    }

    private static Directory asDirectory(Entry<?> entry, CharSequence path) {
        Node<?> node = entry.getNode();
        if (!(node instanceof Directory)) {
            throw new IllegalArgumentException("不是目录：" + (path.length() == 0 ? "/" : path));
        }
        return (Directory) node;
    }

    /**
     * @param path  规范化后的路径
     * @param entry 解析得到的条目（根路径为根条目）
     */
    public record ResolvedEntry(String path, Entry<?> entry) {
    }

    /**
     * @param path      规范化后的完整路径
     * @param directory 父目录（可能是挂载点）
     * @param name      末级名称
     */
    public record ResolvedParent(String path, Directory directory, String name) {
    }
}
