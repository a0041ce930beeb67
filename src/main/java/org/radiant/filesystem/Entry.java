package org.radiant.filesystem;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 目录条目：一个带名字的、指向 {@link Node} 的引用。
 * <p>
 * 一个 Entry 只指向一个 Node，但一个 Node 可以被多个 Entry 指向（硬链接）。
 * <ul>
 *   <li>目标节点只保存 id，通过所属 {@link FileSystem} 解析。</li>
 *   <li>父目录保存为直接引用：经由挂载点添加的条目，其父目录位于另一个文件系统中。</li>
 * </ul>
 *
 * @param <T> 目标节点类型
 */
public class Entry<T extends Node<?>> {

    private final FileSystem filesystem;
    private final String id;
    private final String name;
    private final String nodeId;
    private final Class<?> nodeType;
    private Directory parent;

    public Entry(FileSystem filesystem, String name, T node) {
        this(filesystem, name, node, null);
    }

    /**
     * @param parent 预设的父目录；只记录父目录引用，不会把条目列入该目录
     */
    public Entry(FileSystem filesystem, String name, T node, Directory parent) {
        this.filesystem = Objects.requireNonNull(filesystem, "filesystem 不能为空");
        this.name = requireValidName(name);
        Objects.requireNonNull(node, "node 不能为空");
        this.id = UUID.randomUUID().toString();
        this.nodeId = node.getId();
        this.nodeType = node.getClass();
        this.parent = parent;
    }

    public FileSystem getFileSystem() {
        return filesystem;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * @return 该条目指向的节点（通过所属文件系统解析；节点已被移除时抛出 NotFound）
     */
    public Node<?> getNode() {
        return filesystem.getNode(nodeId);
    }

    public <N extends Node<?>> N getNode(Class<N> type) {
        return filesystem.getNode(nodeId, type);
    }

    public boolean isDirectory() {
        return Directory.class.isAssignableFrom(nodeType);
    }

    public boolean isMount() {
        return ExternDirectory.class.isAssignableFrom(nodeType);
    }

    public boolean isFile() {
        return File.class.isAssignableFrom(nodeType);
    }

    public Optional<Directory> getParent() {
        return Optional.ofNullable(parent);
    }

    void setParent(Directory parent) {
        this.parent = parent;
    }

    private static String requireValidName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("条目名不能为空");
        }
        return name;
    }

    @Override
    public String toString() {
        return "Entry[" + name + " -> " + nodeId + "]";
    }
}
