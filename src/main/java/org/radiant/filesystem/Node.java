package org.radiant.filesystem;

import java.util.Objects;
import java.util.UUID;

/**
 * 文件系统中的数据节点基类。
 * <p>
 * 说明：
 * <ul>
 *   <li>每个节点有唯一 id，并归属于一个 {@link FileSystem}。</li>
 *   <li>引用计数等于当前已注册、指向该节点的 {@link Entry} 数量，随 Entry 的注册/注销增量维护。</li>
 *   <li>构造不会自动注册：需要再调用 {@link FileSystem#addNode(Node)}（或使用 {@code fs.createXxx} 辅助方法）。</li>
 * </ul>
 *
 * @param <T> 节点承载的数据类型
 */
public abstract class Node<T> {

    private final FileSystem filesystem;
    private final String id;
    private int references;
    private T data;

    protected Node(FileSystem filesystem, T data) {
        this.filesystem = Objects.requireNonNull(filesystem, "filesystem 不能为空");
        this.id = UUID.randomUUID().toString();
        this.data = data;
    }

    public FileSystem getFileSystem() {
        return filesystem;
    }

    public String getId() {
        return id;
    }

    public int getReferences() {
        return references;
    }

    protected T getData() {
        return data;
    }

    protected void setData(T data) {
        this.data = data;
    }

    /**
     * 从所属文件系统中移除该节点。
     * <p>
     * 不检查引用计数：仍指向该节点的 Entry 会变成悬空引用，由调用方负责清理。
     */
    public void remove() {
        filesystem.removeNode(id);
    }

    /**
     * 指向该节点的 Entry 被注册到文件系统时调用。
     */
    void entryAdded(Entry<?> entry) {
        references++;
    }

    /**
     * 指向该节点的 Entry 从文件系统注销时调用；计数归零时自动移除该节点。
     */
    void entryRemoved(Entry<?> entry) {
        references--;
        if (references <= 0) {
            remove();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", refs=" + references + "]";
    }
}
