package org.radiant.filesystem;

import org.radiant.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个独立的命名空间：按 id 登记全部 {@link Node} 与 {@link Entry}，并可指定根目录条目。
 * <p>
 * 重要说明：
 * <ul>
 *   <li>两张注册表是唯一的权威存储；目录映射、条目中的引用都只是查找索引。</li>
 *   <li>引用计数在 {@link #addEntry(Entry)} / {@link #removeEntry(String)} 中增量维护；
 *       因移除条目导致计数归零的节点会被立即移除。</li>
 *   <li>非线程安全：内部不加锁，调用方负责串行化。</li>
 * </ul>
 */
public class FileSystem {

    private static final Logger log = LoggerFactory.getLogger(FileSystem.class);

    /**
     * 根目录条目的名称。
     */
    public static final String ROOT_ENTRY_NAME = "/";

    // 名称仅用于日志/排查
    private final String name;
    private final Map<String, Node<?>> nodes = new LinkedHashMap<>();
    private final Map<String, Entry<?>> entries = new LinkedHashMap<>();
    private Entry<Directory> root;

    public FileSystem(String name) {
        this.name = Objects.requireNonNull(name, "name 不能为空");
    }

    /**
     * 创建一个带根目录的文件系统：根目录节点 + 名为 {@code /} 的根条目（已注册并设为 root）。
     */
    public static FileSystem withRootDirectory(String name) {
        FileSystem fs = new FileSystem(name);
        Directory rootDirectory = fs.createDirectory();
        Entry<Directory> rootEntry = new Entry<>(fs, ROOT_ENTRY_NAME, rootDirectory);
        fs.addEntry(rootEntry);
        fs.setRoot(rootEntry);
        return fs;
    }

    public String getName() {
        return name;
    }

    // ---------------------------------------------------------------- nodes

    public void addNode(Node<?> node) {
        if (node.getFileSystem() != this) {
            throw new IllegalArgumentException("节点 " + node.getId() + " 不属于文件系统 " + name);
        }
        nodes.put(node.getId(), node);
    }

    /**
     * 移除节点；不检查、也不清理仍指向它的条目。
     *
     * @return 被移除的节点
     */
    public Node<?> removeNode(String id) {
        Node<?> node = nodes.remove(id);
        if (node == null) {
            throw new NotFoundException("文件系统 " + name + " 中不存在节点：" + id);
        }
        log.debug("Removed node {} from {}", id, name);
        return node;
    }

    public Node<?> getNode(String id) {
        Node<?> node = nodes.get(id);
        if (node == null) {
            throw new NotFoundException("文件系统 " + name + " 中不存在节点：" + id);
        }
        return node;
    }

    public <N extends Node<?>> N getNode(String id, Class<N> type) {
        Node<?> node = getNode(id);
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException("节点 " + id + " 不是 " + type.getSimpleName());
        }
        return type.cast(node);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public List<Node<?>> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public File createFile(byte[] data) {
        File file = new File(this, data);
        addNode(file);
        return file;
    }

    public Directory createDirectory() {
        Directory directory = new Directory(this);
        addNode(directory);
        return directory;
    }

    public ExternDirectory createMount(FileSystem target) {
        ExternDirectory mount = new ExternDirectory(this, target);
        addNode(mount);
        return mount;
    }

    // ---------------------------------------------------------------- entries

    /**
     * 注册条目，并通知目标节点（引用计数 +1）。
     *
     * @throws NotFoundException 目标节点未注册到本文件系统
     */
    public void addEntry(Entry<?> entry) {
        if (entry.getFileSystem() != this) {
            throw new IllegalArgumentException("条目 " + entry.getName() + " 不属于文件系统 " + name);
        }
        if (entries.containsKey(entry.getId())) {
            throw new IllegalArgumentException("条目已注册：" + entry.getId());
        }
        Node<?> node = getNode(entry.getNodeId());
        entries.put(entry.getId(), entry);
        node.entryAdded(entry);
    }

    /**
     * 注销条目：先从父目录中解除，再从注册表移除，最后通知目标节点（引用计数 -1，归零则移除节点）。
     *
     * @return 被移除的条目
     */
    public Entry<?> removeEntry(String id) {
        Entry<?> entry = entries.get(id);
        if (entry == null) {
            throw new NotFoundException("文件系统 " + name + " 中不存在条目：" + id);
        }

        entry.getParent().ifPresent(parent -> parent.detach(entry));
        entries.remove(id);

        Node<?> node = nodes.get(entry.getNodeId());
        if (node == null) {
            // 节点已被强制移除（Node.remove），条目是悬空的
            log.warn("Entry {} in {} points to removed node {}", entry.getName(), name, entry.getNodeId());
            return entry;
        }
        node.entryRemoved(entry);
        return entry;
    }

    public Entry<?> getEntry(String id) {
        Entry<?> entry = entries.get(id);
        if (entry == null) {
            throw new NotFoundException("文件系统 " + name + " 中不存在条目：" + id);
        }
        return entry;
    }

    public boolean containsEntry(String id) {
        return entries.containsKey(id);
    }

    public List<Entry<?>> getEntries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * 创建条目、列入目录并注册（两步合一）。
     *
     * @return 已生效的条目
     */
    public <N extends Node<?>> Entry<N> link(Directory directory, String name, N node) {
        Entry<N> entry = new Entry<>(this, name, node);
        // 先确认节点存在，避免目录中留下无法注册的条目
        getNode(node.getId());
        directory.addEntry(entry);
        addEntry(entry);
        return entry;
    }

    // ---------------------------------------------------------------- root

    public Optional<Entry<Directory>> getRoot() {
        return Optional.ofNullable(root);
    }

    public void setRoot(Entry<Directory> root) {
        this.root = root;
    }

    /**
     * @throws NotFoundException 未设置根条目
     */
    public Directory getRootDirectory() {
        if (root == null) {
            throw new NotFoundException("文件系统 " + name + " 未设置根目录");
        }
        return root.getNode(Directory.class);
    }

    @Override
    public String toString() {
        return "FileSystem[" + name + ", nodes=" + nodes.size() + ", entries=" + entries.size() + "]";
    }
}
