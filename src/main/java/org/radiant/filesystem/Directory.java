package org.radiant.filesystem;

import org.radiant.error.DuplicateNameException;
import org.radiant.error.NotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 包含若干 {@link Entry} 的节点（名称 -> 条目）。
 * <p>
 * 该映射是目录私有的，与 {@link FileSystem} 的扁平条目注册表相互独立：
 * 这里只维护“列在该目录下”的关系，不影响引用计数。
 */
public class Directory extends Node<Map<String, Entry<?>>> {

    public Directory(FileSystem filesystem) {
        super(filesystem, new LinkedHashMap<>());
    }

    /**
     * 创建目录并依次列入给定条目（同 {@link #addEntry(Entry)}，不注册到文件系统）。
     */
    public Directory(FileSystem filesystem, List<? extends Entry<?>> entries) {
        this(filesystem);
        for (Entry<?> entry : entries) {
            addEntry(entry);
        }
    }

    /**
     * 把条目列入该目录，并把条目的父目录设为该目录。
     *
     * @throws DuplicateNameException 已存在同名条目
     */
    public void addEntry(Entry<?> entry) {
        Map<String, Entry<?>> entries = getData();
        if (entries.containsKey(entry.getName())) {
            throw new DuplicateNameException("目录 " + getId() + " 已包含名为 " + entry.getName() + " 的条目");
        }
        entries.put(entry.getName(), entry);
        entry.setParent(this);
    }

    /**
     * @return 被移出目录的条目
     * @throws NotFoundException 不存在该名称
     */
    public Entry<?> removeEntry(String name) {
        Entry<?> entry = getData().remove(name);
        if (entry == null) {
            throw new NotFoundException("目录 " + getId() + " 中不存在条目：" + name);
        }
        if (entry.getParent().orElse(null) == this) {
            entry.setParent(null);
        }
        return entry;
    }

    public Entry<?> getEntry(String name) {
        Entry<?> entry = getData().get(name);
        if (entry == null) {
            throw new NotFoundException("目录 " + getId() + " 中不存在条目：" + name);
        }
        return entry;
    }

    public boolean containsEntry(String name) {
        return getData().containsKey(name);
    }

    /**
     * @return 按加入顺序排列的条目快照
     */
    public List<Entry<?>> getEntries() {
        return new ArrayList<>(getData().values());
    }

    public boolean isEmpty() {
        return getData().isEmpty();
    }

    /**
     * 该目录下条目所指向节点所在的文件系统。
     * <p>
     * 普通目录即自身所属文件系统；挂载点返回目标文件系统。
     */
    public FileSystem listingFileSystem() {
        return getFileSystem();
    }

    /**
     * 仅供 {@link FileSystem#removeEntry(String)} 级联使用：目录当前仍以该名称列出这个条目时才解除。
     */
    boolean detach(Entry<?> entry) {
        if (containsEntry(entry.getName()) && getEntry(entry.getName()) == entry) {
            removeEntry(entry.getName());
            return true;
        }
        return false;
    }
}
