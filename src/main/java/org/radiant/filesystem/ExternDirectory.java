package org.radiant.filesystem;

import java.util.List;
import java.util.Objects;

/**
 * 挂载点：两个文件系统之间的连接。
 * <p>
 * 所有列表操作都转发到目标文件系统的根目录；自身继承的映射始终为空。
 * 通过挂载点添加的条目实际落在目标文件系统根目录下，也只能从那里看到。
 */
public class ExternDirectory extends Directory {

    private final FileSystem target;

    public ExternDirectory(FileSystem filesystem, FileSystem target) {
        super(filesystem);
        this.target = Objects.requireNonNull(target, "target 不能为空");
    }

    public FileSystem getTarget() {
        return target;
    }

    @Override
    public void addEntry(Entry<?> entry) {
        targetRoot().addEntry(entry);
    }

    @Override
    public Entry<?> removeEntry(String name) {
        return targetRoot().removeEntry(name);
    }

    @Override
    public Entry<?> getEntry(String name) {
        return targetRoot().getEntry(name);
    }

    @Override
    public boolean containsEntry(String name) {
        return targetRoot().containsEntry(name);
    }

    @Override
    public List<Entry<?>> getEntries() {
        return targetRoot().getEntries();
    }

    @Override
    public boolean isEmpty() {
        return targetRoot().isEmpty();
    }

    @Override
    public FileSystem listingFileSystem() {
        return target;
    }

    private Directory targetRoot() {
        return target.getRootDirectory();
    }
}
