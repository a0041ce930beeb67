package org.radiant.kernel.manager;

import org.radiant.error.DuplicateNameException;
import org.radiant.error.NotFoundException;
import org.radiant.filesystem.Directory;
import org.radiant.filesystem.Entry;
import org.radiant.filesystem.ExternDirectory;
import org.radiant.filesystem.FileSystem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FileSystemManager} 暴露的能力对象：根文件系统、具名文件系统的登记与挂载。
 * <p>
 * 返回的 {@link FileSystem} 是共享引用，任何持有者的修改对其他持有者立即可见。
 */
public class FileSystemModuleApi {

    private final FileSystem root;
    private final Map<String, FileSystem> fileSystems = new LinkedHashMap<>();

    FileSystemModuleApi(FileSystem root) {
        this.root = root;
        fileSystems.put(root.getName(), root);
    }

    public FileSystem root() {
        return root;
    }

    public FileSystem fileSystem(String name) {
        FileSystem fs = fileSystems.get(name);
        if (fs == null) {
            throw new NotFoundException("未知的文件系统：" + name);
        }
        return fs;
    }

    public List<String> fileSystemNames() {
        return new ArrayList<>(fileSystems.keySet());
    }

    /**
     * 新建一个带根目录的独立文件系统并登记。
     */
    public FileSystem createFileSystem(String name) {
        if (name == null || name.isBlank() || name.contains("/")) {
            throw new IllegalArgumentException("文件系统名称不合法：" + name);
        }
        if (fileSystems.containsKey(name)) {
            throw new DuplicateNameException("文件系统已存在：" + name);
        }
        FileSystem fs = FileSystem.withRootDirectory(name);
        fileSystems.put(name, fs);
        return fs;
    }

    /**
     * 在 {@code parent} 下创建名为 {@code name} 的挂载点，指向具名文件系统 {@code target}。
     */
    public Entry<ExternDirectory> mount(Directory parent, String name, String target) {
        FileSystem targetFs = fileSystem(target);
        FileSystem owner = parent.listingFileSystem();
        if (owner == targetFs) {
            throw new IllegalArgumentException("不能把文件系统挂载到自身：" + target);
        }
        if (parent.containsEntry(name)) {
            throw new DuplicateNameException("目录中已存在：" + name);
        }
        return owner.link(parent, name, owner.createMount(targetFs));
    }
}
