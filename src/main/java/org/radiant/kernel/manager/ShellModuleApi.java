package org.radiant.kernel.manager;

import org.radiant.error.DuplicateNameException;
import org.radiant.error.NotFoundException;
import org.radiant.filesystem.Directory;
import org.radiant.filesystem.Entry;
import org.radiant.filesystem.ExternDirectory;
import org.radiant.filesystem.File;
import org.radiant.filesystem.FileSystem;
import org.radiant.filesystem.HashingUtils;
import org.radiant.filesystem.Node;
import org.radiant.filesystem.VfsPathResolver;
import org.radiant.filesystem.dto.EntryInfo;
import org.radiant.filesystem.dto.FileWriteResult;
import org.radiant.filesystem.dto.RemoveResult;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ShellManager} 暴露的能力对象：基于路径的文件操作。
 * <p>
 * 说明：
 * <ul>
 *   <li>所有路径都从根文件系统的根目录开始解析，经过挂载点时进入目标文件系统。</li>
 *   <li>新建的节点总是落在父目录实际列表所在的文件系统中（挂载点下即目标文件系统）。</li>
 *   <li>方法之间互斥执行：上层可能从不同线程调用，这里统一串行化。
 *       返回值都是在锁内生成的快照（{@link EntryInfo} 等），不会把文件系统内部对象交给调用方。</li>
 * </ul>
 */
public class ShellModuleApi {

    private final FileSystemModuleApi fileSystems;
    private final VfsPathResolver resolver;
    private final long writeMaxBytes;

    ShellModuleApi(FileSystemModuleApi fileSystems, long writeMaxBytes) {
        this.fileSystems = fileSystems;
        this.resolver = new VfsPathResolver(fileSystems.root());
        this.writeMaxBytes = writeMaxBytes;
    }

    /**
     * @return 目录下各条目的快照（按加入顺序）
     */
    public synchronized List<EntryInfo> list(String path) {
        VfsPathResolver.ResolvedEntry resolved = resolver.resolve(path);
        Directory directory = asDirectory(resolved.entry(), resolved.path());
        List<EntryInfo> result = new ArrayList<>();
        for (Entry<?> child : directory.getEntries()) {
            result.add(describe(childPath(resolved.path(), child.getName()), child));
        }
        return result;
    }

    public synchronized EntryInfo stat(String path) {
        VfsPathResolver.ResolvedEntry resolved = resolver.resolve(path);
        return describe(resolved.path(), resolved.entry());
    }

    public synchronized byte[] read(String path) {
        VfsPathResolver.ResolvedEntry resolved = resolver.resolve(path);
        return asFile(resolved.entry(), resolved.path()).read();
    }

    public synchronized FileWriteResult write(String path, byte[] content, boolean createParents) {
        return write(path, content, createParents, null);
    }

    /**
     * 写入文件：不存在则创建，存在则整体替换内容（硬链接共享同一内容）。
     * <p>
     * 给出 {@code expectedSha256} 时，校验与写入在同一次加锁内完成：
     * 文件不存在或当前内容的 sha256 不一致都会拒绝写入。
     */
    public synchronized FileWriteResult write(String path, byte[] content, boolean createParents, String expectedSha256) {
        byte[] bytes = content == null ? new byte[0] : content;
        if (bytes.length > writeMaxBytes) {
            throw new IllegalArgumentException("写入内容过大：" + bytes.length + " 字节（上限 " + writeMaxBytes + "）");
        }
        if (expectedSha256 != null && !expectedSha256.isBlank()) {
            verifySha256(path, expectedSha256.trim());
        }
        if (createParents) {
            ensureDirectories(VfsPathResolver.split(path), 1);
        }
        VfsPathResolver.ResolvedParent parent = resolver.resolveParent(path);
        Directory directory = parent.directory();
        boolean created = !directory.containsEntry(parent.name());
        Entry<?> entry;
        if (created) {
            FileSystem owner = directory.listingFileSystem();
            entry = owner.link(directory, parent.name(), owner.createFile(bytes));
        } else {
            entry = directory.getEntry(parent.name());
            asFile(entry, parent.path()).write(bytes);
        }
        return new FileWriteResult(
                parent.path(),
                created,
                bytes.length,
                HashingUtils.sha256Hex(bytes),
                describe(parent.path(), entry)
        );
    }

    public synchronized EntryInfo mkdir(String path, boolean createParents) {
        List<String> segments = VfsPathResolver.split(path);
        if (createParents) {
            ensureDirectories(segments, 1);
        }
        VfsPathResolver.ResolvedParent parent = resolver.resolveParent(path);
        Directory directory = parent.directory();
        if (directory.containsEntry(parent.name())) {
            throw new DuplicateNameException("已存在：" + parent.path());
        }
        FileSystem owner = directory.listingFileSystem();
        return describe(parent.path(), owner.link(directory, parent.name(), owner.createDirectory()));
    }

    /**
     * 为已有文件创建硬链接：新条目指向同一节点，引用计数 +1。
     * <p>
     * 只支持普通文件，且两端必须位于同一个文件系统。
     */
    public synchronized EntryInfo link(String existingPath, String newPath) {
        VfsPathResolver.ResolvedEntry source = resolver.resolve(existingPath);
        File file = asFile(source.entry(), source.path());
        VfsPathResolver.ResolvedParent parent = resolver.resolveParent(newPath);
        Directory directory = parent.directory();
        FileSystem owner = directory.listingFileSystem();
        if (owner != file.getFileSystem()) {
            throw new IllegalArgumentException("不能跨文件系统创建链接：" + source.path() + " -> " + parent.path());
        }
        if (directory.containsEntry(parent.name())) {
            throw new DuplicateNameException("已存在：" + parent.path());
        }
        return describe(parent.path(), owner.link(directory, parent.name(), file));
    }

    /**
     * 删除路径对应的条目。
     * <p>
     * 非空目录需要 {@code recursive=true}；挂载点只会被卸载，不会递归进入目标文件系统。
     */
    public synchronized RemoveResult remove(String path, boolean recursive) {
        VfsPathResolver.ResolvedEntry resolved = resolver.resolve(path);
        if (VfsPathResolver.split(resolved.path()).isEmpty()) {
            throw new IllegalArgumentException("不能删除根目录");
        }
        Entry<?> entry = resolved.entry();
        if (!recursive && isPlainDirectory(entry) && !entry.getNode(Directory.class).isEmpty()) {
            throw new IllegalArgumentException("目录非空（如需删除请设置 recursive=true）：" + resolved.path());
        }
        removeTree(entry);
        boolean nodeRemoved = !entry.getFileSystem().containsNode(entry.getNodeId());
        return new RemoveResult(resolved.path(), entry.getId(), nodeRemoved);
    }

    public synchronized EntryInfo mount(String path, String fileSystemName) {
        VfsPathResolver.ResolvedParent parent = resolver.resolveParent(path);
        Entry<ExternDirectory> entry = fileSystems.mount(parent.directory(), parent.name(), fileSystemName);
        return describe(parent.path(), entry);
    }

    /**
     * @return 创建后全部文件系统的名称
     */
    public synchronized List<String> createFileSystem(String name) {
        fileSystems.createFileSystem(name);
        return fileSystems.fileSystemNames();
    }

    public synchronized List<String> fileSystems() {
        return fileSystems.fileSystemNames();
    }

    private void verifySha256(String path, String expected) {
        VfsPathResolver.ResolvedEntry resolved;
        try {
            resolved = resolver.resolve(path);
        } catch (NotFoundException e) {
            throw new IllegalArgumentException("文件不存在，无法校验 expectedSha256：" + path, e);
        }
        String current = HashingUtils.sha256Hex(asFile(resolved.entry(), resolved.path()).read());
        if (!current.equalsIgnoreCase(expected)) {
            throw new IllegalArgumentException("文件内容已变化（sha256 不一致），拒绝写入：" + resolved.path());
        }
    }

    private void removeTree(Entry<?> entry) {
        FileSystem owner = entry.getFileSystem();
        // 最后一个指向目录的条目被删除前，先清理目录内容，避免子节点变成孤儿
        if (isPlainDirectory(entry) && entry.getNode().getReferences() <= 1) {
            for (Entry<?> child : entry.getNode(Directory.class).getEntries()) {
                removeTree(child);
            }
        }
        owner.removeEntry(entry.getId());
    }

    private void ensureDirectories(List<String> segments, int skipTail) {
        for (int i = 1; i <= segments.size() - skipTail; i++) {
            String prefix = VfsPathResolver.join(segments.subList(0, i));
            VfsPathResolver.ResolvedParent parent = resolver.resolveParent(prefix);
            if (!parent.directory().containsEntry(parent.name())) {
                FileSystem owner = parent.directory().listingFileSystem();
                owner.link(parent.directory(), parent.name(), owner.createDirectory());
            }
        }
    }

    private static EntryInfo describe(String path, Entry<?> entry) {
        String fileSystem = entry.getFileSystem().getName();
        if (!entry.getFileSystem().containsNode(entry.getNodeId())) {
            return new EntryInfo(entry.getName(), path, entry.getId(), entry.getNodeId(), fileSystem,
                    entry.isDirectory(), entry.isFile(), entry.isMount(), null, null, 0, true);
        }
        Node<?> node = entry.getNode();
        Long size = (node instanceof File) ? (long) ((File) node).size() : null;
        String mountTarget = (node instanceof ExternDirectory) ? ((ExternDirectory) node).getTarget().getName() : null;
        return new EntryInfo(
                entry.getName(),
                path,
                entry.getId(),
                entry.getNodeId(),
                fileSystem,
                entry.isDirectory(),
                entry.isFile(),
                entry.isMount(),
                mountTarget,
                size,
                node.getReferences(),
                false
        );
    }

    private static String childPath(String basePath, String name) {
        return "/".equals(basePath) ? "/" + name : basePath + "/" + name;
    }

    private static Directory asDirectory(Entry<?> entry, String path) {
        if (!entry.isDirectory()) {
            throw new IllegalArgumentException("不是目录：" + path);
        }
        return entry.getNode(Directory.class);
    }

    private static File asFile(Entry<?> entry, String path) {
        if (!entry.isFile()) {
            throw new IllegalArgumentException("不是普通文件：" + path);
        }
        return entry.getNode(File.class);
    }

    private static boolean isPlainDirectory(Entry<?> entry) {
        return entry.isDirectory()
                && !entry.isMount()
                && entry.getFileSystem().containsNode(entry.getNodeId());
    }
}
