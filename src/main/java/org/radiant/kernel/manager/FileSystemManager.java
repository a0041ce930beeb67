package org.radiant.kernel.manager;

import org.radiant.error.InvalidLifecycleStateException;
import org.radiant.filesystem.FileSystem;
import org.radiant.filesystem.VfsProperties;
import org.radiant.kernel.AbstractManager;
import org.radiant.kernel.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 持有根文件系统及若干具名文件系统的 Manager（名称 {@value #NAME}）。
 * <p>
 * setup 阶段按 {@code app.vfs.*} 构建根文件系统，并把 {@code app.vfs.mounts} 中的每个名称
 * 创建为独立文件系统、挂载到根目录下的同名目录。
 */
public class FileSystemManager extends AbstractManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    public static final String NAME = "fs";

    private final VfsProperties properties;
    private FileSystemModuleApi api;

    public FileSystemManager(VfsProperties properties) {
        super(NAME);
        this.properties = properties;
    }

    @Override
    public void setup(Kernel kernel) {
        super.setup(kernel);
        FileSystemModuleApi created = new FileSystemModuleApi(FileSystem.withRootDirectory(properties.getRootName()));
        for (String name : properties.getMounts()) {
            created.createFileSystem(name);
            created.mount(created.root().getRootDirectory(), name, name);
            log.info("Mounted file system {} at /{}", name, name);
        }
        this.api = created;
    }

    @Override
    public FileSystemModuleApi getModuleApi() {
        if (api == null) {
            throw new InvalidLifecycleStateException("Manager " + NAME + " 尚未执行 setup");
        }
        return api;
    }
}
