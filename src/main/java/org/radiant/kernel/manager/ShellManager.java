package org.radiant.kernel.manager;

import org.radiant.error.InvalidLifecycleStateException;
import org.radiant.kernel.AbstractManager;

/**
 * 基于文件系统的 shell 能力（名称 {@value #NAME}）。
 * <p>
 * 依赖 {@value FileSystemManager#NAME}，因此只在 start 阶段获取其能力对象。
 */
public class ShellManager extends AbstractManager {

    public static final String NAME = "shell";

    private final long writeMaxBytes;
    private ShellModuleApi api;

    public ShellManager(long writeMaxBytes) {
        super(NAME);
        this.writeMaxBytes = writeMaxBytes;
    }

    @Override
    public void start() {
        FileSystemModuleApi fileSystems = kernel().managers()
                .get(FileSystemManager.NAME, FileSystemManager.class)
                .getModuleApi();
        this.api = new ShellModuleApi(fileSystems, writeMaxBytes);
    }

    @Override
    public ShellModuleApi getModuleApi() {
        if (api == null) {
            throw new InvalidLifecycleStateException("Manager " + NAME + " 尚未启动");
        }
        return api;
    }
}
