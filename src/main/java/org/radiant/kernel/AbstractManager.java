package org.radiant.kernel;

import org.radiant.error.InvalidLifecycleStateException;

import java.util.Objects;

/**
 * 保存 Kernel 反向引用（仅允许设置一次）的 Manager 基类。
 */
public abstract class AbstractManager implements Manager {

    private final String name;
    private Kernel kernel;

    protected AbstractManager(String name) {
        this.name = Objects.requireNonNull(name, "name 不能为空");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public void setup(Kernel kernel) {
        if (this.kernel != null) {
            throw new InvalidLifecycleStateException("Manager " + name + " 已执行过 setup");
        }
        this.kernel = Objects.requireNonNull(kernel, "kernel 不能为空");
    }

    protected Kernel kernel() {
        if (kernel == null) {
            throw new InvalidLifecycleStateException("Manager " + name + " 尚未执行 setup");
        }
        return kernel;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
