package org.radiant.kernel;

import org.springframework.context.SmartLifecycle;

/**
 * 把 {@link Kernel#start()} 挂到 Spring 容器的生命周期上。
 * <p>
 * Manager 没有定义销毁流程，因此 {@link #stop()} 不做任何事。
 */
public class KernelLifecycle implements SmartLifecycle {

    private final Kernel kernel;
    private final boolean autoStart;

    public KernelLifecycle(Kernel kernel, boolean autoStart) {
        this.kernel = kernel;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        if (!kernel.isRunning()) {
            kernel.start();
        }
    }

    @Override
    public void stop() {
    }

    @Override
    public boolean isRunning() {
        return kernel.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
