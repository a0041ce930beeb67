package org.radiant.kernel;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 内核配置（{@code app.kernel.*}）。
 */
@Validated
@ConfigurationProperties(prefix = "app.kernel")
public class KernelProperties {

    /**
     * Spring 容器启动时是否自动调用 {@link Kernel#start()}。
     * <p>
     * 关闭后需要由调用方手动启动；在此之前仍可通过 {@link Kernel#registerManager(Manager)} 追加 Manager。
     */
    private boolean autoStart = true;

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
