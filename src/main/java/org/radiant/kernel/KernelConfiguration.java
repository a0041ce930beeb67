package org.radiant.kernel;

import org.radiant.filesystem.VfsProperties;
import org.radiant.kernel.manager.FileSystemManager;
import org.radiant.kernel.manager.ShellManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;

/**
 * 内核的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>容器中的所有 {@link Manager} Bean 按 {@link Order} 顺序注册到 {@link Kernel}，该顺序即两阶段启动的顺序。</li>
 *   <li>{@link KernelLifecycle} 在容器启动完成时调用 {@link Kernel#start()}（可用 {@code app.kernel.auto-start=false} 关闭）。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class KernelConfiguration {

    @Bean
    @Order(0)
    public FileSystemManager fileSystemManager(VfsProperties properties) {
        return new FileSystemManager(properties);
    }

    @Bean
    @Order(1)
    public ShellManager shellManager(VfsProperties properties) {
        return new ShellManager(properties.getWriteMaxBytes().toBytes());
    }

    @Bean
    public Kernel kernel(List<Manager> managers) {
        return new Kernel(managers);
    }

    @Bean
    public KernelLifecycle kernelLifecycle(Kernel kernel, KernelProperties properties) {
        return new KernelLifecycle(kernel, properties.isAutoStart());
    }
}
