package org.radiant.kernel;

/**
 * Kernel 内的能力提供者。
 * <p>
 * 生命周期（由 {@link Kernel#start()} 驱动）：
 * <ol>
 *   <li>{@link #setup(Kernel)}：所有 Manager 依次执行；此阶段调用其他 Manager 是<b>不安全</b>的（它们可能尚未 setup）。</li>
 *   <li>{@link #start()}：全部 setup 完成后依次执行；此时可以按名称使用其他 Manager。</li>
 * </ol>
 */
public interface Manager {

    /**
     * @return 在同一个 Kernel 内唯一的名称
     */
    String name();

    void setup(Kernel kernel);

    default void start() {
    }

    /**
     * 暴露给其他 Manager / 内核模块的能力对象。
     * <p>
     * 可以暴露内核内部能力，但不能暴露任何被误用后会危及宿主环境的能力。
     */
    Object getModuleApi();
}
