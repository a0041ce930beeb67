package org.radiant.kernel;

import org.radiant.error.DuplicateNameException;
import org.radiant.error.InvalidLifecycleStateException;
import org.radiant.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行中的内核：持有一组名称唯一的 {@link Manager}，并驱动它们的两阶段启动。
 * <p>
 * 规则：
 * <ul>
 *   <li>只能在 {@link #start()} 之前注册 Manager；启动后不可逆地锁定。</li>
 *   <li>{@link #start()} 先按注册顺序对所有 Manager 执行 setup，再按同样顺序执行 start，
 *       因此任何 Manager 的 start 都看不到尚未完成 setup 的其他 Manager。</li>
 * </ul>
 */
public class Kernel {

    private static final Logger log = LoggerFactory.getLogger(Kernel.class);

    private final Map<String, Manager> managers = new LinkedHashMap<>();
    private final Map<String, ManagerState> states = new LinkedHashMap<>();
    private final Managers view = new Managers(this);
    private boolean running;

    public Kernel(Collection<? extends Manager> managers) {
        for (Manager manager : managers) {
            registerManager(manager);
        }
    }

    /**
     * 注册一个 Manager，仅在启动前可用。
     *
     * @throws InvalidLifecycleStateException Kernel 已启动
     * @throws DuplicateNameException         同名 Manager 已注册
     */
    public void registerManager(Manager manager) {
        if (running) {
            throw new InvalidLifecycleStateException("Kernel 启动后不能再注册 Manager：" + manager.name());
        }
        if (managers.containsKey(manager.name())) {
            throw new DuplicateNameException("名为 " + manager.name() + " 的 Manager 已注册");
        }
        managers.put(manager.name(), manager);
        states.put(manager.name(), ManagerState.REGISTERED);
        log.debug("Registered manager {}", manager.name());
    }

    public Manager getManager(String name) {
        Manager manager = managers.get(name);
        if (manager == null) {
            throw new NotFoundException("未注册的 Manager：" + name);
        }
        return manager;
    }

    public <M extends Manager> M getManager(String name, Class<M> type) {
        Manager manager = getManager(name);
        if (!type.isInstance(manager)) {
            throw new IllegalArgumentException("Manager " + name + " 不是 " + type.getSimpleName());
        }
        return type.cast(manager);
    }

    /**
     * 按名称获取 Manager 的能力对象并做类型检查。
     */
    public <A> A getModuleApi(String name, Class<A> type) {
        Object api = getManager(name).getModuleApi();
        if (!type.isInstance(api)) {
            throw new IllegalArgumentException("Manager " + name + " 的能力对象不是 " + type.getSimpleName());
        }
        return type.cast(api);
    }

    /**
     * 以“按名称取值”的方式访问已注册 Manager 的只读视图。
     */
    public Managers managers() {
        return view;
    }

    public List<String> getManagerNames() {
        return new ArrayList<>(managers.keySet());
    }

    /**
     * @return 未注册的名称返回 {@link ManagerState#UNREGISTERED}
     */
    public ManagerState getManagerState(String name) {
        return states.getOrDefault(name, ManagerState.UNREGISTERED);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 锁定注册并执行两阶段启动。Manager 抛出的异常原样传给调用方。
     */
    public void start() {
        if (running) {
            throw new InvalidLifecycleStateException("Kernel 已启动");
        }
        running = true;

        List<Manager> ordered = new ArrayList<>(managers.values());
        log.info("Starting kernel with managers {}", managers.keySet());

        for (Manager manager : ordered) {
            manager.setup(this);
            states.put(manager.name(), ManagerState.SET_UP);
        }

        for (Manager manager : ordered) {
            manager.start();
            states.put(manager.name(), ManagerState.STARTED);
            log.debug("Started manager {}", manager.name());
        }
        log.info("Kernel started");
    }
}
