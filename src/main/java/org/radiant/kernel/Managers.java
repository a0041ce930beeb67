package org.radiant.kernel;

import java.util.List;

/**
 * {@link Kernel} 中 Manager 的只读视图，便于调用方像访问属性一样按名称取用。
 */
public final class Managers {

    private final Kernel kernel;

    Managers(Kernel kernel) {
        this.kernel = kernel;
    }

    public Manager get(String name) {
        return kernel.getManager(name);
    }

    public <M extends Manager> M get(String name, Class<M> type) {
        return kernel.getManager(name, type);
    }

    public boolean contains(String name) {
        return kernel.getManagerState(name) != ManagerState.UNREGISTERED;
    }

    public List<String> names() {
        return kernel.getManagerNames();
    }
}
