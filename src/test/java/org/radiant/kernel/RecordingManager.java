package org.radiant.kernel;

import java.util.List;

/**
 * 把 setup/start 调用顺序记录到共享列表中的测试 Manager。
 */
class RecordingManager extends AbstractManager {

    private final List<String> calls;

    RecordingManager(String name, List<String> calls) {
        super(name);
        this.calls = calls;
    }

    @Override
    public void setup(Kernel kernel) {
        super.setup(kernel);
        calls.add("setup:" + name());
    }

    @Override
    public void start() {
        calls.add("start:" + name());
    }

    @Override
    public String getModuleApi() {
        return "api:" + name();
    }

    Kernel exposedKernel() {
        return kernel();
    }
}
