package org.radiant.error;

/**
 * 生命周期状态不允许当前操作（例如 Kernel 启动后再注册 Manager）。
 */
public class InvalidLifecycleStateException extends IllegalStateException {

    public InvalidLifecycleStateException(String message) {
        super(message);
    }
}
