package org.radiant.kernel;

/**
 * Manager 生命周期状态，只由 {@link Kernel} 按顺序推进，不可跳过、不可回退。
 */
public enum ManagerState {
    UNREGISTERED,
    REGISTERED,
    SET_UP,
    STARTED
}
