package org.radiant.kernel.dto;

/**
 * @param name  Manager 名称
 * @param state 生命周期状态
 */
public record ManagerInfo(String name, String state) {
}
