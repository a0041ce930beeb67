package org.radiant.kernel.dto;

import java.util.List;

/**
 * {@code kernel_list_managers} 的返回结果。
 *
 * @param running  内核是否已启动
 * @param managers 按注册顺序排列的 Manager
 */
public record ManagerListResult(boolean running, List<ManagerInfo> managers) {
}
