package org.radiant.filesystem.dto;

/**
 * {@code vfs_remove} 的返回结果。
 *
 * @param path        被删除的路径
 * @param entryId     被删除的条目 id
 * @param nodeRemoved 目标节点是否随之被移除（引用计数归零）
 */
public record RemoveResult(String path, String entryId, boolean nodeRemoved) {
}
