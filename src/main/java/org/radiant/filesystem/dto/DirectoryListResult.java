package org.radiant.filesystem.dto;

import java.util.List;

/**
 * {@code vfs_list_directory} 的返回结果。
 *
 * @param path     当前目录路径
 * @param offset   分页偏移
 * @param limit    分页大小
 * @param hasMore  是否还有更多数据（用于分页）
 * @param entries  条目列表
 * @param warnings 非致命告警（例如某个条目指向已被移除的节点）
 */
public record DirectoryListResult(
        String path,
        Integer offset,
        Integer limit,
        boolean hasMore,
        List<EntryInfo> entries,
        List<String> warnings
) {
}
