package org.radiant.filesystem.dto;

import java.util.List;

/**
 * {@code vfs_list_file_systems} 的返回结果。
 *
 * @param names 已登记的文件系统名称（第一个为根文件系统）
 */
public record FileSystemsResult(List<String> names) {
}
