package org.radiant.filesystem.dto;

/**
 * 目录条目信息。
 *
 * @param name        条目名
 * @param path        完整路径（统一使用 / 分隔）
 * @param entryId     条目 id
 * @param nodeId      目标节点 id
 * @param fileSystem  条目所属文件系统名称
 * @param directory   是否为目录（含挂载点）
 * @param file        是否为普通文件
 * @param mount       是否为挂载点
 * @param mountTarget 挂载点指向的文件系统名称（非挂载点为 null）
 * @param sizeBytes   文件大小（目录为 null）
 * @param references  目标节点的引用计数（硬链接数）
 * @param dangling    目标节点是否已被强制移除（此时大小、引用计数均无意义）
 */
public record EntryInfo(
        String name,
        String path,
        String entryId,
        String nodeId,
        String fileSystem,
        boolean directory,
        boolean file,
        boolean mount,
        String mountTarget,
        Long sizeBytes,
        int references,
        boolean dangling
) {
}
