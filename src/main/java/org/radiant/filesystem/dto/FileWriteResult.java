package org.radiant.filesystem.dto;

/**
 * {@code vfs_write_file} 的返回结果。
 *
 * @param path         文件路径
 * @param created      是否为新建文件（false 表示覆盖已有内容）
 * @param bytesWritten 写入字节数
 * @param sha256       写入后内容的 sha256
 * @param entry        写入后的条目信息
 */
public record FileWriteResult(
        String path,
        boolean created,
        long bytesWritten,
        String sha256,
        EntryInfo entry
) {
}
