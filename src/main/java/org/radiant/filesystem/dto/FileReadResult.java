package org.radiant.filesystem.dto;

import java.util.List;

/**
 * {@code vfs_read_file} 的返回结果。
 *
 * @param path          文件路径
 * @param encoding      返回内容的编码：utf-8 或 base64
 * @param binary        是否为二进制（base64）
 * @param truncated     是否被截断（超出 maxBytes）
 * @param totalBytes    文件总字节数
 * @param returnedBytes 实际返回的字节数
 * @param sha256        可选：完整内容的 sha256（includeSha256=true 时返回）
 * @param content       内容（utf-8 文本或 base64 字符串）
 * @param warnings      非致命告警
 */
public record FileReadResult(
        String path,
        String encoding,
        boolean binary,
        boolean truncated,
        long totalBytes,
        long returnedBytes,
        String sha256,
        String content,
        List<String> warnings
) {
}
