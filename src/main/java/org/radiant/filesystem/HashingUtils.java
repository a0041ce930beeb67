package org.radiant.filesystem;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 哈希工具类：计算文件内容的 sha256（十六进制字符串）。
 * <p>
 * 用于读取时返回内容指纹，以及写入时的“是否已被他人修改”校验。
 */
public final class HashingUtils {

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtils() {
    }

    public static String sha256Hex(byte[] bytes) {
        return HEX.formatHex(sha256Digest().digest(bytes));
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
