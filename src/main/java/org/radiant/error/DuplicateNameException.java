package org.radiant.error;

/**
 * 名称冲突：目录中已存在同名条目，或 Kernel 中已注册同名 Manager。
 */
public class DuplicateNameException extends IllegalArgumentException {

    public DuplicateNameException(String message) {
        super(message);
    }
}
