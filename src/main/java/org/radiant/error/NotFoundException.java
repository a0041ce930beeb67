package org.radiant.error;

import java.util.NoSuchElementException;

/**
 * 查找失败：未注册的 Node/Entry/Manager，或目录中不存在的条目名。
 */
public class NotFoundException extends NoSuchElementException {

    public NotFoundException(String message) {
        super(message);
    }
}
