package org.radiant.filesystem;

/**
 * 普通文件：承载一段字节内容。
 */
public class File extends Node<byte[]> {

    public File(FileSystem filesystem) {
        this(filesystem, new byte[0]);
    }

    public File(FileSystem filesystem, byte[] data) {
        super(filesystem, data == null ? new byte[0] : data.clone());
    }

    /**
     * @return 内容副本
     */
    public byte[] read() {
        return getData().clone();
    }

    /**
     * 整体替换文件内容（所有指向该节点的条目都会看到新内容）。
     */
    public void write(byte[] bytes) {
        setData(bytes == null ? new byte[0] : bytes.clone());
    }

    public int size() {
        return getData().length;
    }
}
