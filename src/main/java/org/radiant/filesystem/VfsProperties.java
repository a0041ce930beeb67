package org.radiant.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 内存文件系统的配置（{@code app.vfs.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #rootName}：根文件系统的名称（仅用于日志/排查）。</li>
 *   <li>{@link #mounts}：启动时额外创建的独立文件系统，每个都挂载在根目录下的同名目录。</li>
 *   <li>各种 limit/bytes 配置控制单次返回体积与内存占用。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.vfs")
public class VfsProperties {

    @NotBlank
    private String rootName = "root";

    /**
     * 启动时创建并挂载的文件系统名称（例如 tmp、home）。
     */
    @NotNull
    private List<String> mounts = List.of();

    /**
     * {@code vfs_list_directory} 默认返回条数（分页大小）。
     */
    @Min(1)
    @Max(100_000)
    private int listDefaultLimit = 200;

    /**
     * {@code vfs_list_directory} 允许的最大返回条数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int listMaxLimit = 5_000;

    /**
     * {@code vfs_read_file} 单次返回的最大字节数（超过则截断）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(1);

    /**
     * 单个文件允许写入的最大字节数。
     */
    @NotNull
    private DataSize writeMaxBytes = DataSize.ofMegabytes(5);

    public String getRootName() {
        return rootName;
    }

    public void setRootName(String rootName) {
        this.rootName = rootName;
    }

    public List<String> getMounts() {
        return mounts;
    }

    public void setMounts(List<String> mounts) {
        this.mounts = mounts;
    }

    public int getListDefaultLimit() {
        return listDefaultLimit;
    }

    public void setListDefaultLimit(int listDefaultLimit) {
        this.listDefaultLimit = listDefaultLimit;
    }

    public int getListMaxLimit() {
        return listMaxLimit;
    }

    public void setListMaxLimit(int listMaxLimit) {
        this.listMaxLimit = listMaxLimit;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public DataSize getWriteMaxBytes() {
        return writeMaxBytes;
    }

    public void setWriteMaxBytes(DataSize writeMaxBytes) {
        this.writeMaxBytes = writeMaxBytes;
    }
}
