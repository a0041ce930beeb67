package org.radiant.mcp;

import org.radiant.filesystem.HashingUtils;
import org.radiant.filesystem.VfsPathResolver;
import org.radiant.filesystem.VfsProperties;
import org.radiant.filesystem.dto.DirectoryListResult;
import org.radiant.filesystem.dto.EntryInfo;
import org.radiant.filesystem.dto.FileReadResult;
import org.radiant.filesystem.dto.FileSystemsResult;
import org.radiant.filesystem.dto.FileWriteResult;
import org.radiant.filesystem.dto.RemoveResult;
import org.radiant.kernel.Kernel;
import org.radiant.kernel.dto.ManagerInfo;
import org.radiant.kernel.dto.ManagerListResult;
import org.radiant.kernel.manager.ShellManager;
import org.radiant.kernel.manager.ShellModuleApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * 内存文件系统 MCP 工具集合。
 * <p>
 * 这一层只是能力对象的消费者：所有操作都通过 {@link Kernel#getModuleApi(String, Class)}
 * 取得 {@code shell} 的 {@link ShellModuleApi} 完成，不直接改动内核或文件系统内部结构。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>查看内核中的 Manager（{@code kernel_list_managers}）。</li>
 *   <li>文件系统登记与挂载（{@code vfs_list_file_systems}、{@code vfs_create_file_system}、{@code vfs_mount}）。</li>
 *   <li>列目录、查看条目、读写文件、建目录、硬链接、删除。</li>
 * </ul>
 */
@Component
public class VfsMcpTools {

    private static final Logger log = LoggerFactory.getLogger(VfsMcpTools.class);

    private final Kernel kernel;
    private final VfsProperties properties;

    public VfsMcpTools(Kernel kernel, VfsProperties properties) {
        this.kernel = kernel;
        this.properties = properties;
    }

    @Tool(
            name = "kernel_list_managers",
            description = "列出内核中已注册的 Manager 及其生命周期状态（按注册顺序）。"
    )
    public ManagerListResult listManagers() {
        List<ManagerInfo> managers = new ArrayList<>();
        for (String name : kernel.getManagerNames()) {
            managers.add(new ManagerInfo(name, kernel.getManagerState(name).name()));
        }
        return new ManagerListResult(kernel.isRunning(), managers);
    }

    @Tool(
            name = "vfs_list_file_systems",
            description = "列出已登记的文件系统名称（第一个为根文件系统）。"
    )
    public FileSystemsResult listFileSystems() {
        return new FileSystemsResult(shell().fileSystems());
    }

    @Tool(
            name = "vfs_create_file_system",
            description = "新建一个独立的内存文件系统（带根目录）；之后可用 vfs_mount 挂载。"
    )
    public FileSystemsResult createFileSystem(
            @ToolParam(description = "文件系统名称（不能包含 /，不能与已有名称重复）") String name
    ) {
        List<String> names = shell().createFileSystem(name);
        log.info("Created file system {}", name);
        return new FileSystemsResult(names);
    }

    @Tool(
            name = "vfs_list_directory",
            description = "列出目录下的条目（非递归，支持 limit/offset 分页；经过挂载点时列出目标文件系统根目录）。"
    )
    public DirectoryListResult listDirectory(
            @ToolParam(required = false, description = "目录路径（以 / 开头；为空则为根目录）") String path,
            @ToolParam(required = false, description = "分页大小（默认 app.vfs.list-default-limit，上限 app.vfs.list-max-limit）") Integer limit,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset
    ) {
        String basePath = VfsPathResolver.join(VfsPathResolver.split(path));
        List<EntryInfo> all = shell().list(basePath);

        int resolvedOffset = (offset == null) ? 0 : Math.max(0, offset);
        int resolvedLimit = resolveLimit(limit);

        List<EntryInfo> entries = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int end = (int) Math.min((long) resolvedOffset + resolvedLimit, all.size());
        for (int i = resolvedOffset; i < end; i++) {
            EntryInfo info = all.get(i);
            if (info.dangling()) {
                warnings.add("条目指向的节点已被移除：" + info.path());
            }
            entries.add(info);
        }
        return new DirectoryListResult(
                basePath,
                resolvedOffset,
                resolvedLimit,
                end < all.size(),
                entries,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "vfs_stat",
            description = "查看单个条目的信息（类型、大小、引用计数、所属文件系统等）。"
    )
    public EntryInfo stat(
            @ToolParam(description = "路径（以 / 开头）") String path
    ) {
        return shell().stat(path);
    }

    @Tool(
            name = "vfs_read_file",
            description = "读取文件内容；UTF-8 文本返回字符串，否则返回 base64（支持 maxBytes 截断）。"
    )
    public FileReadResult readFile(
            @ToolParam(description = "文件路径（以 / 开头）") String path,
            @ToolParam(required = false, description = "最大返回字节数（默认 app.vfs.read-max-bytes，上限同配置）") Long maxBytes,
            @ToolParam(required = false, description = "是否强制 base64 输出（true/false）") Boolean asBase64,
            @ToolParam(required = false, description = "是否返回 sha256（true/false）") Boolean includeSha256
    ) {
        String normalized = VfsPathResolver.join(VfsPathResolver.split(path));
        byte[] all = shell().read(normalized);

        long resolvedMaxBytes = resolveReadMaxBytes(maxBytes);
        byte[] bytes = all.length > resolvedMaxBytes ? Arrays.copyOf(all, (int) resolvedMaxBytes) : all;
        boolean truncated = all.length > bytes.length;
        String sha256 = Boolean.TRUE.equals(includeSha256) ? HashingUtils.sha256Hex(all) : null;

        List<String> warnings = new ArrayList<>();
        if (Boolean.TRUE.equals(asBase64) || !isValidUtf8(bytes)) {
            if (!Boolean.TRUE.equals(asBase64) && truncated) {
                warnings.add("内容被 maxBytes 截断，末尾可能存在不完整的 UTF-8 序列；已按 base64 返回。");
            }
            return new FileReadResult(
                    normalized,
                    "base64",
                    true,
                    truncated,
                    all.length,
                    bytes.length,
                    sha256,
                    Base64.getEncoder().encodeToString(bytes),
                    warnings.isEmpty() ? null : warnings
            );
        }
        return new FileReadResult(
                normalized,
                "utf-8",
                false,
                truncated,
                all.length,
                bytes.length,
                sha256,
                new String(bytes, StandardCharsets.UTF_8),
                null
        );
    }

    @Tool(
            name = "vfs_write_file",
            description = "写入文件：不存在则创建，存在则整体替换（硬链接共享内容）；可用 expectedSha256 防止覆盖他人修改。"
    )
    public FileWriteResult writeFile(
            @ToolParam(description = "文件路径（以 / 开头）") String path,
            @ToolParam(description = "文件内容（utf-8 文本，或 base64=true 时为 base64 字符串）") String content,
            @ToolParam(required = false, description = "content 是否为 base64（true/false）") Boolean base64,
            @ToolParam(required = false, description = "是否自动创建缺失的父目录（true/false）") Boolean createParents,
            @ToolParam(required = false, description = "可选：期望的当前内容 sha256；不一致则拒绝写入") String expectedSha256
    ) {
        byte[] bytes = decodeContent(content, Boolean.TRUE.equals(base64));
        FileWriteResult result = shell().write(path, bytes, Boolean.TRUE.equals(createParents), expectedSha256);
        log.debug("Wrote {} bytes to {} (created: {})", result.bytesWritten(), result.path(), result.created());
        return result;
    }

    @Tool(
            name = "vfs_make_directory",
            description = "创建目录（可选自动创建父目录）。"
    )
    public EntryInfo makeDirectory(
            @ToolParam(description = "目录路径（以 / 开头）") String path,
            @ToolParam(required = false, description = "是否自动创建缺失的父目录（true/false）") Boolean createParents
    ) {
        return shell().mkdir(path, Boolean.TRUE.equals(createParents));
    }

    @Tool(
            name = "vfs_link",
            description = "为已有文件创建硬链接（同一文件系统内；引用计数 +1）。"
    )
    public EntryInfo link(
            @ToolParam(description = "已有文件路径") String existingPath,
            @ToolParam(description = "新链接路径") String newPath
    ) {
        return shell().link(existingPath, newPath);
    }

    @Tool(
            name = "vfs_remove",
            description = "删除条目；最后一个引用被删除时节点随之销毁。非空目录需 recursive=true；挂载点只卸载不递归。"
    )
    public RemoveResult remove(
            @ToolParam(description = "路径（以 / 开头，不能是根目录）") String path,
            @ToolParam(required = false, description = "是否递归删除非空目录（true/false）") Boolean recursive
    ) {
        RemoveResult result = shell().remove(path, Boolean.TRUE.equals(recursive));
        log.info("Removed {} (node removed: {})", result.path(), result.nodeRemoved());
        return result;
    }

    @Tool(
            name = "vfs_mount",
            description = "把一个具名文件系统挂载到指定路径（路径的末级名称必须尚不存在）。"
    )
    public EntryInfo mount(
            @ToolParam(description = "挂载点路径（以 / 开头）") String path,
            @ToolParam(description = "要挂载的文件系统名称（见 vfs_list_file_systems）") String fileSystem
    ) {
        EntryInfo entry = shell().mount(path, fileSystem);
        log.info("Mounted file system {} at {}", fileSystem, entry.path());
        return entry;
    }

    private ShellModuleApi shell() {
        return kernel.getModuleApi(ShellManager.NAME, ShellModuleApi.class);
    }

    private int resolveLimit(Integer limit) {
        // 目录列表的分页上限保护：避免一次性返回过多条目
        int resolved = (limit == null) ? properties.getListDefaultLimit() : limit;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getListMaxLimit());
    }

    private long resolveReadMaxBytes(Long maxBytes) {
        long limit = properties.getReadMaxBytes().toBytes();
        if (maxBytes == null) {
            return limit;
        }
        return Math.max(0, Math.min(maxBytes, limit));
    }

    private static byte[] decodeContent(String content, boolean base64) {
        if (content == null) {
            return new byte[0];
        }
        if (!base64) {
            return content.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("content 不是合法的 base64", e);
        }
    }

    private static boolean isValidUtf8(byte[] bytes) {
        // 严格校验 UTF-8：遇到非法序列直接判定为非文本，改用 base64 返回
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
