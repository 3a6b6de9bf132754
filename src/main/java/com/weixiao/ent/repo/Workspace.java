package com.weixiao.ent.repo;

import com.weixiao.ent.mode.FileModes;
import com.weixiao.ent.mode.ModeMapper;
import com.weixiao.ent.obj.TreeEntryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Optional;
import java.util.Set;

/**
 * 工作区：读取路径的 POSIX mode 并按 {@link ModeMapper} 归类为条目类型。不跟随符号链接。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;
    private final ModeMapper mapper;

    /**
     * 以给定路径为工作区根目录，使用给定映射。
     */
    public Workspace(Path root, ModeMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    /**
     * 将路径归类为条目类型；设备、socket、FIFO 等返回空。相对路径按工作区根解析。
     */
    public Optional<TreeEntryType> classify(Path path) throws IOException {
        int mode = readMode(root.resolve(path));
        Optional<TreeEntryType> type = mapper.typeFromMode(mode);
        log.debug("classify {} mode={} -> {} ({})", path, FileModes.toOctal(mode), type.orElse(null), mapper);
        return type;
    }

    /**
     * 读取路径的 st_mode。
     * 优先使用 unix:mode 属性；不支持时（如 Windows）由文件类型与权限拼出等价的 mode。
     */
    public int readMode(Path filePath) throws IOException {
        try {
            Object mode = Files.getAttribute(filePath, "unix:mode", LinkOption.NOFOLLOW_LINKS);
            if (mode instanceof Number) {
                return ((Number) mode).intValue();
            }
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            log.debug("unix:mode not available for {}: {}", filePath, e.getMessage());
        }
        return synthesizeMode(filePath);
    }

    private int synthesizeMode(Path filePath) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(filePath, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isSymbolicLink()) {
            return FileModes.S_IFLNK | 0777;
        }
        if (attrs.isDirectory()) {
            return FileModes.S_IFDIR | 0755;
        }
        if (!attrs.isRegularFile()) {
            // 其他类型无法从 BasicFileAttributes 区分，只保留一个映射不到任何条目类型的类型位
            return FileModes.S_IFIFO;
        }
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(filePath, LinkOption.NOFOLLOW_LINKS);
            int owner = permissionToOctal(permissions, PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE);
            int group = permissionToOctal(permissions, PosixFilePermission.GROUP_READ,
                    PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE);
            int others = permissionToOctal(permissions, PosixFilePermission.OTHERS_READ,
                    PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE);
            return FileModes.S_IFREG | (owner << 6) | (group << 3) | others;
        } catch (UnsupportedOperationException e) {
            boolean executable = Files.isExecutable(filePath);
            log.debug("posix permissions not available for {}, executable={}", filePath, executable);
            return FileModes.S_IFREG | (executable ? 0755 : 0644);
        }
    }

    /**
     * 将 POSIX 权限转换为八进制数字（0-7）。
     */
    private static int permissionToOctal(Set<PosixFilePermission> permissions,
                                         PosixFilePermission read,
                                         PosixFilePermission write,
                                         PosixFilePermission execute) {
        int value = 0;
        if (permissions.contains(read)) value |= 4;
        if (permissions.contains(write)) value |= 2;
        if (permissions.contains(execute)) value |= 1;
        return value;
    }

    public Path getRoot() {
        return root;
    }

    public ModeMapper getMapper() {
        return mapper;
    }
}
