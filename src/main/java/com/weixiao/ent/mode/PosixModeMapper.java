package com.weixiao.ent.mode;

import com.weixiao.ent.obj.TreeEntryType;

import java.util.Optional;

import static com.weixiao.ent.mode.FileModes.S_IFDIR;
import static com.weixiao.ent.mode.FileModes.S_IFLNK;
import static com.weixiao.ent.mode.FileModes.S_IFREG;
import static com.weixiao.ent.mode.FileModes.S_IXUSR;

/**
 * 支持原生符号链接的平台上的映射，四种类型可互逆。
 */
public final class PosixModeMapper implements ModeMapper {

    public static final PosixModeMapper INSTANCE = new PosixModeMapper();

    private PosixModeMapper() {
    }

    @Override
    public int modeFromType(TreeEntryType type) {
        return switch (type) {
            case TREE -> S_IFDIR | 0755;
            case REGULAR_FILE -> S_IFREG | 0644;
            case EXECUTABLE_FILE -> S_IFREG | 0755;
            case SYMLINK -> S_IFLNK | 0755;
        };
    }

    @Override
    public Optional<TreeEntryType> typeFromMode(int mode) {
        if (FileModes.isRegular(mode)) {
            return Optional.of((mode & S_IXUSR) != 0 ? TreeEntryType.EXECUTABLE_FILE : TreeEntryType.REGULAR_FILE);
        } else if (FileModes.isSymlink(mode)) {
            return Optional.of(TreeEntryType.SYMLINK);
        } else if (FileModes.isDirectory(mode)) {
            return Optional.of(TreeEntryType.TREE);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "posix";
    }
}
