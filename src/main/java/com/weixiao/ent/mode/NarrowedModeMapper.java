package com.weixiao.ent.mode;

import com.weixiao.ent.obj.TreeEntryType;

import java.util.Optional;

import static com.weixiao.ent.mode.FileModes.S_IFDIR;
import static com.weixiao.ent.mode.FileModes.S_IFREG;

/**
 * 无原生符号链接的平台（Windows）上的映射：符号链接报告为 0755 的普通文件，
 * 反向映射时普通文件一律为 REGULAR_FILE，可执行与符号链接无法从 mode 位恢复。
 * 这是永久性的收窄，与 Mercurial 的行为一致。
 */
public final class NarrowedModeMapper implements ModeMapper {

    public static final NarrowedModeMapper INSTANCE = new NarrowedModeMapper();

    private NarrowedModeMapper() {
    }

    @Override
    public int modeFromType(TreeEntryType type) {
        return switch (type) {
            case TREE -> S_IFDIR | 0755;
            case REGULAR_FILE -> S_IFREG | 0644;
            case EXECUTABLE_FILE, SYMLINK -> S_IFREG | 0755;
        };
    }

    @Override
    public Optional<TreeEntryType> typeFromMode(int mode) {
        if (FileModes.isRegular(mode)) {
            return Optional.of(TreeEntryType.REGULAR_FILE);
        } else if (FileModes.isDirectory(mode)) {
            return Optional.of(TreeEntryType.TREE);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "narrowed";
    }
}
