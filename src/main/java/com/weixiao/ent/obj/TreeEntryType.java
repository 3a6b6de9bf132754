package com.weixiao.ent.obj;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * 条目类型：目录、普通文件、可执行文件、符号链接。
 * 声明顺序即线上格式的类型标签（ordinal），不可调整顺序，只能在末尾追加。
 */
@Getter
@RequiredArgsConstructor
public enum TreeEntryType {

    TREE('d'),
    REGULAR_FILE('f'),
    EXECUTABLE_FILE('x'),
    SYMLINK('l');

    private static final TreeEntryType[] VALUES = values();

    /** 日志中使用的单字符表示。 */
    private final char logChar;

    /** 线上格式中的 1 字节类型标签。 */
    public int tag() {
        return ordinal();
    }

    /**
     * 按类型标签查找；越界标签返回空（视为数据损坏）。
     *
     * @param tag 0-255 的无符号标签
     */
    public static Optional<TreeEntryType> fromTag(int tag) {
        if (tag < 0 || tag >= VALUES.length) {
            return Optional.empty();
        }
        return Optional.of(VALUES[tag]);
    }

    /** 按日志字符（d/f/x/l）查找，供命令行解析 --type。 */
    public static Optional<TreeEntryType> fromLogChar(char c) {
        for (TreeEntryType t : VALUES) {
            if (t.logChar == c) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
