package com.weixiao.ent.mode;

import com.weixiao.ent.obj.TreeEntryType;

import java.util.Optional;

/**
 * 条目类型与 POSIX mode 位之间的映射。
 * 两种实现：{@link PosixModeMapper}（支持原生符号链接）与 {@link NarrowedModeMapper}（符号链接按可执行文件处理），
 * 由 {@link SymlinkSupport} 选择。
 */
public interface ModeMapper {

    /** 类型 → mode 位，对所有类型都有定义。 */
    int modeFromType(TreeEntryType type);

    /** mode 位 → 类型；设备、socket、FIFO 等无法表示的类型返回空。 */
    Optional<TreeEntryType> typeFromMode(int mode);

    /** 按当前平台能力选择映射。 */
    static ModeMapper forPlatform() {
        return SymlinkSupport.detect().mapper();
    }
}
