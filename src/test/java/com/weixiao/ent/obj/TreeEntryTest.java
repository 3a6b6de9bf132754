package com.weixiao.ent.obj;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TreeEntry 测试")
class TreeEntryTest {

    private static final ObjectId HASH = ObjectId.fromHex("0102");
    private static final Hash20 SHA1 = Hash20.fromHex("da39a3ee5e6b4b0d3255bfef95601890afd80709");

    /**
     * 相等性只看 (hash, type, name)：size 与 contentSha1 不同的两条记录仍然相等，hashCode 也一致。
     */
    @Test
    @DisplayName("equals 忽略 size 与 contentSha1")
    void equals_ignoresMetadata() {
        TreeEntry bare = new TreeEntry(PathComponent.of("main.rs"), HASH, TreeEntryType.REGULAR_FILE);
        TreeEntry withMeta = bare.withSize(42).withContentSha1(SHA1);

        assertThat(withMeta).isEqualTo(bare);
        assertThat(withMeta.hashCode()).isEqualTo(bare.hashCode());
        assertThat(withMeta.getSize()).hasValue(42);
        assertThat(withMeta.getContentSha1()).contains(SHA1);
        assertThat(bare.getSize()).isEmpty();
    }

    @Test
    @DisplayName("hash、type、name 任一不同则不相等")
    void equals_identityFields() {
        TreeEntry base = new TreeEntry(PathComponent.of("a"), HASH, TreeEntryType.REGULAR_FILE);
        assertThat(new TreeEntry(PathComponent.of("b"), HASH, TreeEntryType.REGULAR_FILE)).isNotEqualTo(base);
        assertThat(new TreeEntry(PathComponent.of("a"), ObjectId.fromHex("0103"), TreeEntryType.REGULAR_FILE))
                .isNotEqualTo(base);
        assertThat(new TreeEntry(PathComponent.of("a"), HASH, TreeEntryType.EXECUTABLE_FILE)).isNotEqualTo(base);
    }

    @Test
    @DisplayName("size 为保留值 0xffffffffffffffff 时拒绝构造")
    void reservedSize_rejected() {
        assertThatThrownBy(() -> new TreeEntry(PathComponent.of("a"), HASH, TreeEntryType.TREE,
                OptionalLong.of(TreeEntry.NO_SIZE), Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    @DisplayName("全零 contentSha1 视为未知")
    void zeroSha1_normalizedToAbsent() {
        TreeEntry entry = new TreeEntry(PathComponent.of("a"), HASH, TreeEntryType.TREE,
                OptionalLong.empty(), Optional.of(Hash20.ZERO));
        assertThat(entry.getContentSha1()).isEmpty();
    }

    /**
     * 日志格式：(name, hash hex, 类型字符)。
     * 示例：main.rs / 0102 / REGULAR_FILE → "(main.rs, 0102, f)"。
     */
    @Test
    @DisplayName("toLogString 输出 name、hash 与类型字符")
    void toLogString_format() {
        assertThat(new TreeEntry(PathComponent.of("main.rs"), HASH, TreeEntryType.REGULAR_FILE).toLogString())
                .isEqualTo("(main.rs, 0102, f)");
        assertThat(new TreeEntry(PathComponent.of("src"), HASH, TreeEntryType.TREE).toLogString())
                .isEqualTo("(src, 0102, d)");
        assertThat(new TreeEntry(PathComponent.of("run.sh"), HASH, TreeEntryType.EXECUTABLE_FILE).toLogString())
                .isEqualTo("(run.sh, 0102, x)");
        assertThat(new TreeEntry(PathComponent.of("link"), HASH, TreeEntryType.SYMLINK).toLogString())
                .isEqualTo("(link, 0102, l)");
    }

    @Test
    @DisplayName("toString 以无符号形式显示大小")
    void toString_unsignedSize() {
        TreeEntry entry = new TreeEntry(PathComponent.of("big"), HASH, TreeEntryType.REGULAR_FILE).withSize(-2L);
        assertThat(entry.toString()).contains("size=18446744073709551614");
    }

    @Test
    @DisplayName("间接占用随名字长度增长并按 8 字节对齐")
    void indirectSize_followsName() {
        TreeEntry shortName = new TreeEntry(PathComponent.of("a"), HASH, TreeEntryType.REGULAR_FILE);
        TreeEntry longName = new TreeEntry(PathComponent.of("a".repeat(100)), HASH, TreeEntryType.REGULAR_FILE);
        assertThat(shortName.getIndirectSizeBytes()).isEqualTo(24);
        assertThat(longName.getIndirectSizeBytes()).isEqualTo(120);
        assertThat(longName.getIndirectSizeBytes() % 8).isZero();
    }
}
