package com.weixiao.ent.obj;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 目录中的一条记录：名字 + 内容哈希 + 类型，外加可选的大小与内容 SHA-1。
 * 不可变；相等性只看 (hash, type, name)，size 与 contentSha1 是元数据。
 */
@Getter
public final class TreeEntry {

    /** 线上格式中表示“大小未知”的保留值（64 位全 1）。 */
    public static final long NO_SIZE = 0xFFFFFFFFFFFFFFFFL;

    private final PathComponent name;
    private final ObjectId hash;
    private final TreeEntryType type;
    /** 无符号 64 位字节数；为空表示尚未计算。 */
    private final OptionalLong size;
    private final Optional<Hash20> contentSha1;

    /**
     * 构造条目。size 不能等于 {@link #NO_SIZE}；contentSha1 为全零时视为未知。
     */
    public TreeEntry(PathComponent name, ObjectId hash, TreeEntryType type,
                     OptionalLong size, Optional<Hash20> contentSha1) {
        this.name = Objects.requireNonNull(name, "name");
        this.hash = Objects.requireNonNull(hash, "hash");
        this.type = Objects.requireNonNull(type, "type");
        this.size = Objects.requireNonNull(size, "size");
        if (size.isPresent() && size.getAsLong() == NO_SIZE) {
            throw new IllegalArgumentException("size 0xffffffffffffffff is reserved for unknown size");
        }
        Objects.requireNonNull(contentSha1, "contentSha1");
        this.contentSha1 = contentSha1.filter(h -> !h.isZero());
    }

    /** 构造不带大小与校验和的条目。 */
    public TreeEntry(PathComponent name, ObjectId hash, TreeEntryType type) {
        this(name, hash, type, OptionalLong.empty(), Optional.empty());
    }

    /** 返回替换了大小的新条目。 */
    public TreeEntry withSize(long newSize) {
        return new TreeEntry(name, hash, type, OptionalLong.of(newSize), contentSha1);
    }

    /** 返回替换了内容 SHA-1 的新条目。 */
    public TreeEntry withContentSha1(Hash20 sha1) {
        return new TreeEntry(name, hash, type, size, Optional.ofNullable(sha1));
    }

    /** 名字在堆上的间接占用，供内存统计使用。 */
    public long getIndirectSizeBytes() {
        return name.estimateIndirectMemoryUsage();
    }

    /**
     * 日志用格式：(name, hash, 类型字符)，如 "(main.rs, 0102, f)"。不参与序列化。
     */
    public String toLogString() {
        return "(" + name.asString() + ", " + hash.toHex() + ", " + type.getLogChar() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeEntry)) return false;
        TreeEntry other = (TreeEntry) o;
        return hash.equals(other.hash) && type == other.type && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, type, name);
    }

    @Override
    public String toString() {
        return "TreeEntry{name=" + name.asString()
                + ", hash=" + hash.toHex()
                + ", type=" + type
                + ", size=" + (size.isPresent() ? Long.toUnsignedString(size.getAsLong()) : "unknown")
                + ", contentSha1=" + contentSha1.map(Hash20::toHex).orElse("unknown")
                + "}";
    }
}
