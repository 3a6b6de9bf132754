package com.weixiao.ent.obj;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 路径中的单个分量（不含分隔符），以原始字节保存。
 * 长度上限 65535 字节（线上格式用 2 字节无符号数记录长度）。
 */
public final class PathComponent {

    public static final int MAX_LENGTH = 0xFFFF;

    /** JVM 上 byte[] 的对象头大小（压缩指针），用于估算堆占用。 */
    private static final int ARRAY_HEADER_BYTES = 16;

    private final byte[] bytes;

    private PathComponent(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 由原始字节构造，拷贝输入。
     * 拒绝：含 '/' 或 NUL、"." 与 ".."、超过 65535 字节。
     */
    public static PathComponent of(byte[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("path component must not be null");
        }
        if (raw.length > MAX_LENGTH) {
            throw new IllegalArgumentException("path component too long: " + raw.length + " bytes");
        }
        for (byte b : raw) {
            if (b == '/' || b == 0) {
                throw new IllegalArgumentException("path component must not contain '/' or NUL");
            }
        }
        if ((raw.length == 1 && raw[0] == '.') || (raw.length == 2 && raw[0] == '.' && raw[1] == '.')) {
            throw new IllegalArgumentException("path component must not be '.' or '..'");
        }
        return new PathComponent(raw.clone());
    }

    /** 由字符串构造，按 UTF-8 编码。 */
    public static PathComponent of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("path component must not be null");
        }
        return of(name.getBytes(StandardCharsets.UTF_8));
    }

    /** 返回字节拷贝。 */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /** 字节长度。 */
    public int length() {
        return bytes.length;
    }

    /** 按 UTF-8 解码为字符串（非法序列以替换字符显示）。 */
    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 估算名字存储在堆上的间接占用：数组头 + 数据，按 8 字节对齐。
     */
    public long estimateIndirectMemoryUsage() {
        long raw = ARRAY_HEADER_BYTES + (long) bytes.length;
        return (raw + 7) & ~7L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathComponent)) return false;
        return Arrays.equals(bytes, ((PathComponent) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return asString();
    }
}
