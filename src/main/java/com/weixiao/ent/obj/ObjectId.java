package com.weixiao.ent.obj;

import com.weixiao.ent.utils.HexUtils;

import java.util.Arrays;

/**
 * 内容寻址标识：变长字节串，由外部哈希算法产生，本类不关心算法。
 * 长度 0-65535 字节。
 */
public final class ObjectId {

    public static final int MAX_LENGTH = 0xFFFF;

    private final byte[] bytes;

    private ObjectId(byte[] bytes) {
        this.bytes = bytes;
    }

    /** 由原始字节构造，拷贝输入。 */
    public static ObjectId of(byte[] raw) {
        if (raw == null) {
            throw new IllegalArgumentException("object id must not be null");
        }
        if (raw.length > MAX_LENGTH) {
            throw new IllegalArgumentException("object id too long: " + raw.length + " bytes");
        }
        return new ObjectId(raw.clone());
    }

    /** 由十六进制字符串构造，如 "0102"。 */
    public static ObjectId fromHex(String hex) {
        return of(HexUtils.hexToBytes(hex));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public String toHex() {
        return HexUtils.bytesToHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectId)) return false;
        return Arrays.equals(bytes, ((ObjectId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
