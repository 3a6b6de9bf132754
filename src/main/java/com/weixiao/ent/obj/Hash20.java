package com.weixiao.ent.obj;

import com.weixiao.ent.utils.HexUtils;

import java.util.Arrays;

/**
 * 固定 20 字节的内容校验和（SHA-1 长度）。全零值 {@link #ZERO} 在线上格式中表示“未知”。
 */
public final class Hash20 {

    public static final int RAW_SIZE = 20;

    public static final Hash20 ZERO = new Hash20(new byte[RAW_SIZE]);

    private final byte[] bytes;

    private Hash20(byte[] bytes) {
        this.bytes = bytes;
    }

    /** 由恰好 20 字节构造，拷贝输入。 */
    public static Hash20 of(byte[] raw) {
        if (raw == null || raw.length != RAW_SIZE) {
            throw new IllegalArgumentException("hash20 must be 20 bytes, got: "
                    + (raw == null ? "null" : raw.length));
        }
        return new Hash20(raw.clone());
    }

    /** 由 40 字符十六进制构造。 */
    public static Hash20 fromHex(String hex) {
        return of(HexUtils.hexToBytes(hex));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public String toHex() {
        return HexUtils.bytesToHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash20)) return false;
        return Arrays.equals(bytes, ((Hash20) o).bytes);
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
