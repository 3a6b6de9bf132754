package com.weixiao.ent.utils;

import lombok.experimental.UtilityClass;

/**
 * 十六进制与字节互转工具，用于 ObjectId、Hash20 以及命令行输入输出。
 */
@UtilityClass
public class HexUtils {

    /**
     * 将偶数长度的十六进制字符串转为字节数组，大小写均可。
     * 例："0102" → {0x01, 0x02}；"" → 空数组。
     *
     * @param hex 0-9a-fA-F 字符串
     * @return 字节数组，长度为 hex.length() / 2
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null || hex.length() % 2 != 0) {
            throw new IllegalArgumentException("hex must have an even number of chars, got: "
                    + (hex == null ? "null" : hex.length()));
        }
        byte[] b = new byte[hex.length() / 2];
        for (int i = 0; i < b.length; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("invalid hex at offset " + (i * 2) + ": " + hex);
            }
            b[i] = (byte) ((hi << 4) | lo);
        }
        return b;
    }

    /**
     * 将字节数组转为小写十六进制字符串。
     * 例：{0x01, 0x02} → "0102"。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }
}
