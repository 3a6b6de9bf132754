package com.weixiao.ent.command;

import com.weixiao.ent.EntTestUtil;
import com.weixiao.ent.EntTestUtil.ExecuteResult;
import com.weixiao.ent.utils.HexUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ent encode / decode 命令测试：十六进制输出、文件与 blob 存储往返、错误输入。
 */
@DisplayName("encode/decode 命令测试")
class EncodeDecodeCommandTest {

    private static final String MAIN_RS_HEX = "01" + "0200" + "0102" + "0700" + "6d61696e2e7273"
            + "ff".repeat(8) + "00".repeat(20);

    private static final String SHA1 = "2aae6c35c94fcfb415dbe95f408b9ce91ee846ed";

    @Test
    @DisplayName("encode 输出编码后的十六进制")
    void encode_printsHex() {
        ExecuteResult result = EntTestUtil.execute("encode", "--name", "main.rs", "--hash", "0102", "--type", "f");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput().trim()).isEqualTo(MAIN_RS_HEX);
    }

    @Test
    @DisplayName("decode --hex 打印日志格式、size 与 sha1")
    void decode_hex() {
        ExecuteResult result = EntTestUtil.execute("decode", "--hex", MAIN_RS_HEX);
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput()).contains("(main.rs, 0102, f)");
        assertThat(result.getOutput()).contains("size: unknown");
        assertThat(result.getOutput()).contains("sha1: unknown");
    }

    @Test
    @DisplayName("截断的输入 decode 失败并提示 malformed")
    void decode_truncated_fails() {
        String truncated = MAIN_RS_HEX.substring(0, MAIN_RS_HEX.length() - 2);
        ExecuteResult result = EntTestUtil.execute("decode", "--hex", truncated);
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("malformed tree entry");
    }

    @Test
    @DisplayName("encode --store 后 decode --store --key 还原 size 与 sha1")
    void storeRoundTrip(@TempDir Path dir) {
        ExecuteResult encoded = EntTestUtil.execute("-C", dir.toString(), "encode", "--name", "run.sh",
                "--hash", "cafe", "--type", "x", "--size", "18446744073709551614", "--sha1", SHA1, "--store", "db");
        assertThat(encoded.getExitCode()).isEqualTo(0);
        // 标准输出只有键本身，日志走标准错误
        assertThat(encoded.outputLines()).hasSize(1);
        String key = encoded.outputLines().get(0);
        assertThat(key).matches("[0-9a-f]{40}");
        assertThat(Files.isDirectory(dir.resolve("db").resolve("objects"))).isTrue();

        ExecuteResult decoded = EntTestUtil.execute("-C", dir.toString(), "decode", "--store", "db", "--key", key);
        assertThat(decoded.getExitCode()).isEqualTo(0);
        assertThat(decoded.outputLines()).containsExactly(
                "(run.sh, cafe, x)",
                "size: 18446744073709551614",
                "sha1: " + SHA1);
    }

    @Test
    @DisplayName("decode --file 读取文件中的编码")
    void decode_file(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("entry.bin"), HexUtils.hexToBytes(MAIN_RS_HEX));
        ExecuteResult result = EntTestUtil.execute("-C", dir.toString(), "decode", "--file", "entry.bin");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput()).contains("(main.rs, 0102, f)");
    }

    @Test
    @DisplayName("名字含 '/' 时 encode 失败")
    void encode_invalidName_fails() {
        ExecuteResult result = EntTestUtil.execute("encode", "--name", "a/b", "--hash", "01", "--type", "f");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("fatal:");
    }

    @Test
    @DisplayName("未知类型字符 encode 失败")
    void encode_unknownType_fails() {
        ExecuteResult result = EntTestUtil.execute("encode", "--name", "a", "--hash", "01", "--type", "q");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("unknown type");
    }

    @Test
    @DisplayName("保留的 size 值 encode 失败")
    void encode_reservedSize_fails() {
        ExecuteResult result = EntTestUtil.execute("encode", "--name", "a", "--hash", "01", "--type", "f",
                "--size", "18446744073709551615");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("reserved");
    }
}
