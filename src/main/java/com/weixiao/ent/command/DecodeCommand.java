package com.weixiao.ent.command;

import com.weixiao.ent.Ent;
import com.weixiao.ent.codec.TreeEntryCodec;
import com.weixiao.ent.obj.Hash20;
import com.weixiao.ent.obj.TreeEntry;
import com.weixiao.ent.repo.LocalBlobStore;
import com.weixiao.ent.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * ent decode - 解码一条 tree entry 并打印。输入三选一：--hex、--file、--store 与 --key。
 * <p>
 * 输出格式：
 * <pre>
 * (name, hash, t)
 * size: 123 | unknown
 * sha1: 40 位 hex | unknown
 * </pre>
 */
@Command(name = "decode", mixinStandardHelpOptions = true, description = "解码一条 tree entry")
public class DecodeCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DecodeCommand.class);

    @ParentCommand
    private Ent ent;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    static class Source {
        @Option(names = {"--hex"}, paramLabel = "HEX", description = "编码后的十六进制")
        String hex;

        @Option(names = {"--file"}, paramLabel = "PATH", description = "包含编码字节的文件")
        Path file;

        @ArgGroup(exclusive = false)
        StoreSource store;
    }

    static class StoreSource {
        @Option(names = {"--store"}, required = true, paramLabel = "DIR", description = "blob 存储目录")
        Path dir;

        @Option(names = {"--key"}, required = true, paramLabel = "KEY", description = "encode --store 输出的键")
        String key;
    }

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Optional<TreeEntry> entry;
        try {
            entry = TreeEntryCodec.deserialize(readInput());
        } catch (IllegalArgumentException | IOException e) {
            log.error("decode failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
            return;
        }
        if (entry.isEmpty()) {
            System.err.println("fatal: malformed tree entry");
            exitCode = 1;
            return;
        }
        TreeEntry e = entry.get();
        System.out.println(e.toLogString());
        System.out.println("size: " + (e.getSize().isPresent()
                ? Long.toUnsignedString(e.getSize().getAsLong()) : "unknown"));
        System.out.println("sha1: " + e.getContentSha1().map(Hash20::toHex).orElse("unknown"));
    }

    private ByteBuffer readInput() throws IOException {
        if (source.hex != null) {
            return ByteBuffer.wrap(HexUtils.hexToBytes(source.hex));
        }
        if (source.file != null) {
            Path file = ent.resolve(source.file);
            log.debug("decode file {}", file);
            return ByteBuffer.wrap(Files.readAllBytes(file));
        }
        Path dir = ent.resolve(source.store.dir);
        log.debug("decode blob {} from {}", source.store.key, dir);
        return new LocalBlobStore(dir).get(source.store.key);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
