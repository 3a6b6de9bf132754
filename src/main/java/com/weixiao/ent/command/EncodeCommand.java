package com.weixiao.ent.command;

import com.weixiao.ent.Ent;
import com.weixiao.ent.codec.TreeEntryCodec;
import com.weixiao.ent.obj.Hash20;
import com.weixiao.ent.obj.ObjectId;
import com.weixiao.ent.obj.PathComponent;
import com.weixiao.ent.obj.TreeEntry;
import com.weixiao.ent.obj.TreeEntryType;
import com.weixiao.ent.repo.LocalBlobStore;
import com.weixiao.ent.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * ent encode - 由命令行参数构造一条 tree entry 并编码。
 * 默认输出编码后的十六进制；指定 --store 时写入本地 blob 存储并输出键。
 */
@Command(name = "encode", mixinStandardHelpOptions = true, description = "编码一条 tree entry")
public class EncodeCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(EncodeCommand.class);

    @ParentCommand
    private Ent ent;

    @Option(names = {"--name"}, required = true, paramLabel = "NAME", description = "条目名（单个路径分量）")
    private String name;

    @Option(names = {"--hash"}, required = true, paramLabel = "HEX", description = "内容哈希（十六进制）")
    private String hash;

    @Option(names = {"--type"}, required = true, paramLabel = "d|f|x|l",
            description = "类型：d=目录 f=普通文件 x=可执行文件 l=符号链接")
    private char type;

    @Option(names = {"--size"}, paramLabel = "BYTES", description = "内容大小（无符号 64 位），省略表示未知")
    private String size;

    @Option(names = {"--sha1"}, paramLabel = "HEX", description = "内容 SHA-1（40 字符 hex），省略表示未知")
    private String sha1;

    @Option(names = {"--store"}, paramLabel = "DIR", description = "写入该目录下的 blob 存储并输出键")
    private Path store;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        TreeEntry entry;
        try {
            entry = buildEntry();
        } catch (IllegalArgumentException e) {
            log.warn("encode rejected: {}", e.getMessage());
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
            return;
        }
        byte[] bytes = TreeEntryCodec.serialize(entry);
        log.debug("encoded {} into {} bytes", entry.toLogString(), bytes.length);

        if (store == null) {
            System.out.println(HexUtils.bytesToHex(bytes));
            return;
        }
        try {
            Path storeRoot = ent.resolve(store);
            String key = new LocalBlobStore(storeRoot).put(bytes, TreeEntryCodec.serializedSize(entry));
            log.info("stored {} as {} in {}", entry.toLogString(), key, storeRoot);
            System.out.println(key);
        } catch (IOException e) {
            log.error("encode failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    private TreeEntry buildEntry() {
        TreeEntryType entryType = TreeEntryType.fromLogChar(type)
                .orElseThrow(() -> new IllegalArgumentException("unknown type '" + type + "', expected d, f, x or l"));
        OptionalLong entrySize = OptionalLong.empty();
        if (size != null) {
            try {
                entrySize = OptionalLong.of(Long.parseUnsignedLong(size));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid size: " + size, e);
            }
        }
        Optional<Hash20> contentSha1 = sha1 != null ? Optional.of(Hash20.fromHex(sha1)) : Optional.empty();
        return new TreeEntry(PathComponent.of(name), ObjectId.fromHex(hash), entryType, entrySize, contentSha1);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
