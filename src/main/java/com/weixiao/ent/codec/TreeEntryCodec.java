package com.weixiao.ent.codec;

import com.weixiao.ent.obj.Hash20;
import com.weixiao.ent.obj.ObjectId;
import com.weixiao.ent.obj.PathComponent;
import com.weixiao.ent.obj.TreeEntry;
import com.weixiao.ent.obj.TreeEntryType;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * TreeEntry 的二进制编解码。
 * <p>
 * 格式（多字节整数一律小端序）：
 * <pre>
 *   type      u8
 *   hashLen   u16
 *   hash      hashLen 字节
 *   nameLen   u16
 *   name      nameLen 字节（不以 NUL 结尾）
 *   size      u64，全 1 表示未知
 *   sha1      20 字节，全 0 表示未知
 * </pre>
 * 已持久化的数据依赖此布局，不可更改。
 */
@UtilityClass
public class TreeEntryCodec {

    private static final Logger log = LoggerFactory.getLogger(TreeEntryCodec.class);

    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private static final int TYPE_SIZE = 1;
    private static final int LENGTH_SIZE = 2;
    private static final int SIZE_FIELD_SIZE = 8;
    private static final int MAX_LENGTH = 0xFFFF;

    /**
     * serialize 将写出的字节数，用于预分配缓冲区。
     */
    public static int serializedSize(TreeEntry entry) {
        return TYPE_SIZE + LENGTH_SIZE + entry.getHash().size() + LENGTH_SIZE
                + entry.getName().length() + SIZE_FIELD_SIZE + Hash20.RAW_SIZE;
    }

    /**
     * 序列化为新分配的字节数组，长度恰为 {@link #serializedSize(TreeEntry)}。
     */
    public static byte[] serialize(TreeEntry entry) {
        byte[] out = new byte[serializedSize(entry)];
        serialize(entry, ByteBuffer.wrap(out));
        return out;
    }

    /**
     * 将条目追加写入 out 的当前位置。out 剩余空间不足或长度超出 u16 时抛 IllegalArgumentException，
     * 此时 out 未被写入。不改变 out 自身的字节序设置。
     */
    public static void serialize(TreeEntry entry, ByteBuffer out) {
        int needed = serializedSize(entry);
        if (out.remaining() < needed) {
            throw new IllegalArgumentException("output buffer too small: remaining "
                    + out.remaining() + " need " + needed);
        }
        byte[] hash = entry.getHash().getBytes();
        checkLength("hash", hash.length);
        byte[] name = entry.getName().getBytes();
        checkLength("name", name.length);

        ByteOrder original = out.order();
        out.order(BYTE_ORDER);
        try {
            out.put((byte) entry.getType().tag());
            out.putShort((short) hash.length);
            out.put(hash);
            out.putShort((short) name.length);
            out.put(name);
            out.putLong(entry.getSize().orElse(TreeEntry.NO_SIZE));
            out.put(entry.getContentSha1().orElse(Hash20.ZERO).getBytes());
        } finally {
            out.order(original);
        }
    }

    /**
     * 反序列化字节数组开头的一条记录；多余的尾部字节被忽略。
     */
    public static Optional<TreeEntry> deserialize(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data);
        Optional<TreeEntry> entry = deserialize(buf);
        if (entry.isPresent() && buf.hasRemaining()) {
            log.debug("ignoring {} trailing bytes after tree entry", buf.remaining());
        }
        return entry;
    }

    /**
     * 从 in 的当前位置读取一条记录。
     * <p>
     * 按 type、hash 长度、hash、name 长度、name、size、sha1 的顺序逐字段检查剩余字节，
     * 任一字段不足即记录错误日志并返回空；未知类型标签与非法名字同样返回空。
     * 失败时 in 的 position 恢复到调用前；成功时停在该记录之后，可连续读取。
     */
    public static Optional<TreeEntry> deserialize(ByteBuffer in) {
        int start = in.position();
        ByteOrder original = in.order();
        in.order(BYTE_ORDER);
        try {
            Optional<TreeEntry> entry = readEntry(in);
            if (entry.isEmpty()) {
                in.position(start);
            }
            return entry;
        } finally {
            in.order(original);
        }
    }

    private static Optional<TreeEntry> readEntry(ByteBuffer in) {
        if (in.remaining() < TYPE_SIZE) {
            log.error("Can not read tree entry type, bytes remaining {} need {}", in.remaining(), TYPE_SIZE);
            return Optional.empty();
        }
        int tag = in.get() & 0xFF;
        Optional<TreeEntryType> type = TreeEntryType.fromTag(tag);
        if (type.isEmpty()) {
            log.error("Invalid tree entry type tag {}", tag);
            return Optional.empty();
        }

        if (in.remaining() < LENGTH_SIZE) {
            log.error("Can not read tree entry hash size, bytes remaining {} need {}", in.remaining(), LENGTH_SIZE);
            return Optional.empty();
        }
        int hashSize = in.getShort() & 0xFFFF;

        if (in.remaining() < hashSize) {
            log.error("Can not read tree entry hash, bytes remaining {} need {}", in.remaining(), hashSize);
            return Optional.empty();
        }
        byte[] hashBytes = new byte[hashSize];
        in.get(hashBytes);

        if (in.remaining() < LENGTH_SIZE) {
            log.error("Can not read tree entry name size, bytes remaining {} need {}", in.remaining(), LENGTH_SIZE);
            return Optional.empty();
        }
        int nameSize = in.getShort() & 0xFFFF;

        if (in.remaining() < nameSize) {
            log.error("Can not read tree entry name, bytes remaining {} need {}", in.remaining(), nameSize);
            return Optional.empty();
        }
        byte[] nameBytes = new byte[nameSize];
        in.get(nameBytes);

        if (in.remaining() < SIZE_FIELD_SIZE) {
            log.error("Can not read tree entry size, bytes remaining {} need {}",
                    in.remaining(), SIZE_FIELD_SIZE);
            return Optional.empty();
        }
        long rawSize = in.getLong();
        OptionalLong size = rawSize == TreeEntry.NO_SIZE ? OptionalLong.empty() : OptionalLong.of(rawSize);

        if (in.remaining() < Hash20.RAW_SIZE) {
            log.error("Can not read tree entry sha1, bytes remaining {} need {}",
                    in.remaining(), Hash20.RAW_SIZE);
            return Optional.empty();
        }
        byte[] sha1Bytes = new byte[Hash20.RAW_SIZE];
        in.get(sha1Bytes);
        Hash20 sha1 = Hash20.of(sha1Bytes);

        PathComponent name;
        try {
            name = PathComponent.of(nameBytes);
        } catch (IllegalArgumentException e) {
            log.error("Invalid tree entry name: {}", e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new TreeEntry(name, ObjectId.of(hashBytes), type.get(), size,
                sha1.isZero() ? Optional.empty() : Optional.of(sha1)));
    }

    private static void checkLength(String field, int length) {
        if (length > MAX_LENGTH) {
            throw new IllegalArgumentException(field + " too long for tree entry: " + length + " bytes");
        }
    }
}
