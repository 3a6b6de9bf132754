package com.weixiao.ent.repo;

import com.weixiao.ent.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * 本地目录上的 BlobStore：root/objects/xx/yyyy...，键为内容的 SHA-1（40 字符 hex），内容 zlib 压缩。
 * 写入先落临时文件再原子移动，同一内容重复写入结果相同。
 */
public final class LocalBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    private static final String OBJECTS_DIR = "objects";
    private final Path objectsDir;

    /**
     * 以 root 为基准，字节块存放于 root/objects。
     */
    public LocalBlobStore(Path root) {
        this.objectsDir = root.toAbsolutePath().normalize().resolve(OBJECTS_DIR);
    }

    @Override
    public String put(byte[] data, int declaredSize) throws IOException {
        if (data == null || data.length != declaredSize) {
            throw new IllegalArgumentException("declared size " + declaredSize + " does not match data length "
                    + (data == null ? "null" : data.length));
        }
        String key = HexUtils.bytesToHex(sha1(data));
        Path blobPath = blobPath(key);
        Path dir = blobPath.getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path temp = dir.resolve("tmp_blob_" + System.nanoTime());
        try {
            Files.write(temp, deflate(data));
            Files.move(temp, blobPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("stored blob {} size={}", key, declaredSize);
        return key;
    }

    @Override
    public ByteBuffer get(String key) throws IOException {
        Path p = blobPath(key);
        if (!Files.exists(p)) {
            throw new IOException("blob not found: " + key);
        }
        byte[] data;
        try {
            data = inflate(Files.readAllBytes(p));
        } catch (ZipException e) {
            throw new IOException("corrupt blob: " + key, e);
        }
        log.debug("loaded blob {} size={}", key, data.length);
        return ByteBuffer.wrap(data).asReadOnlyBuffer();
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(blobPath(key));
    }

    /**
     * 根据 40 字符 hex 键得到 objects/xx/yyyy... 路径（前 2 字符为子目录）。
     */
    private Path blobPath(String key) {
        if (key == null || !key.matches("[0-9a-f]{40}")) {
            throw new IllegalArgumentException("invalid blob key: " + key);
        }
        return objectsDir.resolve(key.substring(0, 2)).resolve(key.substring(2));
    }

    private static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static byte[] deflate(byte[] input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream def = new DeflaterOutputStream(out)) {
            def.write(input);
        }
        return out.toByteArray();
    }

    private static byte[] inflate(byte[] input) throws IOException {
        try (InflaterInputStream inf = new InflaterInputStream(new ByteArrayInputStream(input));
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = inf.read(buf)) != -1) out.write(buf, 0, n);
            return out.toByteArray();
        }
    }
}
