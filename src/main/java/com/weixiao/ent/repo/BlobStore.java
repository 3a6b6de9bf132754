package com.weixiao.ent.repo;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 存储层协作接口：保存与取回不透明字节块。编解码只负责产生与消费字节，何时持久化由调用方决定。
 */
public interface BlobStore {

    /**
     * 保存字节块，返回用于取回的键。
     *
     * @param data         待保存的字节
     * @param declaredSize 调用方声明的大小，必须等于 data.length
     */
    String put(byte[] data, int declaredSize) throws IOException;

    /**
     * 按键取回字节块，返回只读缓冲区，position 为 0。
     */
    ByteBuffer get(String key) throws IOException;

    /** 键对应的字节块是否存在。 */
    boolean exists(String key);
}
