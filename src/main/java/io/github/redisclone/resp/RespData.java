package io.github.redisclone.resp;

import java.nio.ByteBuffer;

/**
 * RESP消息，只有四种：{@link RespSimpleString}，{@link RespError}，{@link RespBulkString}，{@link RespArray}。
 *
 * @author zy
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
