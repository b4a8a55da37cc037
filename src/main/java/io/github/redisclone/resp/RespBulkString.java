package io.github.redisclone.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;

import io.github.redisclone.RedisString;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * content为null时表示null bulk string，编码为$-1\r\n，和长度为0的bulk string不同。
 * 内部数组不对外暴露：{@link #with(byte[])}和{@link #getContent()}都复制。
 */
@EqualsAndHashCode
public class RespBulkString implements RespData {
    public static final char firstByte = '$';
    public static final int  MAX_LENGTH = RedisString.MAX_LENGTH;

    private static final RespBulkString NULL = new RespBulkString(null);
    private static final byte[]         CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    @Getter
    private final int    length;
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        Preconditions.checkNotNull(content, "use nullBulkString() for null content");
        return new RespBulkString(content.clone());
    }

    /**
     * 不复制，只给{@link RespParser}使用，数组之后不再被修改。
     */
    static RespBulkString wrap(byte[] content) {
        return new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return with(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString with(RedisString content) {
        return new RespBulkString(content.toByteArray());
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        if (content == null) {
            this.length = -1;
        } else {
            Preconditions.checkArgument(content.length <= MAX_LENGTH,
                    "bulk string length %s exceeds %s", content.length, MAX_LENGTH);
            this.length = content.length;
        }
        this.content = content;
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * @return 内容的副本，null bulk string返回null
     */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    public RedisString toRedisString() {
        Preconditions.checkState(content != null, "null bulk string");
        return RedisString.copyOf(content);
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstByte + String.valueOf(length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, CRLF);
    }

    @Override
    public String toString() {
        final int maxLen = 20;
        return "RespBulkString [length=" + length
                + (content != null
                ? ", content=" + Arrays.toString(Arrays.copyOf(content, Math.min(content.length, maxLen)))
                : "")
                + "]";
    }
}
