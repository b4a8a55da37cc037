package io.github.redisclone;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.ArrayBasedCharEscaper;
import com.google.common.escape.Escaper;

/**
 * redis字符串，key和value都使用该类型。内容是任意字节，不要求是合法的UTF-8，可以包含\r、\n、\0。
 * equals和hashCode按字节比较。toString只用于日志和错误信息，不会出现在协议中。
 *
 * @author zy
 */
public final class RedisString {
    public static final int MAX_LENGTH = 512 * 1024 * 1024;

    // 其余控制字符（< 0x20和0x7f）输出为\xNN
    private static final Escaper ESCAPER = new ArrayBasedCharEscaper(ImmutableMap.<Character, String>builder()
            .put('"', "\\\"")
            .put('\\', "\\\\")
            .put('\r', "\\r")
            .put('\n', "\\n")
            .put('\t', "\\t")
            .put('\0', "\\0")
            .put('\u007f', "\\x7f")
            .build(), ' ', Character.MAX_VALUE) {
        @Override
        protected char[] escapeUnsafe(char c) {
            return String.format("\\x%02x", (int) c).toCharArray();
        }
    };

    private final byte[] bytes;

    private RedisString(byte[] bytes) {
        Preconditions.checkArgument(bytes.length <= MAX_LENGTH,
                "redis string length %s exceeds %s", bytes.length, MAX_LENGTH);
        this.bytes = bytes;
    }

    public static RedisString copyOf(byte[] bytes) {
        Preconditions.checkNotNull(bytes, "bytes");
        return new RedisString(bytes.clone());
    }

    /**
     * 不复制，调用方保证之后不再修改数组。
     */
    public static RedisString wrap(byte[] bytes) {
        Preconditions.checkNotNull(bytes, "bytes");
        return new RedisString(bytes);
    }

    public static RedisString utf8(String s) {
        Preconditions.checkNotNull(s, "s");
        return new RedisString(s.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RedisString)) {
            return false;
        }
        return Arrays.equals(bytes, ((RedisString) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    /**
     * 按UTF-8解释内容，非法序列替换为U+FFFD，控制字符转义，结果带双引号。
     */
    @Override
    public String toString() {
        return '"' + ESCAPER.escape(new String(bytes, StandardCharsets.UTF_8)) + '"';
    }
}
