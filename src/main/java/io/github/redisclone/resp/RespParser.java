package io.github.redisclone.resp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;

/**
 * 从阻塞的{@link ReadableByteChannel}中逐个读取RESP消息。
 * <p>
 * 只有在一个新消息开始之前读到流结束，才算正常结束（返回{@link Optional#empty()}）；
 * 消息读到一半流结束、缺少CRLF、长度非法、类型字节未知等都抛出{@link RespDecodeException}。
 * 预读的字节留在内部缓冲区，下一次{@link #read()}继续使用，所以一个连接只能有一个parser。
 * </p>
 *
 * @author zy
 */
public class RespParser {
    static final int MAX_NESTING_DEPTH = 128;
    static final int MAX_LINE_LENGTH   = 64 * 1024;

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private final ReadableByteChannel channel;
    private final ByteBuffer          bb;

    public static RespParser create(ReadableByteChannel channel) {
        return new RespParser(channel, 5120);
    }

    public static RespParser create(ReadableByteChannel channel, int bufferCapacity) {
        return new RespParser(channel, bufferCapacity);
    }

    private RespParser(ReadableByteChannel channel, int bufferCapacity) {
        Preconditions.checkArgument(bufferCapacity > 0, "buffer capacity must be positive");
        this.channel = Preconditions.checkNotNull(channel, "channel");
        this.bb = ByteBuffer.allocate(bufferCapacity);
        bb.flip();
    }

    /**
     * 读取下一个完整消息。
     *
     * @return 消息；在消息边界上读到流结束时返回empty
     * @throws IOException         读channel失败
     * @throws RespDecodeException 字节流不是合法的RESP
     */
    public Optional<RespData> read() throws IOException, RespDecodeException {
        if (!readBytesIfNotHasRemaining()) {
            return Optional.empty();
        }
        return Optional.of(readData(0));
    }

    private RespData readData(int depth) throws IOException, RespDecodeException {
        byte[] line = readLine();
        if (line.length == 0) {
            throw new RespDecodeException("empty RESP header line");
        }

        switch (line[0]) {
            case RespSimpleString.firstByte:
                return RespSimpleString.withUTF8(readText(line));
            case RespError.firstByte:
                return RespError.withUTF8(readText(line));
            case RespBulkString.firstByte:
                return readBulkString(line);
            case RespArray.firstByte:
                return readArray(line, depth);
            default:
                throw new RespDecodeException(String.format("unknown RESP type byte 0x%02x", line[0] & 0xff));
        }
    }

    private String readText(byte[] line) throws RespDecodeException {
        for (int i = 1; i < line.length; i++) {
            if (line[i] == '\r') {
                throw new RespDecodeException("simple string must not contain CR");
            }
        }
        if (!Utf8.isWellFormed(line, 1, line.length - 1)) {
            throw new RespDecodeException("simple string is not valid UTF-8");
        }
        return new String(line, 1, line.length - 1, StandardCharsets.UTF_8);
    }

    private RespBulkString readBulkString(byte[] line) throws IOException, RespDecodeException {
        String s = headerValue(line);
        long len;
        try {
            len = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespDecodeException("invalid bulk string length '" + s + "'", e);
        }

        if (len == -1) {
            return RespBulkString.nullBulkString();
        }
        if (len < 0 || len > RespBulkString.MAX_LENGTH) {
            throw new RespDecodeException("invalid bulk string length " + len);
        }

        byte[] content = readContent((int) len);

        byte cr = readByte("bulk string terminator");
        byte lf = readByte("bulk string terminator");
        if (cr != '\r' || lf != '\n') {
            throw new RespDecodeException("bulk string must be terminated by CRLF");
        }
        return RespBulkString.wrap(content);
    }

    private RespArray readArray(byte[] line, int depth) throws IOException, RespDecodeException {
        String s = headerValue(line);
        if (s.isEmpty() || !DIGITS.matchesAllOf(s)) {
            throw new RespDecodeException("invalid array length '" + s + "'");
        }
        int len;
        try {
            len = Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new RespDecodeException("invalid array length '" + s + "'", e);
        }
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespDecodeException("array nesting deeper than " + MAX_NESTING_DEPTH);
        }

        if (len == 0) {
            return RespArray.empty();
        }

        // 长度来自客户端，不按它预分配
        List<RespData> datas = new ArrayList<>(Math.min(len, 16));
        for (int i = 0; i < len; i++) {
            if (!readBytesIfNotHasRemaining()) {
                throw new RespDecodeException("truncated array element " + i);
            }
            datas.add(readData(depth + 1));
        }
        return RespArray.with(datas);
    }

    private String headerValue(byte[] line) {
        return new String(line, 1, line.length - 1, StandardCharsets.US_ASCII);
    }

    /**
     * 读一行，行必须以CRLF结尾，返回值不含CRLF。行长度不超过{@link #MAX_LINE_LENGTH}（不含CRLF）。
     */
    private byte[] readLine() throws IOException, RespDecodeException {
        try (ByteArrayOutputStream os = new ByteArrayOutputStream()) {
            for (; ; ) {
                if (!readBytesIfNotHasRemaining()) {
                    throw new RespDecodeException("unexpected end of stream in RESP header");
                }
                byte b = bb.get();
                if (b == '\n') {
                    byte[] bytes = os.toByteArray();
                    if (bytes.length == 0 || bytes[bytes.length - 1] != '\r') {
                        throw new RespDecodeException("RESP header must be terminated by CRLF");
                    }
                    return Arrays.copyOf(bytes, bytes.length - 1);
                }
                if (os.size() > MAX_LINE_LENGTH) {
                    throw new RespDecodeException("RESP header line longer than " + MAX_LINE_LENGTH + " bytes");
                }
                os.write(b);
            }
        }
    }

    private byte readByte(String what) throws IOException, RespDecodeException {
        if (!readBytesIfNotHasRemaining()) {
            throw new RespDecodeException("unexpected end of stream in " + what);
        }
        return bb.get();
    }

    /**
     * 长度来自客户端，缓冲区随实际到达的字节增长，不按声明的长度预分配。
     */
    private byte[] readContent(int len) throws IOException, RespDecodeException {
        ByteArrayOutputStream os = new ByteArrayOutputStream(Math.min(len, bb.capacity()));
        int remaining = len;
        while (remaining > 0) {
            if (!readBytesIfNotHasRemaining()) {
                throw new RespDecodeException("truncated bulk string, expected " + len
                        + " bytes but got " + (len - remaining));
            }
            int n = Math.min(bb.remaining(), remaining);
            os.write(bb.array(), bb.arrayOffset() + bb.position(), n);
            bb.position(bb.position() + n);
            remaining -= n;
        }
        return os.toByteArray();
    }

    /**
     * @return false表示channel已经结束且缓冲区没有剩余数据
     */
    private boolean readBytesIfNotHasRemaining() throws IOException {
        if (bb.hasRemaining()) {
            return true;
        }

        bb.clear();
        int read;
        do {
            read = channel.read(bb);
        } while (read == 0);
        bb.flip();

        return read > 0;
    }
}
