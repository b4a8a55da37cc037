package io.github.redisclone.resp;

/**
 * 字节流不符合RESP协议。和{@link java.io.IOException}不同，连接本身可能还是好的。
 */
public class RespDecodeException extends Exception {
    private static final long serialVersionUID = 4327120862051273194L;

    public RespDecodeException(String message) {
        super(message);
    }

    public RespDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
