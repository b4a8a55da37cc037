package io.github.redisclone.resp;

import lombok.EqualsAndHashCode;

@EqualsAndHashCode(callSuper = true)
public class RespError extends RespString {
    public static final char firstByte = '-';

    public static RespError withUTF8(String msg) {
        return new RespError(msg);
    }

    public RespError(String content) {
        super(content);
    }

    @Override
    char getFirstByte() {
        return firstByte;
    }

    @Override
    public String toString() {
        return "RespError [" + (getContent() != null ? "getContent()=" + getContent() : "") + "]";
    }
}
