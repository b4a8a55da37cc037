package io.github.redisclone.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    public static final char firstByte = '+';

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content);
    }

    public RespSimpleString(String content) {
        super(content);
    }

    @Override
    char getFirstByte() {
        return firstByte;
    }
}
