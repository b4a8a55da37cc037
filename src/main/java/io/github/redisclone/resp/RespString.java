package io.github.redisclone.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String content;

    RespString(String content) {
        Preconditions.checkNotNull(content, "content");
        Preconditions.checkArgument(!content.contains("\r"), "resp simple string must not contain \\r");
        Preconditions.checkArgument(!content.contains("\n"), "resp simple string must not contain \\n");
        this.content = content;
    }

    abstract char getFirstByte();

    @Override
    public byte[] toBytes() {
        return (getFirstByte() + content + "\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
