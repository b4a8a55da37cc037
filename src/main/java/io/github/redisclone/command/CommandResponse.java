package io.github.redisclone.command;

import java.util.Optional;

import com.google.common.base.Preconditions;

import io.github.redisclone.RedisString;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 命令的执行结果，只有四种：PONG，OK，错误信息，bulk string（可以为null）。
 *
 * @author zy
 */
@EqualsAndHashCode
@ToString
public final class CommandResponse {

    public enum Type {
        PONG,
        OK,
        ERROR,
        BULK_STRING
    }

    private static final CommandResponse PONG = new CommandResponse(Type.PONG, null, null);
    private static final CommandResponse OK   = new CommandResponse(Type.OK, null, null);

    @Getter
    private final Type        type;
    @Getter(AccessLevel.NONE)
    private final String      error;
    @Getter(AccessLevel.NONE)
    private final RedisString value;

    private CommandResponse(Type type, String error, RedisString value) {
        this.type = type;
        this.error = error;
        this.value = value;
    }

    public static CommandResponse pong() {
        return PONG;
    }

    public static CommandResponse ok() {
        return OK;
    }

    public static CommandResponse error(String message) {
        Preconditions.checkNotNull(message, "message");
        return new CommandResponse(Type.ERROR, message, null);
    }

    /**
     * @param value null表示key不存在
     */
    public static CommandResponse bulkString(RedisString value) {
        return new CommandResponse(Type.BULK_STRING, null, value);
    }

    public static CommandResponse nullBulkString() {
        return bulkString(null);
    }

    public String getError() {
        Preconditions.checkState(type == Type.ERROR, "not an error response: %s", type);
        return error;
    }

    public Optional<RedisString> getValue() {
        Preconditions.checkState(type == Type.BULK_STRING, "not a bulk string response: %s", type);
        return Optional.ofNullable(value);
    }
}
