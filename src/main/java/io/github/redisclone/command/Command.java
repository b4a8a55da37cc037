package io.github.redisclone.command;

import io.github.redisclone.RedisString;
import io.github.redisclone.resp.RespArray;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * 客户端请求的命令。服务端不认识的命令用{@link Raw}保存原始数组，由引擎回复错误。
 *
 * @author zy
 */
public abstract class Command {

    public enum Type {
        PING,
        GET,
        SET,
        RAW
    }

    Command() {
    }

    public abstract Type getType();

    public static Ping ping() {
        return Ping.INSTANCE;
    }

    public static Get get(RedisString key) {
        return new Get(key);
    }

    public static Set set(RedisString key, RedisString value) {
        return new Set(key, value);
    }

    public static Raw raw(RespArray array) {
        return new Raw(array);
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Ping extends Command {
        private static final Ping INSTANCE = new Ping();

        @Override
        public Type getType() {
            return Type.PING;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Get extends Command {
        @NonNull
        RedisString key;

        @Override
        public Type getType() {
            return Type.GET;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Set extends Command {
        @NonNull
        RedisString key;
        @NonNull
        RedisString value;

        @Override
        public Type getType() {
            return Type.SET;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Raw extends Command {
        @NonNull
        RespArray array;

        @Override
        public Type getType() {
            return Type.RAW;
        }
    }
}
