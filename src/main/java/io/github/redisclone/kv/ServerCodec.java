package io.github.redisclone.kv;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;

import io.github.redisclone.RedisString;
import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandParseException;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.resp.RespArray;
import io.github.redisclone.resp.RespBulkString;
import io.github.redisclone.resp.RespData;
import io.github.redisclone.resp.RespError;
import io.github.redisclone.resp.RespSimpleString;

/**
 * 服务端编解码：RESP数组 -> {@link Command}，{@link CommandResponse} -> RESP。
 *
 * @author zy
 */
public class ServerCodec {
    private static final CharMatcher LINE_BREAKS = CharMatcher.anyOf("\r\n");

    public Command decodeCommand(RespData data) throws CommandParseException {
        if (!(data instanceof RespArray)) {
            throw new CommandParseException("ERR command must be an array, got " + data.getClass().getSimpleName());
        }
        RespArray a = (RespArray) data;
        if (a.isEmpty()) {
            throw new CommandParseException("ERR command must not be an empty array");
        }

        String name = commandName(a.get(0));
        switch (Ascii.toUpperCase(name)) {
            case "PING":
                checkArity(a, 0, "ping");
                return Command.ping();
            case "GET":
                checkArity(a, 1, "get");
                return Command.get(argument(a, 1, "get", "key"));
            case "SET":
                checkArity(a, 2, "set");
                return Command.set(argument(a, 1, "set", "key"), argument(a, 2, "set", "value"));
            default:
                return Command.raw(a);
        }
    }

    public RespData encodeResponse(CommandResponse response) {
        switch (response.getType()) {
            case PONG:
                return RespSimpleString.withUTF8("PONG");
            case OK:
                return RespSimpleString.withUTF8("OK");
            case ERROR:
                return encodeError(response.getError());
            case BULK_STRING:
                return response.getValue()
                        .map(RespBulkString::with)
                        .orElse(RespBulkString.nullBulkString());
            default:
                throw new IllegalStateException("unknown response type " + response.getType());
        }
    }

    /**
     * RESP错误不能包含CR、LF，替换成空格。
     */
    public RespError encodeError(String message) {
        return RespError.withUTF8(LINE_BREAKS.replaceFrom(message, ' '));
    }

    private String commandName(RespData first) throws CommandParseException {
        if (first instanceof RespSimpleString) {
            return ((RespSimpleString) first).getContent();
        }
        if (first instanceof RespBulkString && !((RespBulkString) first).isNull()) {
            return new String(((RespBulkString) first).getContent(), StandardCharsets.UTF_8);
        }
        throw new CommandParseException("ERR command name must be a bulk or simple string");
    }

    private void checkArity(RespArray a, int expected, String name) throws CommandParseException {
        if (a.size() - 1 != expected) {
            throw new CommandParseException("ERR wrong number of arguments for '" + name + "' command, expected "
                    + expected + " but got " + (a.size() - 1));
        }
    }

    private RedisString argument(RespArray a, int i, String name, String field) throws CommandParseException {
        RespData data = a.get(i);
        if (!(data instanceof RespBulkString) || ((RespBulkString) data).isNull()) {
            throw new CommandParseException("ERR '" + name + "' " + field + " must be a non-null bulk string");
        }
        return RedisString.wrap(((RespBulkString) data).getContent());
    }
}
