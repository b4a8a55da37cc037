package io.github.redisclone.client;

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
 * 客户端编解码：{@link Command} -> RESP数组，RESP -> {@link CommandResponse}。
 *
 * @author zy
 */
public class ClientCodec {

    public RespArray encodeCommand(Command command) {
        switch (command.getType()) {
            case PING:
                return RespArray.with(RespBulkString.withUTF8("PING"));
            case GET:
                Command.Get get = (Command.Get) command;
                return RespArray.with(RespBulkString.withUTF8("GET"), RespBulkString.with(get.getKey()));
            case SET:
                Command.Set set = (Command.Set) command;
                return RespArray.with(RespBulkString.withUTF8("SET"),
                        RespBulkString.with(set.getKey()),
                        RespBulkString.with(set.getValue()));
            case RAW:
                return ((Command.Raw) command).getArray();
            default:
                throw new IllegalStateException("unknown command type " + command.getType());
        }
    }

    public CommandResponse decodeResponse(RespData data) throws CommandParseException {
        if (data instanceof RespSimpleString) {
            String s = ((RespSimpleString) data).getContent();
            switch (s) {
                case "PONG":
                    return CommandResponse.pong();
                case "OK":
                    return CommandResponse.ok();
                default:
                    throw new CommandParseException("unknown simple string response: " + s);
            }
        }
        if (data instanceof RespError) {
            return CommandResponse.error(((RespError) data).getContent());
        }
        if (data instanceof RespBulkString) {
            RespBulkString bs = (RespBulkString) data;
            return bs.isNull()
                    ? CommandResponse.nullBulkString()
                    : CommandResponse.bulkString(RedisString.wrap(bs.getContent()));
        }
        throw new CommandParseException("unsupported response type: " + data.getClass().getSimpleName());
    }
}
