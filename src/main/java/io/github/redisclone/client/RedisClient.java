package io.github.redisclone.client;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SocketChannel;
import java.util.Optional;

import io.github.redisclone.RedisString;
import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandParseException;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.resp.RespData;
import io.github.redisclone.resp.RespDecodeException;
import io.github.redisclone.resp.RespParser;
import io.github.redisclone.resp.RespWriter;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 阻塞客户端，一个实例对应一个连接，不是线程安全的。
 *
 * @author zy
 */
public class RedisClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(RedisClient.class);

    @Getter
    private final InetSocketAddress remote;
    private final SocketChannel     channel;
    private final RespParser        parser;
    private final RespWriter        writer;
    private final ClientCodec       codec = new ClientCodec();

    public static RedisClient connect(InetSocketAddress remote) throws IOException {
        return new RedisClient(remote, SocketChannel.open(remote));
    }

    private RedisClient(InetSocketAddress remote, SocketChannel channel) {
        this.remote = remote;
        this.channel = channel;
        this.parser = RespParser.create(channel);
        this.writer = RespWriter.with(channel);
    }

    /**
     * 发送命令并等待响应。服务端返回的错误作为{@link CommandResponse.Type#ERROR}响应返回，不抛异常。
     *
     * @throws IOException 网络错误、连接被关闭或者响应不合法
     */
    public CommandResponse execute(Command command) throws IOException {
        writer.write(codec.encodeCommand(command));
        try {
            Optional<RespData> resp = parser.read();
            if (!resp.isPresent()) {
                throw new EOFException("connection to " + remote + " closed by server");
            }
            return codec.decodeResponse(resp.get());
        } catch (RespDecodeException | CommandParseException e) {
            throw new IOException("invalid response from " + remote + ": " + e.getMessage(), e);
        }
    }

    public void ping() throws IOException {
        expect(execute(Command.ping()), CommandResponse.Type.PONG);
    }

    public Optional<RedisString> get(RedisString key) throws IOException {
        return expect(execute(Command.get(key)), CommandResponse.Type.BULK_STRING).getValue();
    }

    public void set(RedisString key, RedisString value) throws IOException {
        expect(execute(Command.set(key, value)), CommandResponse.Type.OK);
    }

    private CommandResponse expect(CommandResponse response, CommandResponse.Type type) {
        if (response.getType() == CommandResponse.Type.ERROR) {
            throw new IllegalStateException(response.getError());
        }
        if (response.getType() != type) {
            throw new IllegalStateException("expected " + type + " response but got " + response);
        }
        return response;
    }

    @Override
    public void close() throws IOException {
        logger.debug("closing connection to {}.", remote);
        channel.close();
    }
}
