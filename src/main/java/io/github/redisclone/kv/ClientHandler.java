package io.github.redisclone.kv;

import java.io.IOException;
import java.nio.channels.ByteChannel;
import java.util.Optional;

import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandParseException;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.resp.RespData;
import io.github.redisclone.resp.RespDecodeException;
import io.github.redisclone.resp.RespParser;
import io.github.redisclone.resp.RespWriter;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一个连接一个handler，在独立线程中阻塞读写。
 * 读一个请求，交给{@link KeyValueEngine}，等到响应写回客户端以后才读下一个请求，所以同一连接上的响应和请求顺序一致。
 *
 * @author zy
 */
class ClientHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientHandler.class);

    @Getter(AccessLevel.PACKAGE)
    private final long            connectionId;
    private final ByteChannel     channel;
    private final KeyValueEngine  engine;
    private final ResponseChannel responses;
    private final RespParser      parser;
    private final RespWriter      writer;
    private final ServerCodec     codec = new ServerCodec();

    ClientHandler(long connectionId, ByteChannel channel, KeyValueEngine engine, ResponseChannel responses) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.engine = engine;
        this.responses = responses;
        this.parser = RespParser.create(channel);
        this.writer = RespWriter.with(channel);
    }

    @Override
    public void run() {
        try {
            serve();
        } catch (IOException e) {
            logger.warn("connection {} I/O failure, closing.", connectionId, e);
        } catch (EngineStoppedException e) {
            logger.info("connection {} closing: {}", connectionId, e.getMessage());
        } catch (InterruptedException e) {
            logger.info("connection {} interrupted, closing.", connectionId);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Unknown exception in connection {}, closing.", connectionId, e);
        } finally {
            engine.getRouter().remove(connectionId);
            close();
        }
    }

    private void serve() throws IOException, EngineStoppedException, InterruptedException {
        for (; ; ) {
            Optional<RespData> request;
            try {
                request = parser.read();
            } catch (RespDecodeException e) {
                // 无法确定下一个消息从哪里开始，回复错误后关闭连接
                logger.warn("connection {} protocol error: {}", connectionId, e.getMessage());
                writer.write(codec.encodeError("ERR Protocol error: " + e.getMessage()));
                return;
            }

            if (!request.isPresent()) {
                logger.debug("connection {} closed by client.", connectionId);
                return;
            }

            CommandResponse response;
            try {
                Command command = codec.decodeCommand(request.get());
                engine.submit(new Request(connectionId, command));
                response = responses.receive();
            } catch (CommandParseException e) {
                response = CommandResponse.error(e.getMessage());
            }
            writer.write(codec.encodeResponse(response));
        }
    }

    private void close() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("close connection {} failed.", connectionId, e);
        }
    }
}
