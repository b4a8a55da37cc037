package io.github.redisclone.kv;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import io.github.redisclone.command.CommandResponse;

/**
 * 每个连接一个，引擎线程写入，{@link ClientHandler}读取。
 *
 * @author zy
 */
public class ResponseChannel {
    // 只按引用比较
    private static final CommandResponse CLOSED = CommandResponse.error("response channel closed");

    private final BlockingQueue<CommandResponse> responses = new LinkedBlockingQueue<>();

    void send(CommandResponse response) {
        responses.offer(response);
    }

    /**
     * 关闭以后，已经发送的响应仍然可以读到，之后的{@link #receive()}抛出{@link EngineStoppedException}。
     */
    void close() {
        responses.offer(CLOSED);
    }

    CommandResponse receive() throws InterruptedException, EngineStoppedException {
        CommandResponse response = responses.take();
        if (response == CLOSED) {
            responses.offer(CLOSED);
            throw new EngineStoppedException("kv engine stopped");
        }
        return response;
    }
}
