package io.github.redisclone.kv;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import com.google.common.base.Preconditions;

import io.github.redisclone.RedisString;
import io.github.redisclone.command.Command;
import io.github.redisclone.command.CommandResponse;
import io.github.redisclone.resp.RespArray;
import io.github.redisclone.resp.RespBulkString;
import io.github.redisclone.resp.RespData;
import io.github.redisclone.resp.RespSimpleString;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * kv处理引擎，单线程执行所有命令。
 * 所有连接的请求都进入同一个无界队列，引擎线程按入队顺序依次执行，执行结果通过{@link ResponseRouter}
 * 找到请求所属连接的{@link ResponseChannel}返回。
 * kv数据只有引擎线程访问，不需要加锁。
 * </p>
 * <p>
 * 引擎线程退出时关闭路由表里的所有channel，等待响应的连接会收到{@link EngineStoppedException}。
 * </p>
 *
 * @author zy
 */
public class KeyValueEngine implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueEngine.class);

    enum Status {
        init,
        started,
        stopped
    }

    private volatile Status status = Status.init;

    private final BlockingQueue<Request>        requests = new LinkedBlockingQueue<>();
    private final Map<RedisString, RedisString> store    = new HashMap<>();
    @Getter(AccessLevel.PACKAGE)
    private final ResponseRouter                router;
    private       Thread                        engineThread;

    @Builder
    KeyValueEngine(ResponseRouter router) {
        this.router = router == null ? new ResponseRouter() : router;
    }

    public synchronized void start() {
        Preconditions.checkState(status == Status.init, "kv engine is %s", status);
        status = Status.started;
        engineThread = new Thread(this, "kv-engine");
        engineThread.start();
        logger.info("kv engine started.");
    }

    public synchronized void shutdown() {
        if (status != Status.started) {
            status = Status.stopped;
            return;
        }
        status = Status.stopped;
        engineThread.interrupt();
    }

    public boolean isRunning() {
        return status == Status.started;
    }

    /**
     * 提交请求，不阻塞。
     *
     * @throws EngineStoppedException 引擎未启动或已经退出
     */
    public void submit(Request request) throws EngineStoppedException {
        if (status != Status.started) {
            throw new EngineStoppedException("kv engine is " + status);
        }
        requests.offer(request);
    }

    @Override
    public void run() {
        try {
            while (status == Status.started) {
                Request request = requests.take();
                CommandResponse response = process(request.getCommand());

                Optional<ResponseChannel> channel = router.lookup(request.getConnectionId());
                if (channel.isPresent()) {
                    channel.get().send(response);
                } else {
                    logger.warn("no response channel for connection {}, response dropped.",
                            request.getConnectionId());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Unknown exception in kv engine thread.", e);
        } finally {
            status = Status.stopped;
            router.closeAll();
            logger.info("kv engine stopped.");
        }
    }

    /**
     * 执行一个命令。只能在引擎线程中调用（或者引擎启动之前）。
     */
    CommandResponse process(Command command) {
        switch (command.getType()) {
            case PING:
                return CommandResponse.pong();
            case GET:
                Command.Get get = (Command.Get) command;
                return CommandResponse.bulkString(store.get(get.getKey()));
            case SET:
                Command.Set set = (Command.Set) command;
                store.put(set.getKey(), set.getValue());
                return CommandResponse.ok();
            case RAW:
                return CommandResponse.error("unknown command: " + commandName(((Command.Raw) command).getArray()));
            default:
                throw new IllegalStateException("unknown command type " + command.getType());
        }
    }

    private static String commandName(RespArray array) {
        if (array.isEmpty()) {
            return "(empty)";
        }
        RespData first = array.get(0);
        if (first instanceof RespBulkString && !((RespBulkString) first).isNull()) {
            return RedisString.wrap(((RespBulkString) first).getContent()).toString();
        }
        if (first instanceof RespSimpleString) {
            return RedisString.utf8(((RespSimpleString) first).getContent()).toString();
        }
        return first.toString();
    }
}
