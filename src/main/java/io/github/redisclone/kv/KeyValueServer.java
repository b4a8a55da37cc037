package io.github.redisclone.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用阻塞的{@link ServerSocketChannel}监听指定端口，每个连接分配一个递增的连接id，
 * 在{@link ResponseRouter}中注册该连接的{@link ResponseChannel}以后，才在线程池中启动{@link ClientHandler}，
 * 保证引擎处理该连接的请求时路由已经存在。
 *
 * @author zy
 */
public class KeyValueServer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    enum Status {
        init,
        started,
        stopped
    }

    private volatile Status status = Status.init;

    // 配置的服务地址
    private final    InetSocketAddress   socketAddress;
    // 实际绑定的地址，端口为0时由系统分配
    @Getter
    private volatile InetSocketAddress   localAddress;
    private final    KeyValueEngine      engine;
    // 每个连接占用一个线程
    private final    ExecutorService     executorService;
    private          ServerSocketChannel ssc;
    private          Thread              acceptorThread;
    // 只在acceptor线程中访问
    private          long                nextConnectionId = 0;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueEngine keyValueEngine,
                          ExecutorService executorService) {
        this.socketAddress = socketAddress;
        this.engine = keyValueEngine;
        this.executorService = executorService != null ? executorService : Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("kv-client-%d").setDaemon(true).build());
    }

    /**
     * 创建并启动引擎和服务。
     *
     * @param address 监听地址
     * @return 已经启动的服务
     * @throws IOException 绑定地址失败
     */
    public static KeyValueServer start(InetSocketAddress address) throws IOException {
        KeyValueEngine engine = KeyValueEngine.builder().build();
        engine.start();
        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(address)
                .keyValueEngine(engine)
                .build();
        try {
            server.start();
        } catch (IOException e) {
            engine.shutdown();
            throw e;
        }
        return server;
    }

    /**
     * 绑定地址并启动accept线程。
     *
     * @throws IOException 绑定失败
     */
    public synchronized void start() throws IOException {
        Preconditions.checkState(status == Status.init, "kv server is %s", status);
        Preconditions.checkState(engine.isRunning(), "kv engine must be started before kv server");

        ssc = ServerSocketChannel.open();
        try {
            ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            ssc.bind(socketAddress);
            ssc.configureBlocking(true);
            localAddress = (InetSocketAddress) ssc.getLocalAddress();
        } catch (IOException e) {
            ssc.close();
            status = Status.stopped;
            throw e;
        }

        status = Status.started;
        acceptorThread = new Thread(this, "kv-acceptor");
        acceptorThread.start();
        logger.info("kv server listening on {}.", localAddress);
    }

    @Override
    public void run() {
        try {
            while (status == Status.started) {
                SocketChannel cc = ssc.accept();
                dispatch(cc);
            }
        } catch (IOException e) {
            if (status == Status.started) {
                logger.error("kv server accept failed, shutting down.", e);
            }
        } finally {
            try {
                shutdown();
            } catch (IOException e) {
                logger.warn("kv server shutdown failed.", e);
            }
        }
    }

    private void dispatch(SocketChannel cc) throws IOException {
        long id = nextConnectionId++;
        ResponseChannel responses = new ResponseChannel();
        engine.getRouter().register(id, responses);
        logger.debug("accepted connection {} from {}.", id, cc.getRemoteAddress());

        try {
            executorService.submit(new ClientHandler(id, cc, engine, responses));
        } catch (RejectedExecutionException e) {
            logger.warn("connection {} rejected, kv server is {}.", id, status);
            engine.getRouter().remove(id);
            cc.close();
        }
    }

    /**
     * 关闭监听、所有连接和引擎，不等待处理中的请求。
     *
     * @throws IOException 关闭监听socket失败
     */
    public synchronized void shutdown() throws IOException {
        if (status != Status.started) {
            status = Status.stopped;
            return;
        }
        status = Status.stopped;
        try {
            ssc.close();
        } finally {
            executorService.shutdownNow();
            engine.shutdown();
            logger.info("kv server on {} shut down.", localAddress);
        }
    }

    public boolean isRunning() {
        return status == Status.started;
    }
}
