package io.github.redisclone;

import java.io.IOException;
import java.net.InetSocketAddress;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import io.github.redisclone.kv.KeyValueServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 启动kv服务，监听地址使用系统属性bind指定，例如：-Dbind=127.0.0.1:6379。
 */
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    static final String DEFAULT_BIND = "127.0.0.1:6379";

    public static void main(String[] args) throws Exception {
        String prop = System.getProperty("bind");
        InetSocketAddress bind = getInetSocketAddress(Strings.isNullOrEmpty(prop) ? DEFAULT_BIND : prop);

        KeyValueServer server = KeyValueServer.start(bind);
        logger.info("kv server started, address: {}", server.getLocalAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("kv server process exiting.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.warn("kv server shutdown failed.", e);
            }
        }));
    }

    public static InetSocketAddress getInetSocketAddress(String prop) {
        int i = prop.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < prop.length() - 1, "address must be host:port, got '%s'", prop);
        return new InetSocketAddress(prop.substring(0, i), Integer.parseInt(prop.substring(i + 1)));
    }
}
