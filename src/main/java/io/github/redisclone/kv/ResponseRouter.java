package io.github.redisclone.kv;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * 连接id到{@link ResponseChannel}的路由表。锁内只做map操作，向channel发送都在锁外进行。
 *
 * @author zy
 */
public class ResponseRouter {
    private final Object                     lock     = new Object();
    private final Map<Long, ResponseChannel> channels = new HashMap<>();

    void register(long connectionId, ResponseChannel channel) {
        Preconditions.checkNotNull(channel, "channel");
        synchronized (lock) {
            Preconditions.checkState(!channels.containsKey(connectionId),
                    "connection id %s already registered", connectionId);
            channels.put(connectionId, channel);
        }
    }

    Optional<ResponseChannel> lookup(long connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(channels.get(connectionId));
        }
    }

    void remove(long connectionId) {
        synchronized (lock) {
            channels.remove(connectionId);
        }
    }

    int size() {
        synchronized (lock) {
            return channels.size();
        }
    }

    void closeAll() {
        List<ResponseChannel> all;
        synchronized (lock) {
            all = new ArrayList<>(channels.values());
        }
        for (ResponseChannel channel : all) {
            channel.close();
        }
    }
}
