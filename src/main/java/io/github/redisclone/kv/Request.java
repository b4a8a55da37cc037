package io.github.redisclone.kv;

import io.github.redisclone.command.Command;
import lombok.NonNull;
import lombok.Value;

/**
 * 提交给{@link KeyValueEngine}的请求，引擎用connectionId找到回复的{@link ResponseChannel}。
 */
@Value
public class Request {
    long    connectionId;
    @NonNull
    Command command;
}
