package io.github.redisclone.command;

/**
 * 合法的RESP消息，但不是合法的命令或命令响应。
 */
public class CommandParseException extends Exception {
    private static final long serialVersionUID = -2387530468817711392L;

    public CommandParseException(String message) {
        super(message);
    }
}
