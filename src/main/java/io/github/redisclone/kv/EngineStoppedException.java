package io.github.redisclone.kv;

/**
 * 引擎线程已经退出，请求不会再被处理。
 */
public class EngineStoppedException extends Exception {
    private static final long serialVersionUID = 5210748394460671937L;

    public EngineStoppedException(String message) {
        super(message);
    }
}
