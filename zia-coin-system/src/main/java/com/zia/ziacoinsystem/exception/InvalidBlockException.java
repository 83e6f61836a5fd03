package com.zia.ziacoinsystem.exception;

/**
 * 区块校验失败：hash不一致、难度不满足、前序区块不存在、无法连接到链尾等
 */
public class InvalidBlockException extends Exception {

    /**
     * 构造一个空的InvalidBlockException
     */
    public InvalidBlockException() {
        super();
    }

    /**
     * 构造一个带有详细消息的InvalidBlockException
     * @param message 详细错误消息
     */
    public InvalidBlockException(String message) {
        super(message);
    }

    /**
     * 构造一个带有详细消息和原因的InvalidBlockException
     * @param message 详细错误消息
     * @param cause 导致此异常的原因
     */
    public InvalidBlockException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidBlockException(Throwable cause) {
        super(cause);
    }
}
