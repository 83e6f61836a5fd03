package com.zia.ziacoinsystem.exception;

/**
 * 从备份恢复区块链失败 节点不会再自动重试
 */
public class RecoveryFailedException extends Exception {

    public RecoveryFailedException() {
        super();
    }

    public RecoveryFailedException(String message) {
        super(message);
    }

    public RecoveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecoveryFailedException(Throwable cause) {
        super(cause);
    }
}
