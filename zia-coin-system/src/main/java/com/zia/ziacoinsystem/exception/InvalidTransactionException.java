package com.zia.ziacoinsystem.exception;

/**
 * 交易格式或内容不合法（缺少字段、金额非正、时间过期）
 */
public class InvalidTransactionException extends Exception {

    public InvalidTransactionException() {
        super();
    }

    public InvalidTransactionException(String message) {
        super(message);
    }

    public InvalidTransactionException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidTransactionException(Throwable cause) {
        super(cause);
    }
}
