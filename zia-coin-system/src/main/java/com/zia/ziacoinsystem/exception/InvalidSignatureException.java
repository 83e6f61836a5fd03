package com.zia.ziacoinsystem.exception;

/**
 * 交易签名无法通过发送方公钥验证时抛出
 */
public class InvalidSignatureException extends Exception {

    public InvalidSignatureException() {
        super();
    }

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidSignatureException(Throwable cause) {
        super(cause);
    }
}
