package com.zia.ziacoinsystem.service.transaction;

import com.zia.ziacoinsystem.data.transaction.Transaction;

/**
 * 交易签名验证
 */
@FunctionalInterface
public interface TransactionVerifier {

    /**
     * 签名是否与交易中的发送方公钥匹配 未签名返回false
     */
    boolean verify(Transaction transaction);
}
