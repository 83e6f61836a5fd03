package com.zia.ziacoinsystem.service.transaction;

import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.security.PublicKey;

/**
 * secp256k1 ECDSA签名验证 发送方为压缩公钥hex
 */
@Slf4j
public class EcdsaTransactionVerifier implements TransactionVerifier {

    @Override
    public boolean verify(Transaction transaction) {
        if (transaction == null || transaction.getSignature() == null || transaction.getSender() == null
                || transaction.getRecipient() == null || transaction.getAmount() == null) {
            return false;
        }
        try {
            PublicKey publicKey = CryptoUtil.ECDSASigner.importCompressedPublicKey(transaction.getSender());
            byte[] signature = CryptoUtil.hexToBytes(transaction.getSignature());
            return CryptoUtil.ECDSASigner.verifySignature(publicKey, transaction.signatureData(), signature);
        } catch (IllegalArgumentException e) {
            log.debug("交易公钥或签名格式错误: {}", e.getMessage());
            return false;
        }
    }
}
