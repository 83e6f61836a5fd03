package com.zia.ziacoinsystem.data.transaction;

import com.google.gson.JsonObject;
import com.zia.ziacoinsystem.util.CryptoUtil;
import com.zia.ziacoinsystem.util.HashUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;

/**
 * 交易 签名后不再修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction implements Serializable {

    private String sender;//发送方压缩公钥hex
    private String recipient;//接收方地址
    private BigDecimal amount;//金额
    private long timestamp;//创建时间 毫秒
    private String signature;//DER签名hex


    /**
     * 签名原文：sender + recipient + amount + timestamp
     */
    public byte[] signatureData() {
        String data = sender + recipient + amount.toPlainString() + timestamp;
        return data.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 使用发送方私钥签名
     */
    public void sign(PrivateKey privateKey) {
        byte[] sig = CryptoUtil.ECDSASigner.applySignature(privateKey, signatureData());
        this.signature = CryptoUtil.bytesToHex(sig);
    }

    /**
     * 规范序列化 键按字母序
     */
    public JsonObject toCanonicalJson() {
        JsonObject json = new JsonObject();
        json.addProperty("amount", amount);
        json.addProperty("recipient", recipient);
        json.addProperty("sender", sender);
        json.addProperty("signature", signature);
        json.addProperty("timestamp", timestamp);
        return json;
    }

    public String calculateHash() {
        return HashUtils.hashCanonical(toCanonicalJson());
    }
}
