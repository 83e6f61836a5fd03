package com.zia.ziacoinsystem.data.transaction.dto;

import com.zia.ziacoinsystem.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 网络传输用交易 字段可为空 用于必填校验
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TransactionDTO {
    private String sender;
    private String recipient;
    private BigDecimal amount;
    private Long timestamp;
    private String signature;

    public static TransactionDTO fromTransaction(Transaction transaction) {
        return new TransactionDTO(
                transaction.getSender(),
                transaction.getRecipient(),
                transaction.getAmount(),
                transaction.getTimestamp(),
                transaction.getSignature());
    }

    /**
     * 缺失的必填字段
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (sender == null) missing.add("sender");
        if (recipient == null) missing.add("recipient");
        if (amount == null) missing.add("amount");
        if (timestamp == null) missing.add("timestamp");
        if (signature == null) missing.add("signature");
        return missing;
    }

    public Transaction toTransaction() {
        return Transaction.builder()
                .sender(sender)
                .recipient(recipient)
                .amount(amount)
                .timestamp(timestamp)
                .signature(signature)
                .build();
    }
}
