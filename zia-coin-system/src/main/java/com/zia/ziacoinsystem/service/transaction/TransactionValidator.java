package com.zia.ziacoinsystem.service.transaction;

import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.exception.InvalidTransactionException;

import java.math.BigDecimal;
import java.util.List;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.TRANSACTION_FRESHNESS_WINDOW;

/**
 * 外部提交或网络收到的交易的格式校验 签名由账本校验
 */
public class TransactionValidator {

    /**
     * 校验必填字段、金额大于0、时间戳在当前时间前后一小时内
     */
    public static Transaction validate(TransactionDTO dto, long now) throws InvalidTransactionException {
        if (dto == null) {
            throw new InvalidTransactionException("交易为空");
        }
        List<String> missing = dto.missingFields();
        if (!missing.isEmpty()) {
            throw new InvalidTransactionException("交易缺少字段: " + missing);
        }
        if (dto.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidTransactionException("交易金额必须大于0: " + dto.getAmount().toPlainString());
        }
        if (Math.abs(now - dto.getTimestamp()) > TRANSACTION_FRESHNESS_WINDOW) {
            throw new InvalidTransactionException("交易时间戳超出允许范围: " + dto.getTimestamp());
        }
        return dto.toTransaction();
    }
}
