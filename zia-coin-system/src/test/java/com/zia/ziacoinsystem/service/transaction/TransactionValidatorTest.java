package com.zia.ziacoinsystem.service.transaction;

import com.zia.ziacoinsystem.ChainFixtures;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.exception.InvalidTransactionException;
import com.zia.ziacoinsystem.util.CryptoUtil;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.TRANSACTION_FRESHNESS_WINDOW;

public class TransactionValidatorTest {

    private Transaction transaction;

    @BeforeEach
    void setUp() {
        transaction = ChainFixtures.signedTransaction(CryptoUtil.ECDSASigner.generateKeyPair(), "bob", "10");
    }

    @Test
    void wellFormedTransactionPasses() throws Exception {
        Transaction validated = TransactionValidator.validate(TransactionDTO.fromTransaction(transaction), transaction.getTimestamp());
        Assertions.assertEquals(transaction, validated);
        Assertions.assertTrue(new EcdsaTransactionVerifier().verify(validated));
    }

    @Test
    void missingFieldIsNamed() {
        TransactionDTO dto = TransactionDTO.fromTransaction(transaction);
        dto.setSignature(null);
        InvalidTransactionException e = Assertions.assertThrows(InvalidTransactionException.class,
                () -> TransactionValidator.validate(dto, transaction.getTimestamp()));
        Assertions.assertTrue(e.getMessage().contains("signature"));
    }

    @Test
    void nonPositiveAmountIsRejected() {
        TransactionDTO dto = TransactionDTO.fromTransaction(transaction);
        dto.setAmount(BigDecimal.ZERO);
        Assertions.assertThrows(InvalidTransactionException.class, () -> TransactionValidator.validate(dto, transaction.getTimestamp()));
        dto.setAmount(new BigDecimal("-1"));
        Assertions.assertThrows(InvalidTransactionException.class, () -> TransactionValidator.validate(dto, transaction.getTimestamp()));
    }

    @Test
    void staleOrFutureTimestampIsRejected() throws Exception {
        TransactionDTO dto = TransactionDTO.fromTransaction(transaction);
        long ts = transaction.getTimestamp();
        Assertions.assertThrows(InvalidTransactionException.class,
                () -> TransactionValidator.validate(dto, ts + TRANSACTION_FRESHNESS_WINDOW + 1));
        Assertions.assertThrows(InvalidTransactionException.class,
                () -> TransactionValidator.validate(dto, ts - TRANSACTION_FRESHNESS_WINDOW - 1));
        Assertions.assertNotNull(TransactionValidator.validate(dto, ts + TRANSACTION_FRESHNESS_WINDOW));
    }

    @Test
    void nullTransactionIsRejected() {
        Assertions.assertThrows(InvalidTransactionException.class, () -> TransactionValidator.validate(null, 0));
    }

    @Test
    void verifierRejectsMalformedSender() {
        transaction.setSender("not-a-key");
        Assertions.assertFalse(new EcdsaTransactionVerifier().verify(transaction));
    }
}
