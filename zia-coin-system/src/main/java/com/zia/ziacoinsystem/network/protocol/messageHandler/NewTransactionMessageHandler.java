package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.exception.InvalidSignatureException;
import com.zia.ziacoinsystem.exception.InvalidTransactionException;
import com.zia.ziacoinsystem.network.protocol.message.NewTransactionMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;
import com.zia.ziacoinsystem.service.transaction.TransactionValidator;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class NewTransactionMessageHandler implements MessageHandler {

    @Override
    public ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) {
        NewTransactionMessage transactionMessage = (NewTransactionMessage) message;
        Transaction transaction;
        try {
            transaction = TransactionValidator.validate(transactionMessage.getTransaction(), System.currentTimeMillis());
        } catch (InvalidTransactionException e) {
            log.warn("拒绝交易: {}", e.getMessage());
            return null;
        }
        if (!nodeServer.markTransactionSeen(transaction.calculateHash())) {
            log.debug("交易已处理过，丢弃");
            return null;
        }
        try {
            nodeServer.getBlockChainService().addTransaction(transaction);
        } catch (InvalidSignatureException e) {
            log.warn("拒绝交易: {}", e.getMessage());
            return null;
        }
        nodeServer.broadcastTransaction(transaction);
        return null;
    }
}
