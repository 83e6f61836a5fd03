package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(callSuper = true)
public class NewTransactionMessage extends ProtocolMessage {

    private TransactionDTO transaction;

    public NewTransactionMessage() {
        super(MessageType.NEW_TRANSACTION);
    }

    public NewTransactionMessage(TransactionDTO transaction) {
        super(MessageType.NEW_TRANSACTION);
        this.transaction = transaction;
    }
}
