package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString(callSuper = true)
public class NewBlockMessage extends ProtocolMessage {

    private BlockDTO block;

    public NewBlockMessage() {
        super(MessageType.NEW_BLOCK);
    }

    public NewBlockMessage(BlockDTO block) {
        super(MessageType.NEW_BLOCK);
        this.block = block;
    }
}
