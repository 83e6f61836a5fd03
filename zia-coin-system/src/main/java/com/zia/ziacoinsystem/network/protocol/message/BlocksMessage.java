package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(callSuper = true)
public class BlocksMessage extends ProtocolMessage {

    private List<BlockDTO> blocks = new ArrayList<>();

    public BlocksMessage() {
        super(MessageType.BLOCKS);
    }

    public BlocksMessage(List<BlockDTO> blocks) {
        super(MessageType.BLOCKS);
        this.blocks = blocks;
    }
}
