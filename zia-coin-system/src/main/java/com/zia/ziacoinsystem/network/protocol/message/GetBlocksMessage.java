package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 索取闭区间[start_height, end_height]内的区块
 */
@Getter
@Setter
@ToString(callSuper = true)
public class GetBlocksMessage extends ProtocolMessage {

    private Long startHeight;
    private Long endHeight;

    public GetBlocksMessage() {
        super(MessageType.GET_BLOCKS);
    }

    public GetBlocksMessage(long startHeight, long endHeight) {
        super(MessageType.GET_BLOCKS);
        this.startHeight = startHeight;
        this.endHeight = endHeight;
    }
}
