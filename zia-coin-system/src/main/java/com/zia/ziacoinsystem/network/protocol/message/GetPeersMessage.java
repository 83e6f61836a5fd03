package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;

public class GetPeersMessage extends ProtocolMessage {

    public GetPeersMessage() {
        super(MessageType.GET_PEERS);
    }
}
