package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.ToString;

@ToString(callSuper = true)
public class HandshakeAckMessage extends PeerAnnouncementMessage {

    public HandshakeAckMessage() {
        super(MessageType.HANDSHAKE_ACK);
    }

    public HandshakeAckMessage(String host, int port, int version, long height) {
        super(MessageType.HANDSHAKE_ACK, host, port, version, height);
    }
}
