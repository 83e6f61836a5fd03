package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.ToString;

@ToString(callSuper = true)
public class HandshakeMessage extends PeerAnnouncementMessage {

    public HandshakeMessage() {
        super(MessageType.HANDSHAKE);
    }

    public HandshakeMessage(String host, int port, int version, long height) {
        super(MessageType.HANDSHAKE, host, port, version, height);
    }
}
