package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 握手双方互相告知的节点信息
 */
@Getter
@Setter
@ToString(callSuper = true)
public abstract class PeerAnnouncementMessage extends ProtocolMessage {

    private String host;
    private Integer port;
    private Integer version;
    private Long height;

    protected PeerAnnouncementMessage(MessageType messageType) {
        super(messageType);
    }

    protected PeerAnnouncementMessage(MessageType messageType, String host, int port, int version, long height) {
        super(messageType);
        this.host = host;
        this.port = port;
        this.version = version;
        this.height = height;
    }

    public boolean isComplete() {
        return host != null && port != null && version != null && height != null;
    }
}
