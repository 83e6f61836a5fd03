package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString(callSuper = true)
public class PeerListMessage extends ProtocolMessage {

    private List<PeerSummary> peers = new ArrayList<>();

    public PeerListMessage() {
        super(MessageType.PEER_LIST);
    }

    public PeerListMessage(List<PeerSummary> peers) {
        super(MessageType.PEER_LIST);
        this.peers = peers;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class PeerSummary {
        private String host;
        private Integer port;
        private Integer version;
        private Long height;

        public static PeerSummary fromNode(ExternalNodeInfo node) {
            return new PeerSummary(node.getHost(), node.getPort(), node.getVersion(), node.getHeight());
        }
    }
}
