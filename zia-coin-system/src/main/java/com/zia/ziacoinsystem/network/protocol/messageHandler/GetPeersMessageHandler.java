package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.protocol.message.PeerListMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;

import java.util.ArrayList;
import java.util.List;

public class GetPeersMessageHandler implements MessageHandler {

    @Override
    public ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) {
        List<PeerListMessage.PeerSummary> peers = new ArrayList<>();
        for (ExternalNodeInfo node : nodeServer.getRoutingTable().getActiveNodes()) {
            peers.add(PeerListMessage.PeerSummary.fromNode(node));
        }
        return new PeerListMessage(peers);
    }
}
