package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.protocol.message.HandshakeMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class HandshakeMessageHandler implements MessageHandler {

    @Override
    public ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) {
        HandshakeMessage handshake = (HandshakeMessage) message;
        if (!handshake.isComplete()) {
            log.warn("握手信息不完整，忽略: {}", handshake);
            return nodeServer.selfAck();
        }
        ExternalNodeInfo node = new ExternalNodeInfo(handshake.getHost(), handshake.getPort(),
                handshake.getVersion(), handshake.getHeight());
        boolean added = nodeServer.getRoutingTable().addNode(node);
        log.debug("收到握手 {} 版本:{} 高度:{} 加入路由表:{}", node.address(), handshake.getVersion(), handshake.getHeight(), added);
        return nodeServer.selfAck();
    }
}
