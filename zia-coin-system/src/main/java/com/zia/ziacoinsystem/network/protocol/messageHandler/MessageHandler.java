package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;

public interface MessageHandler {

    /**
     * @return 需要回复的响应 广播类消息返回null
     */
    ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) throws Exception;
}
