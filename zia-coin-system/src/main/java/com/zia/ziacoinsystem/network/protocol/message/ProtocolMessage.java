package com.zia.ziacoinsystem.network.protocol.message;

import com.zia.ziacoinsystem.network.protocol.MessageType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 节点间消息 JSON对象 type字段区分消息类型
 */
@Getter
@Setter
@ToString
public abstract class ProtocolMessage {

    private String type;

    protected ProtocolMessage(MessageType messageType) {
        this.type = messageType.getWireName();
    }

    public MessageType messageType() {
        return MessageType.fromWireName(type);
    }
}
