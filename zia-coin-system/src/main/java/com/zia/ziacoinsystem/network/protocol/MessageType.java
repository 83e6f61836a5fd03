package com.zia.ziacoinsystem.network.protocol;

import java.util.HashMap;
import java.util.Map;

public enum MessageType {
    HANDSHAKE("handshake", "握手请求", true),
    HANDSHAKE_ACK("handshake_ack", "握手响应", false),
    GET_PEERS("get_peers", "索取节点列表请求", true),
    PEER_LIST("peer_list", "节点列表响应", false),
    GET_BLOCKS("get_blocks", "索取区块数据请求", true),
    BLOCKS("blocks", "区块数据响应", false),
    NEW_BLOCK("new_block", "区块广播消息", true),
    NEW_TRANSACTION("new_transaction", "交易广播消息", true),
    ;

    private final String wireName;
    private final String description;
    //可以作为请求到达服务端
    private final boolean request;
    private static final Map<String, MessageType> wireNameMap = new HashMap<>();

    static {
        for (MessageType type : MessageType.values()) {
            wireNameMap.put(type.wireName, type);
        }
    }

    MessageType(String wireName, String description, boolean request) {
        this.wireName = wireName;
        this.description = description;
        this.request = request;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRequest() {
        return request;
    }

    /**
     * @return 未知类型返回null
     */
    public static MessageType fromWireName(String wireName) {
        return wireNameMap.get(wireName);
    }
}
