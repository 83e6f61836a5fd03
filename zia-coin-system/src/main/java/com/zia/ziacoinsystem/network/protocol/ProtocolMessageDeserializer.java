package com.zia.ziacoinsystem.network.protocol;

import com.google.gson.*;
import com.zia.ziacoinsystem.exception.UnknownMessageTypeException;
import com.zia.ziacoinsystem.network.protocol.message.*;

import java.lang.reflect.Type;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按type字段选择具体的消息类
 */
public class ProtocolMessageDeserializer implements JsonDeserializer<ProtocolMessage> {
    private final Map<MessageType, Class<? extends ProtocolMessage>> messageClassRegistry = new EnumMap<>(MessageType.class);

    public ProtocolMessageDeserializer() {
        this.registerMessageClass(MessageType.HANDSHAKE, HandshakeMessage.class);
        this.registerMessageClass(MessageType.HANDSHAKE_ACK, HandshakeAckMessage.class);
        this.registerMessageClass(MessageType.GET_PEERS, GetPeersMessage.class);
        this.registerMessageClass(MessageType.PEER_LIST, PeerListMessage.class);
        this.registerMessageClass(MessageType.GET_BLOCKS, GetBlocksMessage.class);
        this.registerMessageClass(MessageType.BLOCKS, BlocksMessage.class);
        this.registerMessageClass(MessageType.NEW_BLOCK, NewBlockMessage.class);
        this.registerMessageClass(MessageType.NEW_TRANSACTION, NewTransactionMessage.class);
    }

    @Override
    public ProtocolMessage deserialize(JsonElement jsonElement, Type type, JsonDeserializationContext context) throws JsonParseException {
        if (!jsonElement.isJsonObject()) {
            throw new JsonParseException("消息必须是JSON对象");
        }
        JsonObject jsonObject = jsonElement.getAsJsonObject();
        JsonElement typeElement = jsonObject.get("type");
        if (typeElement == null || !typeElement.isJsonPrimitive()) {
            throw new JsonParseException("消息缺少type字段");
        }
        String wireName = typeElement.getAsString();
        MessageType messageType = MessageType.fromWireName(wireName);
        Class<? extends ProtocolMessage> messageClass = messageType == null ? null : messageClassRegistry.get(messageType);
        if (messageClass == null) {
            throw new UnknownMessageTypeException(wireName);
        }
        return context.deserialize(jsonObject, messageClass);
    }

    public void registerMessageClass(MessageType type, Class<? extends ProtocolMessage> clazz) {
        this.messageClassRegistry.put(type, clazz);
    }
}
