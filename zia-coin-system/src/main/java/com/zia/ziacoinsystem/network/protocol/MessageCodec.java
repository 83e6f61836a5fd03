package com.zia.ziacoinsystem.network.protocol;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;

/**
 * 消息与JSON文本互转 字段使用snake_case
 */
public class MessageCodec {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .registerTypeAdapter(ProtocolMessage.class, new ProtocolMessageDeserializer())
            .create();

    public static String encode(ProtocolMessage message) {
        return GSON.toJson(message);
    }

    /**
     * @throws JsonParseException JSON格式错误或缺少type字段
     * @throws com.zia.ziacoinsystem.exception.UnknownMessageTypeException 未知的消息类型
     */
    public static ProtocolMessage decode(String json) throws JsonParseException {
        ProtocolMessage message = GSON.fromJson(json, ProtocolMessage.class);
        if (message == null) {
            throw new JsonParseException("空消息");
        }
        return message;
    }
}
