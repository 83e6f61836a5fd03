package com.zia.ziacoinsystem.network.service;

import com.zia.ziacoinsystem.network.protocol.MessageCodec;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * JSON文本与消息对象互转 位于StringDecoder/StringEncoder之后
 * 解析失败时抛出的JsonParseException由Netty包装为DecoderException
 */
@Slf4j
public class ProtocolMessageCodec extends MessageToMessageCodec<String, ProtocolMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, ProtocolMessage message, List<Object> out) {
        out.add(MessageCodec.encode(message));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, String json, List<Object> out) {
        ProtocolMessage message = MessageCodec.decode(json);
        log.debug("解码消息:{}", message.getType());
        out.add(message);
    }
}
