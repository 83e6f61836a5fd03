package com.zia.ziacoinsystem.network.service;

import com.zia.ziacoinsystem.exception.UnknownMessageTypeException;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.RejectedExecutionException;

/**
 * 入站连接 每条连接处理一个请求，回复后关闭
 * 业务处理在业务线程池中进行，不占用EventLoop
 */
@Slf4j
public class NodeTcpHandler extends SimpleChannelInboundHandler<ProtocolMessage> {

    private final NodeServer nodeServer;

    public NodeTcpHandler(NodeServer nodeServer) {
        if (nodeServer == null) {
            throw new NullPointerException("传入的NodeServer为null");
        }
        this.nodeServer = nodeServer;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ProtocolMessage message) {
        try {
            nodeServer.getBusinessExecutor().execute(() -> process(ctx, message));
        } catch (RejectedExecutionException e) {
            log.warn("业务线程池已关闭，丢弃消息 {}", message.getType());
            ctx.close();
        }
    }

    private void process(ChannelHandlerContext ctx, ProtocolMessage message) {
        try {
            ProtocolMessage response = nodeServer.handleMessage(message);
            if (response != null) {
                ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            } else {
                ctx.close();
            }
        } catch (Exception e) {
            log.warn("处理消息 {} 失败: {}", message.getType(), e.getMessage());
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof UnknownMessageTypeException) {
            log.warn("来自 {} 的消息类型未知: {}", ctx.channel().remoteAddress(), ((UnknownMessageTypeException) root).getType());
        } else {
            log.warn("连接 {} 异常: {}", ctx.channel().remoteAddress(), root.getMessage());
        }
        ctx.close();
    }
}
