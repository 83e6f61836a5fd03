package com.zia.ziacoinsystem.network.service;

import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.json.JsonObjectDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 出站请求 每个请求使用一条短连接，发送后等待一个响应再关闭
 */
@Slf4j
public class TCPClient {

    static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private final NioEventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private final int timeoutMillis;

    public TCPClient(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
        // 全局复用一个EventLoopGroup
        this.eventLoopGroup = new NioEventLoopGroup(2);
        this.bootstrap = new Bootstrap();
        bootstrap.group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis);
    }

    /**
     * 发送请求并同步等待响应
     * @throws ConnectException 无法连接
     * @throws TimeoutException 超时未收到响应
     * @throws IOException 发送失败或连接在响应前关闭
     */
    public ProtocolMessage sendMessageWithResponse(String host, int port, ProtocolMessage request)
            throws ConnectException, TimeoutException, InterruptedException, IOException {
        Promise<ProtocolMessage> promise = eventLoopGroup.next().newPromise();
        Channel channel = connect(host, port, new ResponseHandler(promise));
        try {
            channel.writeAndFlush(request).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                }
            });
            if (!promise.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new TimeoutException("等待节点 " + host + ":" + port + " 响应超时（" + timeoutMillis + "ms）");
            }
            if (!promise.isSuccess()) {
                throw new IOException("请求节点 " + host + ":" + port + " 失败", promise.cause());
            }
            return promise.getNow();
        } finally {
            channel.close();
        }
    }

    /**
     * 只发送不等待响应 用于广播
     */
    public void sendMessage(String host, int port, ProtocolMessage message)
            throws ConnectException, InterruptedException, IOException {
        Channel channel = connect(host, port, new ChannelInboundHandlerAdapter());
        try {
            ChannelFuture writeFuture = channel.writeAndFlush(message);
            if (!writeFuture.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new IOException("发送到节点 " + host + ":" + port + " 超时");
            }
            if (!writeFuture.isSuccess()) {
                throw new IOException("发送到节点 " + host + ":" + port + " 失败", writeFuture.cause());
            }
        } finally {
            channel.close();
        }
    }

    private Channel connect(String host, int port, ChannelHandler inboundHandler) throws ConnectException, InterruptedException {
        Bootstrap b = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline pipeline = ch.pipeline();
                pipeline.addLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS));
                pipeline.addLast(new JsonObjectDecoder(MAX_FRAME_LENGTH));
                pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
                pipeline.addLast(new StringEncoder(StandardCharsets.UTF_8));
                pipeline.addLast(new ProtocolMessageCodec());
                pipeline.addLast(inboundHandler);
            }
        });
        ChannelFuture connectFuture = b.connect(host, port);
        if (!connectFuture.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
            connectFuture.cancel(true);
            throw new ConnectException("连接节点 " + host + ":" + port + " 超时");
        }
        if (!connectFuture.isSuccess()) {
            ConnectException exception = new ConnectException("无法连接节点 " + host + ":" + port);
            exception.initCause(connectFuture.cause());
            throw exception;
        }
        return connectFuture.channel();
    }

    public void close() {
        eventLoopGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly(10, TimeUnit.SECONDS);
    }

    /**
     * 收到第一条消息即完成promise
     */
    private static class ResponseHandler extends SimpleChannelInboundHandler<ProtocolMessage> {
        private final Promise<ProtocolMessage> promise;

        ResponseHandler(Promise<ProtocolMessage> promise) {
            this.promise = promise;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ProtocolMessage msg) {
            promise.trySuccess(msg);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            promise.tryFailure(new IOException("连接在收到响应前关闭"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("请求异常: {}", cause.getMessage());
            promise.tryFailure(cause);
            ctx.close();
        }
    }
}
