package com.zia.ziacoinsystem.network.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.zia.ziacoinsystem.config.SystemConfig;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.event.BlockMinedEvent;
import com.zia.ziacoinsystem.exception.UnknownMessageTypeException;
import com.zia.ziacoinsystem.network.common.BootstrapNode;
import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.common.RoutingTable;
import com.zia.ziacoinsystem.network.protocol.MessageType;
import com.zia.ziacoinsystem.network.protocol.message.*;
import com.zia.ziacoinsystem.network.protocol.messageHandler.*;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.service.blockChain.ChainHealthChecker;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.json.JsonObjectDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.*;
import java.util.concurrent.*;

/**
 * 节点网络服务：监听入站请求、广播区块与交易、节点发现、定期同步与维护
 */
@Slf4j
@Getter
public class NodeServer {

    private final SystemConfig config;
    private final BlockChainService blockChainService;
    private final RoutingTable routingTable;
    private final ChainHealthChecker chainHealthChecker;
    private final TCPClient tcpClient;
    private final ChainSynchronizer chainSynchronizer;
    //消息处理器
    private final Map<MessageType, MessageHandler> messageHandlers = new EnumMap<>(MessageType.class);

    //已处理的区块hash/交易hash 防止重复处理和广播风暴
    private final Cache<String, Boolean> seenBlocks = CacheBuilder.newBuilder()
            .maximumSize(10000)
            .expireAfterWrite(30, TimeUnit.MINUTES)
            .build();
    private final Cache<String, Boolean> seenTransactions = CacheBuilder.newBuilder()
            .maximumSize(50000)
            .expireAfterWrite(2, TimeUnit.HOURS)
            .build();

    private final ExecutorService businessExecutor;
    private final ExecutorService broadcastExecutor;
    private ScheduledExecutorService scheduler;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ChannelFuture tcpBindFuture;
    private volatile boolean running = false;

    public NodeServer(SystemConfig config, BlockChainService blockChainService,
                      RoutingTable routingTable, ChainHealthChecker chainHealthChecker) {
        this.config = config;
        this.blockChainService = blockChainService;
        this.routingTable = routingTable;
        this.chainHealthChecker = chainHealthChecker;
        this.tcpClient = new TCPClient(config.getRequestTimeout());
        this.chainSynchronizer = new ChainSynchronizer(blockChainService, tcpClient);
        this.businessExecutor = Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), namedThreadFactory("node-business"));
        this.broadcastExecutor = Executors.newFixedThreadPool(4, namedThreadFactory("node-broadcast"));
        routingTable.setLivenessProbe(node -> handshake(node.getHost(), node.getPort()) != null);

        registerMessageHandler(MessageType.HANDSHAKE, new HandshakeMessageHandler());
        registerMessageHandler(MessageType.GET_PEERS, new GetPeersMessageHandler());
        registerMessageHandler(MessageType.GET_BLOCKS, new GetBlocksMessageHandler());
        registerMessageHandler(MessageType.NEW_BLOCK, new NewBlockMessageHandler());
        registerMessageHandler(MessageType.NEW_TRANSACTION, new NewTransactionMessageHandler());
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + count++);
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    public void registerMessageHandler(MessageType type, MessageHandler messageHandler) {
        messageHandlers.put(type, messageHandler);
    }

    /**
     * 分发入站请求
     * @throws UnknownMessageTypeException 没有对应处理器，或响应类型的消息作为请求到达
     */
    public ProtocolMessage handleMessage(ProtocolMessage message) throws Exception {
        MessageType type = message.messageType();
        if (type == null || !type.isRequest()) {
            throw new UnknownMessageTypeException(message.getType());
        }
        MessageHandler handler = messageHandlers.get(type);
        if (handler == null) {
            throw new UnknownMessageTypeException(message.getType());
        }
        log.debug("处理消息:{}", type.getDescription());
        return handler.handleMessage(this, message);
    }

    public synchronized void start() throws InterruptedException {
        if (running) {
            return;
        }
        startTcpServer();
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "node-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safeDiscoverPeers, 0, config.getDiscoveryInterval(), TimeUnit.SECONDS);
        scheduler.scheduleWithFixedDelay(this::cleanupNodes, config.getCleanupInterval(), config.getCleanupInterval(), TimeUnit.SECONDS);
        scheduler.scheduleWithFixedDelay(this::synchronizeChain, config.getSyncInterval(), config.getSyncInterval(), TimeUnit.SECONDS);
        scheduler.scheduleWithFixedDelay(this::healthCheck, config.getHealthCheckInterval(), config.getHealthCheckInterval(), TimeUnit.SECONDS);
    }

    private void startTcpServer() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap tcpBootstrap = new ServerBootstrap();
        tcpBootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    public void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new ReadTimeoutHandler(config.getRequestTimeout(), TimeUnit.MILLISECONDS));
                        pipeline.addLast(new JsonObjectDecoder(TCPClient.MAX_FRAME_LENGTH));
                        pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        pipeline.addLast(new ProtocolMessageCodec());
                        pipeline.addLast(new NodeTcpHandler(NodeServer.this));
                    }
                });
        tcpBindFuture = tcpBootstrap.bind(config.getPort()).sync();
        log.info("TCP服务已启动，地址 {}:{}", config.getHost(), config.getPort());
    }

    public HandshakeMessage selfHandshake() {
        return new HandshakeMessage(config.getHost(), config.getPort(), config.getNetVersion(), blockChainService.getHeight());
    }

    public HandshakeAckMessage selfAck() {
        return new HandshakeAckMessage(config.getHost(), config.getPort(), config.getNetVersion(), blockChainService.getHeight());
    }

    public BigInteger getLocalNodeId() {
        return routingTable.getLocalNodeId();
    }

    /**
     * 向对方握手 成功后对方进入路由表
     * @return 对方的握手响应 失败返回null
     */
    public HandshakeAckMessage handshake(String host, int port) {
        try {
            ProtocolMessage response = tcpClient.sendMessageWithResponse(host, port, selfHandshake());
            if (!(response instanceof HandshakeAckMessage) || !((HandshakeAckMessage) response).isComplete()) {
                log.warn("节点 {}:{} 握手响应无效: {}", host, port, response);
                return null;
            }
            HandshakeAckMessage ack = (HandshakeAckMessage) response;
            if (ack.getVersion() != config.getNetVersion()) {
                log.warn("节点 {}:{} 协议版本不一致 对方:{} 本地:{}", host, port, ack.getVersion(), config.getNetVersion());
            }
            return ack;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.debug("与节点 {}:{} 握手失败: {}", host, port, e.getMessage());
            routingTable.offlineNode(ExternalNodeInfo.nodeIdOf(host, port));
            return null;
        }
    }

    /**
     * 握手并把对方加入路由表
     */
    private HandshakeAckMessage connectToNode(String host, int port) {
        HandshakeAckMessage ack = handshake(host, port);
        if (ack != null) {
            routingTable.addNode(new ExternalNodeInfo(ack.getHost(), ack.getPort(), ack.getVersion(), ack.getHeight()));
        }
        return ack;
    }

    /**
     * 向对方索取节点列表
     */
    public List<PeerListMessage.PeerSummary> requestPeers(String host, int port) {
        try {
            ProtocolMessage response = tcpClient.sendMessageWithResponse(host, port, new GetPeersMessage());
            if (response instanceof PeerListMessage && ((PeerListMessage) response).getPeers() != null) {
                return ((PeerListMessage) response).getPeers();
            }
            log.warn("节点 {}:{} 返回了无效的节点列表", host, port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.debug("向节点 {}:{} 索取节点列表失败: {}", host, port, e.getMessage());
            routingTable.offlineNode(ExternalNodeInfo.nodeIdOf(host, port));
        }
        return new ArrayList<>();
    }

    /**
     * 节点发现：握手引导节点并获取其节点列表，再对随机ID的最近节点索取节点列表
     */
    public void discoverPeers() {
        log.debug("开始节点发现");
        for (BootstrapNode bootstrap : config.getBootstrap()) {
            if (isSelf(bootstrap.getHost(), bootstrap.getPort())) {
                continue;
            }
            if (connectToNode(bootstrap.getHost(), bootstrap.getPort()) != null) {
                learnPeers(requestPeers(bootstrap.getHost(), bootstrap.getPort()));
            }
        }
        BigInteger randomTargetId = new BigInteger(160, new SecureRandom());
        for (ExternalNodeInfo peer : routingTable.findNode(randomTargetId)) {
            learnPeers(requestPeers(peer.getHost(), peer.getPort()));
        }
        log.info("节点发现完成 路由表节点数:{}", routingTable.size());
    }

    private void learnPeers(List<PeerListMessage.PeerSummary> peers) {
        for (PeerListMessage.PeerSummary peer : peers) {
            if (peer.getHost() == null || peer.getPort() == null || isSelf(peer.getHost(), peer.getPort())) {
                continue;
            }
            if (!routingTable.contains(ExternalNodeInfo.nodeIdOf(peer.getHost(), peer.getPort()))) {
                connectToNode(peer.getHost(), peer.getPort());
            }
        }
    }

    private boolean isSelf(String host, int port) {
        return ExternalNodeInfo.nodeIdOf(host, port).equals(getLocalNodeId());
    }

    private void safeDiscoverPeers() {
        try {
            discoverPeers();
        } catch (RuntimeException e) {
            log.error("节点发现任务执行失败", e);
        }
    }

    private void cleanupNodes() {
        try {
            routingTable.cleanExpiredNodes(config.getNodeExpirationTime());
        } catch (RuntimeException e) {
            log.error("节点清理任务执行失败", e);
        }
    }

    /**
     * 与每个在线节点对比高度 对方更长时同步
     */
    public void synchronizeChain() {
        for (ExternalNodeInfo peer : routingTable.getActiveNodes()) {
            HandshakeAckMessage ack = handshake(peer.getHost(), peer.getPort());
            if (ack == null) {
                continue;
            }
            try {
                chainSynchronizer.synchronizeWith(peer.getHost(), peer.getPort(), ack.getHeight());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.warn("从节点 {} 同步失败: {}", peer.address(), e.getMessage());
                routingTable.offlineNode(peer.getId());
            }
        }
    }

    private void healthCheck() {
        try {
            chainHealthChecker.check();
        } catch (RuntimeException e) {
            log.error("区块链健康检查执行失败", e);
        }
    }

    /**
     * @return 首次见到返回true
     */
    public boolean markBlockSeen(String hash) {
        return seenBlocks.asMap().putIfAbsent(hash, Boolean.TRUE) == null;
    }

    public boolean markTransactionSeen(String transactionHash) {
        return seenTransactions.asMap().putIfAbsent(transactionHash, Boolean.TRUE) == null;
    }

    @EventListener
    public void onBlockMined(BlockMinedEvent event) {
        broadcastBlock(event.getBlock());
    }

    public void broadcastBlock(Block block) {
        seenBlocks.put(block.getHash(), Boolean.TRUE);
        broadcastMessage(new NewBlockMessage(BlockDTO.fromBlock(block)));
    }

    public void broadcastTransaction(Transaction transaction) {
        seenTransactions.put(transaction.calculateHash(), Boolean.TRUE);
        broadcastMessage(new NewTransactionMessage(TransactionDTO.fromTransaction(transaction)));
    }

    /**
     * 发送给所有在线节点 单个节点失败只记录日志并标记离线
     */
    public void broadcastMessage(ProtocolMessage message) {
        List<ExternalNodeInfo> peers = routingTable.getActiveNodes();
        log.debug("广播消息 {} 到{}个节点", message.getType(), peers.size());
        for (ExternalNodeInfo peer : peers) {
            try {
                broadcastExecutor.execute(() -> {
                    try {
                        tcpClient.sendMessage(peer.getHost(), peer.getPort(), message);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        log.error("向节点 {} 发送消息失败: {}", peer.address(), e.getMessage());
                        routingTable.offlineNode(peer.getId());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("广播线程池已关闭，停止广播");
                return;
            }
        }
    }

    @PreDestroy
    public synchronized void stop() {
        this.running = false;
        shutdownExecutor(scheduler, "调度");
        shutdownExecutor(broadcastExecutor, "广播");
        shutdownExecutor(businessExecutor, "业务");
        if (tcpBindFuture != null) {
            tcpBindFuture.channel().close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly(10, TimeUnit.SECONDS);
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly(10, TimeUnit.SECONDS);
        }
        tcpClient.close();
        log.info("节点网络服务已停止");
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                List<Runnable> remainingTasks = executor.shutdownNow();
                log.warn("{}线程池强制关闭，剩余未执行任务数：{}", name, remainingTasks.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
