package com.zia.ziacoinsystem.network.service;

import com.zia.ziacoinsystem.ChainFixtures;
import com.zia.ziacoinsystem.config.SystemConfig;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.network.common.BootstrapNode;
import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.common.NodeSettings;
import com.zia.ziacoinsystem.network.common.RoutingTable;
import com.zia.ziacoinsystem.network.protocol.message.HandshakeAckMessage;
import com.zia.ziacoinsystem.service.blockChain.BlockChainServiceImpl;
import com.zia.ziacoinsystem.service.blockChain.ChainHealthChecker;
import com.zia.ziacoinsystem.service.transaction.EcdsaTransactionVerifier;
import com.zia.ziacoinsystem.storage.InMemoryChainStorage;
import com.zia.ziacoinsystem.util.CryptoUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * 两个节点在本机回环地址上通信
 */
public class NodeServerTest {

    private final List<NodeServer> servers = new ArrayList<>();
    private KeyPair keyPair;

    @BeforeEach
    void setUp() {
        keyPair = CryptoUtil.ECDSASigner.generateKeyPair();
    }

    @AfterEach
    void tearDown() {
        for (NodeServer server : servers) {
            server.stop();
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private NodeServer startNode(int port, List<BootstrapNode> bootstrap) throws Exception {
        SystemConfig config = new SystemConfig();
        config.setHost("127.0.0.1");
        config.setPort(port);
        config.setBootstrap(bootstrap);
        config.setDiscoveryInterval(3600);
        config.setCleanupInterval(3600);
        config.setSyncInterval(3600);
        config.setHealthCheckInterval(3600);
        config.setRequestTimeout(3000);
        InMemoryChainStorage storage = new InMemoryChainStorage();
        BlockChainServiceImpl ledger = new BlockChainServiceImpl(storage, new EcdsaTransactionVerifier(), 1);
        RoutingTable routingTable = new RoutingTable(ExternalNodeInfo.nodeIdOf("127.0.0.1", port), NodeSettings.Default.build());
        NodeServer server = new NodeServer(config, ledger, routingTable, new ChainHealthChecker(ledger, storage));
        servers.add(server);
        server.start();
        return server;
    }

    @Test
    void handshakeReturnsPeerStatus() throws Exception {
        int portB = freePort();
        NodeServer b = startNode(portB, new ArrayList<>());
        NodeServer a = startNode(freePort(), new ArrayList<>());

        HandshakeAckMessage ack = a.handshake("127.0.0.1", portB);

        Assertions.assertNotNull(ack);
        Assertions.assertEquals(Integer.valueOf(portB), ack.getPort());
        Assertions.assertEquals(Long.valueOf(0), ack.getHeight());
        Assertions.assertTrue(b.getRoutingTable().contains(a.getLocalNodeId()));
    }

    @Test
    void handshakeWithUnreachablePeerReturnsNull() throws Exception {
        NodeServer a = startNode(freePort(), new ArrayList<>());
        Assertions.assertNull(a.handshake("127.0.0.1", freePort()));
    }

    @Test
    void discoveryLearnsBootstrapAndItsPeers() throws Exception {
        int portB = freePort();
        NodeServer b = startNode(portB, new ArrayList<>());
        NodeServer c = startNode(freePort(), List.of(new BootstrapNode("127.0.0.1", portB)));
        c.discoverPeers();
        NodeServer a = startNode(freePort(), List.of(new BootstrapNode("127.0.0.1", portB)));

        a.discoverPeers();

        Assertions.assertTrue(a.getRoutingTable().contains(b.getLocalNodeId()));
        Assertions.assertTrue(a.getRoutingTable().contains(c.getLocalNodeId()));
        Assertions.assertTrue(b.getRoutingTable().contains(a.getLocalNodeId()));
    }

    @Test
    void shorterNodeSynchronizesFromLongerPeer() throws Exception {
        int portB = freePort();
        NodeServer b = startNode(portB, new ArrayList<>());
        for (Block block : ChainFixtures.extendChain(b.getBlockChainService().getChain(), 3, keyPair, 1).subList(1, 4)) {
            b.getBlockChainService().appendBlock(block);
        }
        NodeServer a = startNode(freePort(), List.of(new BootstrapNode("127.0.0.1", portB)));
        a.discoverPeers();

        a.synchronizeChain();

        Assertions.assertEquals(3, a.getBlockChainService().getHeight());
        Assertions.assertEquals(b.getBlockChainService().getLatestBlockHash(), a.getBlockChainService().getLatestBlockHash());
        Assertions.assertTrue(a.getBlockChainService().isChainValid());
    }

    @Test
    void broadcastReachesActivePeers() throws Exception {
        int portB = freePort();
        NodeServer b = startNode(portB, new ArrayList<>());
        NodeServer a = startNode(freePort(), List.of(new BootstrapNode("127.0.0.1", portB)));
        a.discoverPeers();

        Transaction transaction = ChainFixtures.signedTransaction(keyPair, "bob", "10");
        a.getBlockChainService().addTransaction(transaction);
        a.broadcastTransaction(transaction);
        waitUntil(() -> b.getBlockChainService().getPendingTransactions().size() == 1);

        Block block = ChainFixtures.mineBlock(a.getBlockChainService().getLatestBlock(), List.of(transaction), 1);
        a.getBlockChainService().appendBlock(block);
        a.broadcastBlock(block);
        waitUntil(() -> block.getHash().equals(b.getBlockChainService().getLatestBlockHash()));
        Assertions.assertTrue(b.getBlockChainService().getPendingTransactions().isEmpty());
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("等待超时");
            }
            Thread.sleep(20);
        }
    }
}
