package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.ChainFixtures;
import com.zia.ziacoinsystem.config.SystemConfig;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.exception.UnknownMessageTypeException;
import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.common.NodeSettings;
import com.zia.ziacoinsystem.network.common.RoutingTable;
import com.zia.ziacoinsystem.network.protocol.message.*;
import com.zia.ziacoinsystem.network.service.NodeServer;
import com.zia.ziacoinsystem.service.blockChain.BlockChainServiceImpl;
import com.zia.ziacoinsystem.service.blockChain.ChainHealthChecker;
import com.zia.ziacoinsystem.service.transaction.EcdsaTransactionVerifier;
import com.zia.ziacoinsystem.storage.InMemoryChainStorage;
import com.zia.ziacoinsystem.util.CryptoUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.security.KeyPair;
import java.util.List;

/**
 * 入站消息处理 不启动网络监听
 */
public class MessageHandlerTest {

    private BlockChainServiceImpl ledger;
    private RoutingTable routingTable;
    private NodeServer nodeServer;
    private KeyPair keyPair;

    @BeforeEach
    void setUp() {
        SystemConfig config = new SystemConfig();
        InMemoryChainStorage storage = new InMemoryChainStorage();
        ledger = new BlockChainServiceImpl(storage, new EcdsaTransactionVerifier(), 1);
        routingTable = new RoutingTable(ExternalNodeInfo.nodeIdOf(config.getHost(), config.getPort()), NodeSettings.Default.build());
        nodeServer = new NodeServer(config, ledger, routingTable, new ChainHealthChecker(ledger, storage));
        keyPair = CryptoUtil.ECDSASigner.generateKeyPair();
    }

    @AfterEach
    void tearDown() {
        nodeServer.stop();
    }

    @Test
    void handshakeRegistersPeerAndAnswersWithOwnStatus() throws Exception {
        ProtocolMessage response = nodeServer.handleMessage(new HandshakeMessage("10.0.0.2", 6000, 1, 42));

        HandshakeAckMessage ack = (HandshakeAckMessage) response;
        Assertions.assertEquals("127.0.0.1", ack.getHost());
        Assertions.assertEquals(Long.valueOf(0), ack.getHeight());
        ExternalNodeInfo peer = routingTable.getNode(ExternalNodeInfo.nodeIdOf("10.0.0.2", 6000));
        Assertions.assertNotNull(peer);
        Assertions.assertEquals(42, peer.getHeight());
    }

    @Test
    void incompleteHandshakeIsNotRegistered() throws Exception {
        HandshakeMessage handshake = new HandshakeMessage();
        handshake.setHost("10.0.0.2");
        Assertions.assertInstanceOf(HandshakeAckMessage.class, nodeServer.handleMessage(handshake));
        Assertions.assertEquals(0, routingTable.size());
    }

    @Test
    void getPeersListsActivePeers() throws Exception {
        nodeServer.handleMessage(new HandshakeMessage("10.0.0.2", 6000, 1, 0));
        nodeServer.handleMessage(new HandshakeMessage("10.0.0.3", 6000, 1, 0));
        routingTable.offlineNode(ExternalNodeInfo.nodeIdOf("10.0.0.3", 6000));

        PeerListMessage peers = (PeerListMessage) nodeServer.handleMessage(new GetPeersMessage());
        Assertions.assertEquals(1, peers.getPeers().size());
        Assertions.assertEquals("10.0.0.2", peers.getPeers().get(0).getHost());
    }

    @Test
    void getBlocksReturnsInclusiveRange() throws Exception {
        for (Block block : ChainFixtures.extendChain(ledger.getChain(), 3, keyPair, 1).subList(1, 4)) {
            ledger.appendBlock(block);
        }
        BlocksMessage blocks = (BlocksMessage) nodeServer.handleMessage(new GetBlocksMessage(1, 2));
        Assertions.assertEquals(2, blocks.getBlocks().size());
        Assertions.assertEquals(Long.valueOf(1), blocks.getBlocks().get(0).getIndex());

        BlocksMessage reversed = (BlocksMessage) nodeServer.handleMessage(new GetBlocksMessage(3, 1));
        Assertions.assertTrue(reversed.getBlocks().isEmpty());
    }

    @Test
    void responseTypeArrivingAsRequestIsRejected() {
        Assertions.assertThrows(UnknownMessageTypeException.class,
                () -> nodeServer.handleMessage(new BlocksMessage(List.of())));
        Assertions.assertThrows(UnknownMessageTypeException.class,
                () -> nodeServer.handleMessage(new HandshakeAckMessage("h", 1, 1, 0)));
    }

    @Test
    void newBlockExtendingTipIsAppended() throws Exception {
        Block block = ChainFixtures.mineBlock(ledger.getLatestBlock(),
                List.of(ChainFixtures.signedTransaction(keyPair, "bob", "10")), 1);
        Assertions.assertNull(nodeServer.handleMessage(new NewBlockMessage(BlockDTO.fromBlock(block))));
        Assertions.assertEquals(block.getHash(), ledger.getLatestBlockHash());

        //重复的区块被丢弃
        nodeServer.handleMessage(new NewBlockMessage(BlockDTO.fromBlock(block)));
        Assertions.assertEquals(1, ledger.getHeight());
    }

    @Test
    void orphanBlockIsRejected() throws Exception {
        Block unknownParent = ChainFixtures.mineBlock(Block.createGenesisBlock(), List.of(), 1);
        Block orphan = ChainFixtures.mineBlock(unknownParent, List.of(), 1);
        nodeServer.handleMessage(new NewBlockMessage(BlockDTO.fromBlock(orphan)));
        Assertions.assertEquals(0, ledger.getHeight());
        Assertions.assertFalse(ledger.containsBlock(orphan.getHash()));
    }

    @Test
    void blockWithForgedTransactionIsRejected() throws Exception {
        Transaction forged = ChainFixtures.signedTransaction(keyPair, "bob", "10");
        forged.setAmount(new BigDecimal("1000"));
        Block block = ChainFixtures.mineBlock(ledger.getLatestBlock(), List.of(forged), 1);
        nodeServer.handleMessage(new NewBlockMessage(BlockDTO.fromBlock(block)));
        Assertions.assertEquals(0, ledger.getHeight());
    }

    @Test
    void newTransactionEntersPoolOnce() throws Exception {
        Transaction transaction = ChainFixtures.signedTransaction(keyPair, "bob", "10");
        nodeServer.handleMessage(new NewTransactionMessage(TransactionDTO.fromTransaction(transaction)));
        nodeServer.handleMessage(new NewTransactionMessage(TransactionDTO.fromTransaction(transaction)));
        Assertions.assertEquals(List.of(transaction), ledger.getPendingTransactions());
    }

    @Test
    void invalidTransactionIsDropped() throws Exception {
        Transaction transaction = ChainFixtures.signedTransaction(keyPair, "bob", "10");
        TransactionDTO dto = TransactionDTO.fromTransaction(transaction);
        dto.setAmount(new BigDecimal("-5"));
        nodeServer.handleMessage(new NewTransactionMessage(dto));

        TransactionDTO forged = TransactionDTO.fromTransaction(transaction);
        forged.setRecipient("mallory");
        nodeServer.handleMessage(new NewTransactionMessage(forged));

        Assertions.assertTrue(ledger.getPendingTransactions().isEmpty());
    }
}
