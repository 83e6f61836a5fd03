package com.zia.ziacoinsystem.application.service;

import com.zia.ziacoinsystem.application.service.vo.MiningStatusVO;
import com.zia.ziacoinsystem.application.service.vo.NetworkStatusVO;
import com.zia.ziacoinsystem.application.service.vo.PeerVO;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import com.zia.ziacoinsystem.exception.InvalidSignatureException;
import com.zia.ziacoinsystem.exception.InvalidTransactionException;
import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.common.RoutingTable;
import com.zia.ziacoinsystem.network.service.NodeServer;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.service.mining.MiningServiceImpl;
import com.zia.ziacoinsystem.service.transaction.TransactionValidator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 节点对外操作 供上层接口直接调用
 */
@Slf4j
public class NodeService {

    private final BlockChainService blockChainService;
    private final MiningServiceImpl miningService;
    private final NodeServer nodeServer;

    public NodeService(BlockChainService blockChainService, MiningServiceImpl miningService, NodeServer nodeServer) {
        this.blockChainService = blockChainService;
        this.miningService = miningService;
        this.nodeServer = nodeServer;
    }

    /**
     * 校验并加入交易池，然后广播
     * @return 交易预计进入的区块索引
     */
    public long submitTransaction(TransactionDTO dto) throws InvalidTransactionException, InvalidSignatureException {
        Transaction transaction = TransactionValidator.validate(dto, System.currentTimeMillis());
        long index = blockChainService.addTransaction(transaction);
        nodeServer.broadcastTransaction(transaction);
        log.info("交易已提交 预计区块:{}", index);
        return index;
    }

    /**
     * 立即打包交易池并挖一个区块
     * @return 新区块 交易池为空、正在挖矿或被取消时返回null
     */
    public Block mine() {
        return miningService.minePendingTransactions();
    }

    public List<Block> getChain() {
        return blockChainService.getChain();
    }

    public boolean validateChain() {
        return blockChainService.isChainValid();
    }

    public BigDecimal getBalance(String address) {
        return blockChainService.getBalance(address);
    }

    public List<PeerVO> getPeers() {
        List<PeerVO> peers = new ArrayList<>();
        for (ExternalNodeInfo node : nodeServer.getRoutingTable().getAllNodes()) {
            peers.add(PeerVO.fromNode(node));
        }
        return peers;
    }

    public NetworkStatusVO getNetworkStatus() {
        RoutingTable routingTable = nodeServer.getRoutingTable();
        return NetworkStatusVO.builder()
                .nodeId(routingTable.getLocalNodeId().toString(16))
                .host(nodeServer.getConfig().getHost())
                .port(nodeServer.getConfig().getPort())
                .version(nodeServer.getConfig().getNetVersion())
                .height(blockChainService.getHeight())
                .latestBlockHash(blockChainService.getLatestBlockHash())
                .difficulty(blockChainService.getDifficulty())
                .knownPeers(routingTable.size())
                .activePeers(routingTable.getActiveNodes().size())
                .pendingTransactions(blockChainService.getPendingTransactions().size())
                .mining(miningService.isMining())
                .build();
    }

    public MiningStatusVO getMiningStatus() {
        return miningService.getMiningStatus();
    }

    public boolean startMining() {
        return miningService.startMining();
    }

    public boolean stopMining() {
        return miningService.stopMining();
    }
}
