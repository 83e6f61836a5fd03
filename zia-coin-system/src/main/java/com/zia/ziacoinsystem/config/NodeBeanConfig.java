package com.zia.ziacoinsystem.config;

import com.zia.ziacoinsystem.application.service.NodeService;
import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import com.zia.ziacoinsystem.network.common.NodeSettings;
import com.zia.ziacoinsystem.network.common.RoutingTable;
import com.zia.ziacoinsystem.network.service.NodeServer;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.service.blockChain.BlockChainServiceImpl;
import com.zia.ziacoinsystem.service.blockChain.ChainHealthChecker;
import com.zia.ziacoinsystem.service.mining.MiningServiceImpl;
import com.zia.ziacoinsystem.service.transaction.EcdsaTransactionVerifier;
import com.zia.ziacoinsystem.service.transaction.TransactionVerifier;
import com.zia.ziacoinsystem.storage.ChainStorage;
import com.zia.ziacoinsystem.storage.RocksDbChainStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class NodeBeanConfig {

    @Bean
    public ChainStorage chainStorage(SystemConfig config) {
        return new RocksDbChainStorage(config.getStoragePath());
    }

    @Bean
    public TransactionVerifier transactionVerifier() {
        return new EcdsaTransactionVerifier();
    }

    @Bean
    public BlockChainService blockChainService(ChainStorage chainStorage, TransactionVerifier transactionVerifier,
                                               SystemConfig config) {
        return new BlockChainServiceImpl(chainStorage, transactionVerifier, config.getInitialDifficulty());
    }

    @Bean
    public RoutingTable routingTable(SystemConfig config) {
        NodeSettings nodeSettings = NodeSettings.Default.build(config.getBucketSize());
        return new RoutingTable(ExternalNodeInfo.nodeIdOf(config.getHost(), config.getPort()), nodeSettings);
    }

    @Bean
    public MiningServiceImpl miningService(BlockChainService blockChainService, ApplicationEventPublisher eventPublisher,
                                           SystemConfig config) {
        return new MiningServiceImpl(blockChainService, eventPublisher, config.getTargetBlockTime());
    }

    @Bean
    public ChainHealthChecker chainHealthChecker(BlockChainService blockChainService, ChainStorage chainStorage) {
        return new ChainHealthChecker(blockChainService, chainStorage);
    }

    @Bean
    public NodeServer nodeServer(SystemConfig config, BlockChainService blockChainService,
                                 RoutingTable routingTable, ChainHealthChecker chainHealthChecker) {
        return new NodeServer(config, blockChainService, routingTable, chainHealthChecker);
    }

    @Bean
    public NodeService nodeService(BlockChainService blockChainService, MiningServiceImpl miningService,
                                   NodeServer nodeServer) {
        return new NodeService(blockChainService, miningService, nodeServer);
    }

    @Bean
    public ApplicationRunner startNode(NodeServer nodeServer, MiningServiceImpl miningService, SystemConfig config) {
        return args -> {
            log.info("正在启动网络......");
            nodeServer.start();
            if (config.isMiningEnabled()) {
                log.info("正在启动挖矿......");
                miningService.startMining();
            }
        };
    }
}
