package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.exception.InvalidBlockException;
import com.zia.ziacoinsystem.network.protocol.message.NewBlockMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.service.blockChain.BlockValidator;
import lombok.extern.slf4j.Slf4j;

/**
 * 区块广播：校验后若延伸本地链尾则追加并继续广播
 */
@Slf4j
public class NewBlockMessageHandler implements MessageHandler {

    @Override
    public ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) {
        NewBlockMessage newBlockMessage = (NewBlockMessage) message;
        BlockChainService blockChainService = nodeServer.getBlockChainService();
        Block block;
        try {
            block = BlockValidator.validateIncoming(newBlockMessage.getBlock(), blockChainService);
        } catch (InvalidBlockException e) {
            log.warn("拒绝区块: {}", e.getMessage());
            return null;
        }
        if (!nodeServer.markBlockSeen(block.getHash()) || blockChainService.containsBlock(block.getHash())) {
            log.debug("区块 {} 已处理过，丢弃", block.getHash());
            return null;
        }
        if (!block.getPreviousHash().equals(blockChainService.getLatestBlockHash())) {
            log.info("区块 #{} 未延伸本地链尾，等待同步", block.getIndex());
            return null;
        }
        try {
            blockChainService.appendBlock(block);
        } catch (InvalidBlockException e) {
            log.warn("区块 #{} 追加失败: {}", block.getIndex(), e.getMessage());
            return null;
        }
        log.info("接收区块 #{} {}", block.getIndex(), block.getHash());
        nodeServer.broadcastBlock(block);
        return null;
    }
}
