package com.zia.ziacoinsystem.network.service;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.exception.InvalidBlockException;
import com.zia.ziacoinsystem.network.protocol.message.BlocksMessage;
import com.zia.ziacoinsystem.network.protocol.message.GetBlocksMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.service.blockChain.BlockValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.MAX_BLOCKS_PER_REQUEST;

/**
 * 与更长的对方链对齐：分批下载整条链，逐块校验后整体替换本地链
 * 分叉选择只比较长度
 */
@Slf4j
public class ChainSynchronizer {

    private final BlockChainService blockChainService;
    private final TCPClient tcpClient;

    public ChainSynchronizer(BlockChainService blockChainService, TCPClient tcpClient) {
        this.blockChainService = blockChainService;
        this.tcpClient = tcpClient;
    }

    /**
     * @param remoteHeight 对方握手时报告的高度
     * @return 本地链是否被替换
     */
    public boolean synchronizeWith(String host, int port, long remoteHeight)
            throws ConnectException, TimeoutException, InterruptedException, IOException {
        long localHeight = blockChainService.getHeight();
        if (remoteHeight <= localHeight) {
            log.debug("节点 {}:{} 高度{}不高于本地{}，无需同步", host, port, remoteHeight, localHeight);
            return false;
        }
        log.info("开始从 {}:{} 同步区块 本地高度:{} 对方高度:{}", host, port, localHeight, remoteHeight);
        List<Block> candidate = new ArrayList<>();
        for (long start = 0; start <= remoteHeight; start += MAX_BLOCKS_PER_REQUEST) {
            long end = Math.min(start + MAX_BLOCKS_PER_REQUEST - 1, remoteHeight);
            ProtocolMessage response = tcpClient.sendMessageWithResponse(host, port, new GetBlocksMessage(start, end));
            if (!(response instanceof BlocksMessage)) {
                throw new IOException("意外的响应类型: " + response.getType());
            }
            List<BlockDTO> batch = ((BlocksMessage) response).getBlocks();
            if (batch == null || batch.isEmpty()) {
                break;
            }
            try {
                appendVerified(candidate, batch);
            } catch (InvalidBlockException e) {
                log.warn("节点 {}:{} 的区块校验失败，放弃同步: {}", host, port, e.getMessage());
                return false;
            }
        }
        boolean replaced = blockChainService.replaceChain(candidate);
        if (replaced) {
            log.info("已从 {}:{} 同步区块链 新高度:{}", host, port, blockChainService.getHeight());
        }
        return replaced;
    }

    /**
     * 逐块校验并连接到已下载部分
     */
    static void appendVerified(List<Block> candidate, List<BlockDTO> batch) throws InvalidBlockException {
        for (BlockDTO dto : batch) {
            Block block = BlockValidator.validateStandalone(dto);
            if (block.getIndex() != candidate.size()) {
                throw new InvalidBlockException("区块高度不连续 期望:" + candidate.size() + " 实际:" + block.getIndex());
            }
            if (!candidate.isEmpty()
                    && !candidate.get(candidate.size() - 1).getHash().equals(block.getPreviousHash())) {
                throw new InvalidBlockException("区块 #" + block.getIndex() + " 未连接到前一个区块");
            }
            candidate.add(block);
        }
    }
}
