package com.zia.ziacoinsystem.network.protocol.messageHandler;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.network.protocol.message.BlocksMessage;
import com.zia.ziacoinsystem.network.protocol.message.GetBlocksMessage;
import com.zia.ziacoinsystem.network.protocol.message.ProtocolMessage;
import com.zia.ziacoinsystem.network.service.NodeServer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.MAX_BLOCKS_PER_REQUEST;

/**
 * 返回闭区间内的区块 单次最多MAX_BLOCKS_PER_REQUEST个
 */
@Slf4j
public class GetBlocksMessageHandler implements MessageHandler {

    @Override
    public ProtocolMessage handleMessage(NodeServer nodeServer, ProtocolMessage message) {
        GetBlocksMessage request = (GetBlocksMessage) message;
        List<BlockDTO> result = new ArrayList<>();
        if (request.getStartHeight() == null || request.getEndHeight() == null
                || request.getStartHeight() > request.getEndHeight()) {
            log.warn("无效的区块范围请求: {}", request);
            return new BlocksMessage(result);
        }
        long start = Math.max(0, request.getStartHeight());
        long end = Math.min(request.getEndHeight(), start + MAX_BLOCKS_PER_REQUEST - 1);
        for (Block block : nodeServer.getBlockChainService().getBlocks(start, end)) {
            result.add(BlockDTO.fromBlock(block));
        }
        log.debug("返回区块 [{}, {}] 共{}个", start, end, result.size());
        return new BlocksMessage(result);
    }
}
