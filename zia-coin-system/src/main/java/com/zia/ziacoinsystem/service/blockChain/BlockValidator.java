package com.zia.ziacoinsystem.service.blockChain;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.block.dto.BlockDTO;
import com.zia.ziacoinsystem.exception.InvalidBlockException;

import java.util.List;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.MIN_DIFFICULTY;

/**
 * 网络收到的区块的接收校验
 * 默克尔根与交易签名在追加到账本时校验
 */
public class BlockValidator {

    /**
     * 校验必填字段、hash可复算、满足难度、高度大于1时前一个区块必须已知
     */
    public static Block validateIncoming(BlockDTO dto, BlockChainService blockChainService) throws InvalidBlockException {
        Block block = validateStandalone(dto);
        if (block.getIndex() > 1 && !blockChainService.containsBlock(block.getPreviousHash())) {
            throw new InvalidBlockException("孤块，前一个区块未知: " + block.getPreviousHash());
        }
        return block;
    }

    /**
     * 不依赖本地链的校验 同步下载的区块逐块使用
     */
    public static Block validateStandalone(BlockDTO dto) throws InvalidBlockException {
        if (dto == null) {
            throw new InvalidBlockException("区块为空");
        }
        List<String> missing = dto.missingFields();
        if (!missing.isEmpty()) {
            throw new InvalidBlockException("区块缺少字段: " + missing);
        }
        Block block = dto.toBlock();
        if (block.getDifficulty() < MIN_DIFFICULTY) {
            throw new InvalidBlockException("区块难度无效 index=" + block.getIndex() + " difficulty=" + block.getDifficulty());
        }
        if (!block.getHash().equals(block.calculateHash())) {
            throw new InvalidBlockException("区块hash不正确 index=" + block.getIndex());
        }
        if (!block.meetsDifficulty()) {
            throw new InvalidBlockException("区块未满足难度要求 index=" + block.getIndex());
        }
        return block;
    }
}
