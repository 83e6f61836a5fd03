package com.zia.ziacoinsystem.storage;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.blockChain.ChainState;

import java.util.List;
import java.util.Optional;

/**
 * 区块链持久化
 * 所有方法同步执行，返回即已落盘；失败抛出 StorageException
 */
public interface ChainStorage {

    /**
     * 保存区块
     * @return 区块hash
     */
    String saveBlock(Block block);

    Optional<Block> loadBlock(String hash);

    void saveChainState(ChainState state);

    Optional<ChainState> loadChainState();

    /**
     * 从最新区块沿previous_hash回溯，按高度升序返回整条链；无链状态时返回空列表
     */
    List<Block> loadChain();

    /**
     * 生成名为name的快照，已存在则覆盖
     */
    void backup(String name);

    /**
     * 用名为name的快照替换当前数据
     */
    void restore(String name);

    void close();
}
