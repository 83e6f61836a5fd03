package com.zia.ziacoinsystem.service.blockChain;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.exception.InvalidBlockException;
import com.zia.ziacoinsystem.exception.InvalidSignatureException;
import com.zia.ziacoinsystem.exception.RecoveryFailedException;

import java.math.BigDecimal;
import java.util.List;

/**
 * 账本：有序区块链与待打包交易池的唯一持有者
 * 所有修改操作互斥执行，读操作返回一致的快照
 */
public interface BlockChainService {

    /**
     * 添加交易到交易池
     * @return 交易预计所在的区块高度（最新高度+1）
     * @throws InvalidSignatureException 签名验证失败，交易池不变
     */
    long addTransaction(Transaction transaction) throws InvalidSignatureException;

    /**
     * 从高度1开始逐块校验hash、前序hash、默克尔根、难度与交易签名
     */
    boolean isChainValid();

    BigDecimal getBalance(String address);

    /**
     * 链无效时从最近一次备份恢复；只尝试一次
     */
    void recoverChain() throws RecoveryFailedException;

    /**
     * 原子地取出并清空交易池
     */
    List<Transaction> drainPendingTransactions();

    /**
     * 将未被打包的交易放回交易池 已上链的交易会被忽略
     */
    void restorePendingTransactions(List<Transaction> transactions);

    List<Transaction> getPendingTransactions();

    /**
     * 追加一个连接到链尾的区块并持久化，同时设置之后使用的难度
     */
    void appendBlock(Block block, int nextDifficulty) throws InvalidBlockException;

    /**
     * 追加区块 难度保持不变
     */
    void appendBlock(Block block) throws InvalidBlockException;

    /**
     * 候选链更长且完整有效时整体替换本地链
     * @return 是否替换
     */
    boolean replaceChain(List<Block> candidate);

    /**
     * 校验一条以创世区块开头的完整链
     */
    boolean isValidChain(List<Block> candidate);

    /**
     * 闭区间[start, end]内的区块 超出范围部分会被截掉
     */
    List<Block> getBlocks(long start, long end);

    List<Block> getChain();

    Block getLatestBlock();

    String getLatestBlockHash();

    long getHeight();

    boolean containsBlock(String hash);

    String getGenesisHash();

    int getDifficulty();

    void setDifficulty(int difficulty);

    /**
     * 将当前链状态写入存储
     */
    void flush();
}
