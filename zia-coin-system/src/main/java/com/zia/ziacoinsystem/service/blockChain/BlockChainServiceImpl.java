package com.zia.ziacoinsystem.service.blockChain;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.blockChain.ChainState;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.exception.InvalidBlockException;
import com.zia.ziacoinsystem.exception.InvalidSignatureException;
import com.zia.ziacoinsystem.exception.RecoveryFailedException;
import com.zia.ziacoinsystem.exception.StorageException;
import com.zia.ziacoinsystem.service.transaction.TransactionVerifier;
import com.zia.ziacoinsystem.storage.ChainStorage;
import com.zia.ziacoinsystem.util.HashUtils;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.LATEST_BACKUP_NAME;
import static com.zia.ziacoinsystem.constant.BlockChainConstants.MIN_DIFFICULTY;

@Slf4j
public class BlockChainServiceImpl implements BlockChainService {

    private final ChainStorage storage;
    private final TransactionVerifier verifier;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final String genesisHash;
    private List<Block> chain = new ArrayList<>();
    private final Map<String, Block> blockIndex = new HashMap<>();
    private final List<Transaction> pendingTransactions = new ArrayList<>();
    private int difficulty;
    //挖矿线程无锁读取 用于判断链尾是否变化
    private volatile String latestBlockHash;

    public BlockChainServiceImpl(ChainStorage storage, TransactionVerifier verifier, int initialDifficulty) {
        this.storage = storage;
        this.verifier = verifier;
        this.genesisHash = Block.createGenesisBlock().getHash();
        loadChain(initialDifficulty);
    }

    private void loadChain(int initialDifficulty) {
        List<Block> stored = storage.loadChain();
        if (stored.isEmpty()) {
            Block genesis = Block.createGenesisBlock();
            storage.saveBlock(genesis);
            storage.saveChainState(new ChainState(0, genesis.getHash(), initialDifficulty));
            List<Block> fresh = new ArrayList<>();
            fresh.add(genesis);
            installChain(fresh);
            this.difficulty = initialDifficulty;
            log.info("创建创世区块: {}", genesisHash);
            return;
        }
        if (!genesisHash.equals(stored.get(0).getHash())) {
            log.error("存储中的创世区块与本节点不一致: {}", stored.get(0).getHash());
            throw new StorageException("创世区块不一致");
        }
        installChain(stored);
        this.difficulty = storage.loadChainState()
                .map(ChainState::getDifficulty)
                .orElse(initialDifficulty);
        log.info("从存储加载区块链 高度:{} 难度:{}", getLatestBlock().getIndex(), difficulty);
    }

    //调用方需持有写锁或处于构造阶段
    private void installChain(List<Block> blocks) {
        this.chain = new ArrayList<>(blocks);
        blockIndex.clear();
        for (Block block : chain) {
            blockIndex.put(block.getHash(), block);
        }
        this.latestBlockHash = chain.get(chain.size() - 1).getHash();
    }

    @Override
    public long addTransaction(Transaction transaction) throws InvalidSignatureException {
        if (transaction == null || !verifier.verify(transaction)) {
            log.warn("交易签名验证失败，拒绝加入交易池");
            throw new InvalidSignatureException("交易签名验证失败");
        }
        lock.writeLock().lock();
        try {
            pendingTransactions.add(transaction);
            return chain.get(chain.size() - 1).getIndex() + 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isChainValid() {
        return isValidChain(getChain());
    }

    @Override
    public boolean isValidChain(List<Block> candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        if (!genesisHash.equals(candidate.get(0).getHash())) {
            log.warn("创世区块不匹配");
            return false;
        }
        for (int i = 1; i < candidate.size(); i++) {
            Block current = candidate.get(i);
            Block previous = candidate.get(i - 1);
            try {
                checkBlock(current);
            } catch (InvalidBlockException e) {
                log.warn("区块 {} 校验失败: {}", i, e.getMessage());
                return false;
            }
            if (current.getIndex() != previous.getIndex() + 1
                    || !Objects.equals(current.getPreviousHash(), previous.getHash())) {
                log.warn("区块 {} 未连接到前一个区块", i);
                return false;
            }
        }
        return true;
    }

    /**
     * 单个区块的自身校验：hash、难度、默克尔根与交易签名
     */
    private void checkBlock(Block block) throws InvalidBlockException {
        if (block.getHash() == null || !block.getHash().equals(block.calculateHash())) {
            throw new InvalidBlockException("区块hash不正确");
        }
        if (block.getDifficulty() < MIN_DIFFICULTY) {
            throw new InvalidBlockException("区块难度无效: " + block.getDifficulty());
        }
        if (!block.meetsDifficulty()) {
            throw new InvalidBlockException("区块未满足难度要求");
        }
        List<Transaction> transactions = block.getTransactions() == null ? List.of() : block.getTransactions();
        if (!HashUtils.calculateMerkleRoot(transactions).equals(block.getMerkleRoot())) {
            throw new InvalidBlockException("默克尔根不正确");
        }
        for (Transaction transaction : transactions) {
            if (!verifier.verify(transaction)) {
                throw new InvalidBlockException("区块包含签名无效的交易");
            }
        }
    }

    @Override
    public BigDecimal getBalance(String address) {
        lock.readLock().lock();
        try {
            BigDecimal balance = BigDecimal.ZERO;
            for (Block block : chain) {
                for (Transaction transaction : block.getTransactions()) {
                    if (address.equals(transaction.getSender())) {
                        balance = balance.subtract(transaction.getAmount());
                    }
                    if (address.equals(transaction.getRecipient())) {
                        balance = balance.add(transaction.getAmount());
                    }
                }
            }
            return balance;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void recoverChain() throws RecoveryFailedException {
        if (isChainValid()) {
            log.info("区块链有效，无需恢复");
            return;
        }
        log.warn("检测到区块链无效，尝试从备份恢复");
        lock.writeLock().lock();
        try {
            List<Block> restored;
            Optional<ChainState> state;
            try {
                storage.restore(LATEST_BACKUP_NAME);
                restored = storage.loadChain();
                state = storage.loadChainState();
            } catch (StorageException e) {
                throw new RecoveryFailedException("从备份恢复失败", e);
            }
            if (!isValidChain(restored)) {
                throw new RecoveryFailedException("备份中的区块链无效");
            }
            installChain(restored);
            state.ifPresent(s -> this.difficulty = s.getDifficulty());
            log.info("区块链已从备份恢复 高度:{}", getLatestBlock().getIndex());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Transaction> drainPendingTransactions() {
        lock.writeLock().lock();
        try {
            List<Transaction> drained = new ArrayList<>(pendingTransactions);
            pendingTransactions.clear();
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void restorePendingTransactions(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Set<String> confirmed = confirmedSignatures(chain);
            List<Transaction> requeue = new ArrayList<>();
            for (Transaction transaction : transactions) {
                if (!confirmed.contains(transaction.getSignature())) {
                    requeue.add(transaction);
                }
            }
            pendingTransactions.addAll(0, requeue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Transaction> getPendingTransactions() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(pendingTransactions);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void appendBlock(Block block) throws InvalidBlockException {
        appendBlock(block, getDifficulty());
    }

    @Override
    public void appendBlock(Block block, int nextDifficulty) throws InvalidBlockException {
        if (block == null) {
            throw new InvalidBlockException("区块为空");
        }
        checkBlock(block);
        lock.writeLock().lock();
        try {
            Block tip = chain.get(chain.size() - 1);
            if (block.getIndex() != tip.getIndex() + 1 || !tip.getHash().equals(block.getPreviousHash())) {
                throw new InvalidBlockException("区块无法连接到链尾 index=" + block.getIndex());
            }
            //先落盘再修改内存
            storage.saveBlock(block);
            storage.saveChainState(new ChainState(block.getIndex(), block.getHash(), nextDifficulty));
            chain.add(block);
            blockIndex.put(block.getHash(), block);
            latestBlockHash = block.getHash();
            difficulty = nextDifficulty;
            removeConfirmed(List.of(block));
            log.info("区块已上链 高度:{} hash:{} 交易数:{}", block.getIndex(), block.getHash(), block.getTransactions().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean replaceChain(List<Block> candidate) {
        if (!isValidChain(candidate)) {
            log.warn("候选链无效，拒绝替换");
            return false;
        }
        lock.writeLock().lock();
        try {
            if (candidate.size() <= chain.size()) {
                log.debug("候选链不长于本地链 本地:{} 候选:{}", chain.size(), candidate.size());
                return false;
            }
            Block tip = candidate.get(candidate.size() - 1);
            for (Block block : candidate) {
                if (!blockIndex.containsKey(block.getHash())) {
                    storage.saveBlock(block);
                }
            }
            storage.saveChainState(new ChainState(tip.getIndex(), tip.getHash(), tip.getDifficulty()));
            installChain(candidate);
            difficulty = tip.getDifficulty();
            removeConfirmed(chain);
            log.info("本地链已替换 新高度:{}", tip.getIndex());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeConfirmed(List<Block> blocks) {
        Set<String> confirmed = confirmedSignatures(blocks);
        pendingTransactions.removeIf(tx -> confirmed.contains(tx.getSignature()));
    }

    private static Set<String> confirmedSignatures(List<Block> blocks) {
        Set<String> signatures = new HashSet<>();
        for (Block block : blocks) {
            for (Transaction transaction : block.getTransactions()) {
                signatures.add(transaction.getSignature());
            }
        }
        return signatures;
    }

    @Override
    public List<Block> getBlocks(long start, long end) {
        lock.readLock().lock();
        try {
            long from = Math.max(0, start);
            long to = Math.min(end, chain.size() - 1);
            if (from > to) {
                return new ArrayList<>();
            }
            return new ArrayList<>(chain.subList((int) from, (int) to + 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Block> getChain() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(chain);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Block getLatestBlock() {
        lock.readLock().lock();
        try {
            return chain.get(chain.size() - 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getLatestBlockHash() {
        return latestBlockHash;
    }

    @Override
    public long getHeight() {
        return getLatestBlock().getIndex();
    }

    @Override
    public boolean containsBlock(String hash) {
        if (hash == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return blockIndex.containsKey(hash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getGenesisHash() {
        return genesisHash;
    }

    @Override
    public int getDifficulty() {
        lock.readLock().lock();
        try {
            return difficulty;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setDifficulty(int difficulty) {
        lock.writeLock().lock();
        try {
            this.difficulty = difficulty;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    @PreDestroy
    public void flush() {
        lock.readLock().lock();
        try {
            Block tip = chain.get(chain.size() - 1);
            storage.saveChainState(new ChainState(tip.getIndex(), tip.getHash(), difficulty));
            log.info("链状态已写入存储 高度:{}", tip.getIndex());
        } finally {
            lock.readLock().unlock();
        }
    }
}
