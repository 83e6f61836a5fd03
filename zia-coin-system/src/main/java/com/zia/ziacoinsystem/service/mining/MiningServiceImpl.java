package com.zia.ziacoinsystem.service.mining;

import com.zia.ziacoinsystem.application.service.vo.MiningStatusVO;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.event.BlockMinedEvent;
import com.zia.ziacoinsystem.exception.InvalidBlockException;
import com.zia.ziacoinsystem.exception.StorageException;
import com.zia.ziacoinsystem.service.blockChain.BlockChainService;
import com.zia.ziacoinsystem.util.DifficultyUtils;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 工作量证明挖矿
 * 同一时间只有一次挖矿尝试；停止、线程中断或链尾变化时取消本次尝试并把交易放回交易池
 */
@Slf4j
public class MiningServiceImpl {

    public enum MiningState {
        IDLE,//空闲
        ASSEMBLING,//打包交易
        SEARCHING,//搜索nonce
        SEALED//已找到nonce 正在提交
    }

    //交易池为空时的等待时间
    private static final long IDLE_WAIT_MS = 1000;
    private static final long NONCE_REPORT_INTERVAL = 10_000;

    private final BlockChainService blockChainService;
    private final ApplicationEventPublisher eventPublisher;
    private final long targetBlockTime;

    private final ReentrantLock miningLock = new ReentrantLock();
    //每次取消加1 正在进行的尝试发现编号变化即退出
    private final AtomicLong cancelEpoch = new AtomicLong();
    private final AtomicLong blocksMined = new AtomicLong();
    private volatile MiningState state = MiningState.IDLE;
    private volatile long currentNonce;
    //是否在持续挖矿 保证变量的可见性
    private volatile boolean isMining = false;
    private ThreadPoolExecutor miningExecutor;

    public MiningServiceImpl(BlockChainService blockChainService, ApplicationEventPublisher eventPublisher, long targetBlockTime) {
        this.blockChainService = blockChainService;
        this.eventPublisher = eventPublisher;
        this.targetBlockTime = targetBlockTime;
    }

    /**
     * 打包交易池中的全部交易并挖出一个区块
     * @return 新区块；交易池为空、已有挖矿在进行或本次被取消时返回null
     */
    public Block minePendingTransactions() {
        if (!miningLock.tryLock()) {
            log.debug("已有挖矿任务在进行");
            return null;
        }
        long epoch = cancelEpoch.get();
        try {
            state = MiningState.ASSEMBLING;
            long start = System.currentTimeMillis();
            List<Transaction> transactions = blockChainService.drainPendingTransactions();
            if (transactions.isEmpty()) {
                log.debug("没有可用的交易");
                return null;
            }
            Block latestBlock = blockChainService.getLatestBlock();
            int difficulty = blockChainService.getDifficulty();
            Block newBlock = Block.builder()
                    .index(latestBlock.getIndex() + 1)
                    .timestamp(System.currentTimeMillis())
                    .transactions(new ArrayList<>(transactions))
                    .previousHash(latestBlock.getHash())
                    .nonce(0)
                    .difficulty(difficulty)
                    .build();
            newBlock.calculateAndSetMerkleRoot();
            log.info("开始挖矿新区块 #{} (难度: {}, 交易数: {})", newBlock.getIndex(), difficulty, transactions.size());

            state = MiningState.SEARCHING;
            MiningResult result = searchNonce(newBlock, latestBlock.getHash(), epoch);
            if (!result.found) {
                log.info("区块 #{} 挖矿已取消，交易放回交易池", newBlock.getIndex());
                blockChainService.restorePendingTransactions(transactions);
                return null;
            }
            state = MiningState.SEALED;
            newBlock.setNonce(result.nonce);
            newBlock.setHash(result.hash);
            long elapsed = System.currentTimeMillis() - start;
            int nextDifficulty = DifficultyUtils.adjustDifficulty(difficulty, elapsed, targetBlockTime);
            try {
                blockChainService.appendBlock(newBlock, nextDifficulty);
            } catch (InvalidBlockException e) {
                log.warn("新区块 #{} 提交失败: {}", newBlock.getIndex(), e.getMessage());
                blockChainService.restorePendingTransactions(transactions);
                return null;
            } catch (StorageException e) {
                log.error("新区块 #{} 持久化失败，交易放回交易池", newBlock.getIndex(), e);
                blockChainService.restorePendingTransactions(transactions);
                throw e;
            }
            blocksMined.incrementAndGet();
            log.info("挖矿成功 区块 #{} hash:{} nonce:{} 耗时:{}ms 下一难度:{}",
                    newBlock.getIndex(), newBlock.getHash(), result.nonce, elapsed, nextDifficulty);
            eventPublisher.publishEvent(new BlockMinedEvent(this, newBlock));
            return newBlock;
        } finally {
            state = MiningState.IDLE;
            miningLock.unlock();
        }
    }

    private MiningResult searchNonce(Block block, String parentHash, long epoch) {
        MiningResult result = new MiningResult();
        for (long nonce = 0; nonce < Long.MAX_VALUE; nonce++) {
            if (isCancelled(parentHash, epoch)) {
                return result;
            }
            block.setNonce(nonce);
            String hash = block.calculateHash();
            if (DifficultyUtils.meetsDifficulty(hash, block.getDifficulty())) {
                currentNonce = nonce;
                result.found = true;
                result.nonce = nonce;
                result.hash = hash;
                return result;
            }
            if (nonce % NONCE_REPORT_INTERVAL == 0) {
                currentNonce = nonce;
            }
        }
        return result;
    }

    private boolean isCancelled(String parentHash, long epoch) {
        return cancelEpoch.get() != epoch
                || Thread.currentThread().isInterrupted()
                || !parentHash.equals(blockChainService.getLatestBlockHash());
    }

    /**
     * 取消当前挖矿尝试 持续挖矿不受影响
     */
    public void cancelCurrentAttempt() {
        cancelEpoch.incrementAndGet();
    }

    private void initMiningExecutor() {
        if (miningExecutor == null || miningExecutor.isShutdown() || miningExecutor.isTerminated()) {
            ThreadFactory threadFactory = r -> {
                Thread thread = new Thread(r, "mining-main-thread");
                thread.setDaemon(false);
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("挖矿线程[" + t.getName() + "]发生未捕获异常", e)
                );
                return thread;
            };
            RejectedExecutionHandler rejectedHandler = (r, executor) ->
                    log.warn("挖矿线程池忙碌，无法提交新任务");
            miningExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new SynchronousQueue<>(), threadFactory, rejectedHandler);
        }
    }

    /**
     * 启动持续挖矿
     * @return 已在挖矿时返回false
     */
    public synchronized boolean startMining() {
        if (isMining) {
            log.warn("节点已在挖矿");
            return false;
        }
        initMiningExecutor();
        isMining = true;
        miningExecutor.submit(this::miningLoop);
        log.info("持续挖矿已启动 当前难度:{}", blockChainService.getDifficulty());
        return true;
    }

    private void miningLoop() {
        while (isMining && !Thread.currentThread().isInterrupted()) {
            try {
                if (blockChainService.getPendingTransactions().isEmpty()) {
                    Thread.sleep(IDLE_WAIT_MS);
                    continue;
                }
                minePendingTransactions();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("挖矿过程发生异常，继续下一轮", e);
            }
        }
    }

    /**
     * 停止持续挖矿 当前尝试会被取消
     * @return 未在挖矿时返回false
     */
    public synchronized boolean stopMining() {
        if (!isMining) {
            return false;
        }
        isMining = false;
        cancelCurrentAttempt();
        if (miningExecutor != null) {
            miningExecutor.shutdown();
            try {
                if (!miningExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    List<Runnable> remainingTasks = miningExecutor.shutdownNow();
                    log.warn("挖矿线程池强制关闭，剩余未执行任务数：{}", remainingTasks.size());
                }
            } catch (InterruptedException e) {
                miningExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            } finally {
                miningExecutor = null;
            }
        }
        log.info("挖矿已停止");
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stopMining();
    }

    public boolean isMining() {
        return isMining;
    }

    public MiningState getState() {
        return state;
    }

    public MiningStatusVO getMiningStatus() {
        return MiningStatusVO.builder()
                .mining(isMining)
                .state(state.name())
                .difficulty(blockChainService.getDifficulty())
                .height(blockChainService.getHeight())
                .pendingTransactions(blockChainService.getPendingTransactions().size())
                .blocksMined(blocksMined.get())
                .currentNonce(currentNonce)
                .build();
    }

    static class MiningResult {
        String hash;
        long nonce;
        boolean found = false;
    }
}
