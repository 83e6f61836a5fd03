package com.zia.ziacoinsystem.storage;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.blockChain.ChainState;
import com.zia.ziacoinsystem.exception.StorageException;
import com.zia.ziacoinsystem.util.SerializeUtils;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * 基于RocksDB的区块链存储
 * 区块按hash存放在BLOCK列族，链状态存放在BLOCK_CHAIN列族；备份使用RocksDB Checkpoint
 */
@Slf4j
public class RocksDbChainStorage implements ChainStorage {

    private static final byte[] KEY_CHAIN_STATE = "key_chain_state".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final Path dbPath;
    private final Path backupRoot;
    //普通读写用读锁，恢复/关闭时用写锁独占数据库句柄
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Map<ColumnFamily, ColumnFamilyHandle> handles = new EnumMap<>(ColumnFamily.class);
    private DBOptions dbOptions;
    private RocksDB db;

    public RocksDbChainStorage(String storagePath) {
        this.dbPath = Paths.get(storagePath, "blockChain", "chain.db");
        this.backupRoot = Paths.get(storagePath, "backups");
        try {
            open();
        } catch (RocksDBException | IOException e) {
            log.error("初始化数据库失败: {}", dbPath, e);
            throw new StorageException("数据库初始化失败", e);
        }
        log.info("区块链数据库已打开: {}", dbPath);
    }

    private void open() throws RocksDBException, IOException {
        Files.createDirectories(dbPath);
        List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        // 默认列族（必须包含）
        cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));
        for (ColumnFamily cf : ColumnFamily.values()) {
            cfDescriptors.add(new ColumnFamilyDescriptor(cf.actualName.getBytes(StandardCharsets.UTF_8), cf.options));
        }
        dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL)
                .setMaxLogFileSize(1024 * 1024)
                .setKeepLogFileNum(2);
        db = RocksDB.open(dbOptions, dbPath.toString(), cfDescriptors, cfHandles);
        // 跳过默认列族（索引0）
        handles.clear();
        for (int i = 0; i < ColumnFamily.values().length; i++) {
            handles.put(ColumnFamily.values()[i], cfHandles.get(i + 1));
        }
    }

    private ColumnFamilyHandle handle(ColumnFamily cf) {
        if (db == null) {
            throw new StorageException("数据库已关闭");
        }
        return handles.get(cf);
    }

    @Override
    public String saveBlock(Block block) {
        rwLock.readLock().lock();
        try {
            db.put(handle(ColumnFamily.BLOCK), block.getHash().getBytes(StandardCharsets.UTF_8), SerializeUtils.serialize(block));
            return block.getHash();
        } catch (RocksDBException e) {
            log.error("保存区块失败: index={}, hash={}", block.getIndex(), block.getHash(), e);
            throw new StorageException("保存区块失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Optional<Block> loadBlock(String hash) {
        if (hash == null) {
            return Optional.empty();
        }
        rwLock.readLock().lock();
        try {
            byte[] bytes = db.get(handle(ColumnFamily.BLOCK), hash.getBytes(StandardCharsets.UTF_8));
            return Optional.ofNullable((Block) SerializeUtils.deSerialize(bytes));
        } catch (RocksDBException e) {
            log.error("读取区块失败: hash={}", hash, e);
            throw new StorageException("读取区块失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void saveChainState(ChainState state) {
        rwLock.readLock().lock();
        try {
            db.put(handle(ColumnFamily.BLOCK_CHAIN), KEY_CHAIN_STATE, SerializeUtils.serialize(state));
        } catch (RocksDBException e) {
            log.error("保存链状态失败: {}", state, e);
            throw new StorageException("保存链状态失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Optional<ChainState> loadChainState() {
        rwLock.readLock().lock();
        try {
            byte[] bytes = db.get(handle(ColumnFamily.BLOCK_CHAIN), KEY_CHAIN_STATE);
            return Optional.ofNullable((ChainState) SerializeUtils.deSerialize(bytes));
        } catch (RocksDBException e) {
            log.error("读取链状态失败", e);
            throw new StorageException("读取链状态失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public List<Block> loadChain() {
        Optional<ChainState> state = loadChainState();
        if (state.isEmpty()) {
            return new ArrayList<>();
        }
        List<Block> chain = new ArrayList<>();
        String hash = state.get().getLatestBlockHash();
        long remaining = state.get().getHeight() + 1;
        while (hash != null && remaining-- > 0) {
            final String current = hash;
            Block block = loadBlock(current)
                    .orElseThrow(() -> new StorageException("区块缺失: " + current));
            chain.add(block);
            if (block.getIndex() == 0) {
                break;
            }
            hash = block.getPreviousHash();
        }
        // 回溯得到的是倒序
        Collections.reverse(chain);
        return chain;
    }

    @Override
    public void backup(String name) {
        Path target = backupRoot.resolve(name);
        rwLock.readLock().lock();
        try {
            Files.createDirectories(backupRoot);
            deleteRecursively(target);
            // Checkpoint要求目标目录不存在
            try (Checkpoint checkpoint = Checkpoint.create(db)) {
                checkpoint.createCheckpoint(target.toString());
            }
            log.info("区块链备份完成: {}", target);
        } catch (RocksDBException | IOException e) {
            log.error("区块链备份失败: {}", target, e);
            throw new StorageException("区块链备份失败: " + name, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void restore(String name) {
        Path source = backupRoot.resolve(name);
        if (!Files.isDirectory(source)) {
            throw new StorageException("备份不存在: " + name);
        }
        rwLock.writeLock().lock();
        try {
            closeInternal();
            deleteRecursively(dbPath);
            copyRecursively(source, dbPath);
            open();
            log.info("已从备份 {} 恢复区块链", name);
        } catch (RocksDBException | IOException e) {
            log.error("从备份恢复失败: {}", name, e);
            throw new StorageException("从备份恢复失败: " + name, e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                log.info("关闭数据库资源...");
            }
            closeInternal();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 内部关闭方法，统一处理资源释放
     */
    private void closeInternal() {
        for (ColumnFamilyHandle handle : handles.values()) {
            handle.close();
        }
        handles.clear();
        if (db != null) {
            db.close();
            db = null;
        }
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = new ArrayList<>();
            walk.forEach(paths::add);
            Collections.reverse(paths);
            for (Path p : paths) {
                Files.delete(p);
            }
        }
    }

    private static void copyRecursively(Path source, Path target) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            List<Path> paths = new ArrayList<>();
            walk.forEach(paths::add);
            for (Path p : paths) {
                Path dest = target.resolve(source.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(dest);
                } else {
                    Files.copy(p, dest);
                }
            }
        }
    }
}
