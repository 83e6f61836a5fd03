package com.zia.ziacoinsystem.storage;

import com.zia.ziacoinsystem.ChainFixtures;
import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.blockChain.ChainState;
import com.zia.ziacoinsystem.exception.StorageException;
import com.zia.ziacoinsystem.util.CryptoUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

public class RocksDbChainStorageTest {

    @TempDir
    Path tempDir;

    private RocksDbChainStorage storage;

    @BeforeEach
    void setUp() {
        storage = new RocksDbChainStorage(tempDir.toString());
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private List<Block> saveChain(int length) {
        List<Block> chain = ChainFixtures.extendChain(List.of(Block.createGenesisBlock()), length,
                CryptoUtil.ECDSASigner.generateKeyPair(), 1);
        for (Block block : chain) {
            storage.saveBlock(block);
        }
        Block tip = chain.get(chain.size() - 1);
        storage.saveChainState(new ChainState(tip.getIndex(), tip.getHash(), 2));
        return chain;
    }

    @Test
    void emptyStorageHasNoChain() {
        Assertions.assertTrue(storage.loadChainState().isEmpty());
        Assertions.assertTrue(storage.loadChain().isEmpty());
        Assertions.assertTrue(storage.loadBlock("missing").isEmpty());
    }

    @Test
    void blocksAndChainStateRoundTrip() {
        List<Block> chain = saveChain(3);

        Block loaded = storage.loadBlock(chain.get(2).getHash()).orElseThrow();
        Assertions.assertEquals(chain.get(2), loaded);
        Assertions.assertEquals(chain.get(2).getTransactions().get(0).getAmount(), loaded.getTransactions().get(0).getAmount());

        ChainState state = storage.loadChainState().orElseThrow();
        Assertions.assertEquals(3, state.getHeight());
        Assertions.assertEquals(2, state.getDifficulty());
        Assertions.assertEquals(chain, storage.loadChain());
    }

    @Test
    void chainSurvivesReopen() {
        List<Block> chain = saveChain(2);
        storage.close();
        storage = new RocksDbChainStorage(tempDir.toString());
        Assertions.assertEquals(chain, storage.loadChain());
    }

    @Test
    void restoreReturnsToBackup() {
        List<Block> chain = saveChain(2);
        storage.backup("latest");

        Block extra = ChainFixtures.mineBlock(chain.get(2), List.of(), 1);
        storage.saveBlock(extra);
        storage.saveChainState(new ChainState(extra.getIndex(), extra.getHash(), 2));
        Assertions.assertEquals(4, storage.loadChain().size());

        storage.restore("latest");
        Assertions.assertEquals(chain, storage.loadChain());
        Assertions.assertTrue(storage.loadBlock(extra.getHash()).isEmpty());
    }

    @Test
    void backupOverwritesSameName() {
        saveChain(1);
        storage.backup("latest");
        List<Block> longer = saveChain(3);
        storage.backup("latest");
        storage.restore("latest");
        Assertions.assertEquals(longer.get(3).getHash(), storage.loadChainState().orElseThrow().getLatestBlockHash());
    }

    @Test
    void restoreOfUnknownBackupFails() {
        Assertions.assertThrows(StorageException.class, () -> storage.restore("nope"));
    }
}
