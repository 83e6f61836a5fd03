package com.zia.ziacoinsystem.data.block;

import com.zia.ziacoinsystem.ChainFixtures;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.util.CryptoUtil;
import com.zia.ziacoinsystem.util.HashUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.GENESIS_DIFFICULTY;
import static com.zia.ziacoinsystem.constant.BlockChainConstants.GENESIS_PREV_BLOCK_HASH;

public class BlockTest {

    @Test
    void genesisIsDeterministicAndMeetsItsDifficulty() {
        Block first = Block.createGenesisBlock();
        Block second = Block.createGenesisBlock();
        Assertions.assertEquals(first.getHash(), second.getHash());
        Assertions.assertEquals(0, first.getIndex());
        Assertions.assertEquals(GENESIS_PREV_BLOCK_HASH, first.getPreviousHash());
        Assertions.assertEquals(GENESIS_DIFFICULTY, first.getDifficulty());
        Assertions.assertTrue(first.meetsDifficulty());
        Assertions.assertEquals(first.calculateHash(), first.getHash());
    }

    @Test
    void hashChangesWhenAnyFieldChanges() {
        Block block = Block.createGenesisBlock();
        String original = block.calculateHash();
        block.setNonce(block.getNonce() + 1);
        Assertions.assertNotEquals(original, block.calculateHash());
    }

    @Test
    void canonicalJsonKeysAreSorted() {
        String json = HashUtils.toCanonicalString(Block.createGenesisBlock().toCanonicalJson());
        int difficulty = json.indexOf("\"difficulty\"");
        int index = json.indexOf("\"index\"");
        int merkleRoot = json.indexOf("\"merkle_root\"");
        int nonce = json.indexOf("\"nonce\"");
        int previousHash = json.indexOf("\"previous_hash\"");
        int timestamp = json.indexOf("\"timestamp\"");
        int transactions = json.indexOf("\"transactions\"");
        Assertions.assertTrue(difficulty < index && index < merkleRoot && merkleRoot < nonce
                && nonce < previousHash && previousHash < timestamp && timestamp < transactions, json);
        Assertions.assertFalse(json.contains("\"hash\""));
    }

    @Test
    void merkleRootOfEmptyListIsHashOfEmptyString() {
        Assertions.assertEquals(CryptoUtil.sha256Hex(""), HashUtils.calculateMerkleRoot(new ArrayList<>()));
    }

    @Test
    void merkleRootDependsOnOrderAndDuplicatesOddLeaf() {
        KeyPair keyPair = CryptoUtil.ECDSASigner.generateKeyPair();
        Transaction a = ChainFixtures.signedTransaction(keyPair, "alice", "1");
        Transaction b = ChainFixtures.signedTransaction(keyPair, "bob", "2");
        Transaction c = ChainFixtures.signedTransaction(keyPair, "carol", "3");

        Assertions.assertEquals(a.calculateHash(), HashUtils.calculateMerkleRoot(List.of(a)));
        Assertions.assertEquals(HashUtils.calculateMerkleRoot(List.of(a, b)), HashUtils.calculateMerkleRoot(List.of(a, b)));
        Assertions.assertNotEquals(HashUtils.calculateMerkleRoot(List.of(a, b)), HashUtils.calculateMerkleRoot(List.of(b, a)));

        String ab = CryptoUtil.sha256Hex(a.calculateHash() + b.calculateHash());
        String cc = CryptoUtil.sha256Hex(c.calculateHash() + c.calculateHash());
        Assertions.assertEquals(CryptoUtil.sha256Hex(ab + cc), HashUtils.calculateMerkleRoot(List.of(a, b, c)));
    }

    @Test
    void transactionSignatureCoversAmount() {
        KeyPair keyPair = CryptoUtil.ECDSASigner.generateKeyPair();
        Transaction transaction = ChainFixtures.signedTransaction(keyPair, "alice", "10");
        byte[] signature = CryptoUtil.hexToBytes(transaction.getSignature());
        Assertions.assertTrue(CryptoUtil.ECDSASigner.verifySignature(keyPair.getPublic(), transaction.signatureData(), signature));

        transaction.setAmount(new BigDecimal("11"));
        Assertions.assertFalse(CryptoUtil.ECDSASigner.verifySignature(keyPair.getPublic(), transaction.signatureData(), signature));
    }
}
