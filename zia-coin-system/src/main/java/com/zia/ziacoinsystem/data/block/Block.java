package com.zia.ziacoinsystem.data.block;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.util.DifficultyUtils;
import com.zia.ziacoinsystem.util.HashUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Block implements Serializable {

    private long index;//区块高度
    private long timestamp;//出块时间 毫秒
    @Builder.Default
    private List<Transaction> transactions = new ArrayList<>();//区块中的交易 有序
    private String previousHash;//前一个区块hash
    private long nonce;//随机数
    private int difficulty;//难度 前导0个数
    private String merkleRoot;//默克尔根
    private String hash;//区块hash


    /**
     * 规范序列化 除hash外的所有字段 键按字母序
     */
    public JsonObject toCanonicalJson() {
        JsonObject json = new JsonObject();
        json.addProperty("difficulty", difficulty);
        json.addProperty("index", index);
        json.addProperty("merkle_root", merkleRoot);
        json.addProperty("nonce", nonce);
        json.addProperty("previous_hash", previousHash);
        json.addProperty("timestamp", timestamp);
        JsonArray txs = new JsonArray();
        for (Transaction transaction : transactions) {
            txs.add(transaction.toCanonicalJson());
        }
        json.add("transactions", txs);
        return json;
    }

    public String calculateHash() {
        return HashUtils.hashCanonical(toCanonicalJson());
    }

    public void calculateAndSetMerkleRoot() {
        this.merkleRoot = HashUtils.calculateMerkleRoot(transactions);
    }

    public boolean meetsDifficulty() {
        return DifficultyUtils.meetsDifficulty(hash, difficulty);
    }

    /**
     * 创世区块 所有字段固定，nonce取满足难度的最小值，各节点得到同一个hash
     */
    public static Block createGenesisBlock() {
        Block genesis = Block.builder()
                .index(0)
                .timestamp(GENESIS_TIMESTAMP)
                .transactions(new ArrayList<>())
                .previousHash(GENESIS_PREV_BLOCK_HASH)
                .nonce(0)
                .difficulty(GENESIS_DIFFICULTY)
                .build();
        genesis.calculateAndSetMerkleRoot();
        String hash = genesis.calculateHash();
        while (!DifficultyUtils.meetsDifficulty(hash, GENESIS_DIFFICULTY)) {
            genesis.setNonce(genesis.getNonce() + 1);
            hash = genesis.calculateHash();
        }
        genesis.setHash(hash);
        return genesis;
    }
}
