package com.zia.ziacoinsystem.data.block.dto;

import com.zia.ziacoinsystem.data.block.Block;
import com.zia.ziacoinsystem.data.transaction.Transaction;
import com.zia.ziacoinsystem.data.transaction.dto.TransactionDTO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 网络传输用区块
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockDTO {
    private Long index;
    private Long timestamp;
    private List<TransactionDTO> transactions;
    private String previousHash;
    private Long nonce;
    private Integer difficulty;
    private String merkleRoot;
    private String hash;

    public static BlockDTO fromBlock(Block block) {
        List<TransactionDTO> txs = new ArrayList<>(block.getTransactions().size());
        for (Transaction transaction : block.getTransactions()) {
            txs.add(TransactionDTO.fromTransaction(transaction));
        }
        return new BlockDTO(
                block.getIndex(),
                block.getTimestamp(),
                txs,
                block.getPreviousHash(),
                block.getNonce(),
                block.getDifficulty(),
                block.getMerkleRoot(),
                block.getHash());
    }

    /**
     * 缺失的必填字段 包括区块内交易的字段
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (index == null) missing.add("index");
        if (timestamp == null) missing.add("timestamp");
        if (transactions == null) missing.add("transactions");
        if (previousHash == null) missing.add("previous_hash");
        if (nonce == null) missing.add("nonce");
        if (difficulty == null) missing.add("difficulty");
        if (merkleRoot == null) missing.add("merkle_root");
        if (hash == null) missing.add("hash");
        if (transactions != null) {
            for (int i = 0; i < transactions.size(); i++) {
                TransactionDTO tx = transactions.get(i);
                if (tx == null) {
                    missing.add("transactions[" + i + "]");
                    continue;
                }
                for (String field : tx.missingFields()) {
                    missing.add("transactions[" + i + "]." + field);
                }
            }
        }
        return missing;
    }

    public Block toBlock() {
        List<Transaction> txs = new ArrayList<>(transactions.size());
        for (TransactionDTO dto : transactions) {
            txs.add(dto.toTransaction());
        }
        return Block.builder()
                .index(index)
                .timestamp(timestamp)
                .transactions(txs)
                .previousHash(previousHash)
                .nonce(nonce)
                .difficulty(difficulty)
                .merkleRoot(merkleRoot)
                .hash(hash)
                .build();
    }
}
