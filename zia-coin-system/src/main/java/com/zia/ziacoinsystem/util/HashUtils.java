package com.zia.ziacoinsystem.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.zia.ziacoinsystem.data.transaction.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * 区块/交易哈希与默克尔根计算 纯函数
 */
public class HashUtils {

    //规范序列化：不转义HTML字符 不格式化 键顺序由调用方按字母序写入
    private static final Gson CANONICAL_GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    public static String toCanonicalString(JsonObject jsonObject) {
        return CANONICAL_GSON.toJson(jsonObject);
    }

    public static String hashCanonical(JsonObject jsonObject) {
        return CryptoUtil.sha256Hex(toCanonicalString(jsonObject));
    }

    /**
     * 计算默克尔根
     * 每笔交易先做规范序列化的SHA-256，之后两两拼接十六进制串再哈希，奇数个时复制最后一个
     * 空列表返回空字节串的SHA-256
     */
    public static String calculateMerkleRoot(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return CryptoUtil.sha256Hex("");
        }
        List<String> level = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            level.add(transaction.calculateHash());
        }
        while (level.size() > 1) {
            if (level.size() % 2 != 0) {
                level.add(level.get(level.size() - 1));
            }
            List<String> next = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2) {
                next.add(CryptoUtil.sha256Hex(level.get(i) + level.get(i + 1)));
            }
            level = next;
        }
        return level.get(0);
    }
}
