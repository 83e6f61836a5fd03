package com.zia.ziacoinsystem.util;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.MIN_DIFFICULTY;

public class DifficultyUtils {

    /**
     * hash是否至少有difficulty个前导'0'
     */
    public static boolean meetsDifficulty(String hash, int difficulty) {
        if (hash == null || difficulty < 0 || hash.length() < difficulty) {
            return false;
        }
        for (int i = 0; i < difficulty; i++) {
            if (hash.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    /**
     * 根据本次出块耗时调整难度
     * 耗时小于目标一半 难度+1；大于目标两倍 难度-1（最低为1）；否则不变
     * @param currentDifficulty 当前难度
     * @param elapsedMillis 本次出块耗时
     * @param targetMillis 目标出块时间
     */
    public static int adjustDifficulty(int currentDifficulty, long elapsedMillis, long targetMillis) {
        if (elapsedMillis * 2 < targetMillis) {
            return currentDifficulty + 1;
        }
        if (elapsedMillis > targetMillis * 2) {
            return Math.max(MIN_DIFFICULTY, currentDifficulty - 1);
        }
        return currentDifficulty;
    }
}
