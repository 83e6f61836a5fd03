package com.zia.ziacoinsystem.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DifficultyUtilsTest {

    private static final long TARGET = 60_000;

    @Test
    void fastBlockRaisesDifficulty() {
        Assertions.assertEquals(5, DifficultyUtils.adjustDifficulty(4, (long) (TARGET * 0.4), TARGET));
    }

    @Test
    void slowBlockLowersDifficulty() {
        Assertions.assertEquals(3, DifficultyUtils.adjustDifficulty(4, TARGET * 3, TARGET));
    }

    @Test
    void difficultyNeverDropsBelowOne() {
        Assertions.assertEquals(1, DifficultyUtils.adjustDifficulty(1, TARGET * 10, TARGET));
    }

    @Test
    void blockWithinWindowKeepsDifficulty() {
        Assertions.assertEquals(4, DifficultyUtils.adjustDifficulty(4, TARGET / 2, TARGET));
        Assertions.assertEquals(4, DifficultyUtils.adjustDifficulty(4, TARGET, TARGET));
        Assertions.assertEquals(4, DifficultyUtils.adjustDifficulty(4, TARGET * 2, TARGET));
    }

    @Test
    void meetsDifficultyCountsLeadingZeros() {
        Assertions.assertTrue(DifficultyUtils.meetsDifficulty("000abc", 3));
        Assertions.assertFalse(DifficultyUtils.meetsDifficulty("00abc0", 3));
        Assertions.assertTrue(DifficultyUtils.meetsDifficulty("abc", 0));
        Assertions.assertFalse(DifficultyUtils.meetsDifficulty(null, 1));
        Assertions.assertFalse(DifficultyUtils.meetsDifficulty("00", 3));
    }
}
