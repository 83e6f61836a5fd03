package com.zia.ziacoinsystem.data.blockChain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 持久化的链状态
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChainState implements Serializable {
    private long height;//最新区块高度
    private String latestBlockHash;//最新区块hash
    private int difficulty;//当前挖矿难度
}
