package com.zia.ziacoinsystem.application.service.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MiningStatusVO {

    private boolean mining;//是否在持续挖矿
    private String state;//当前挖矿阶段
    private int difficulty;//当前难度
    private long height;//最新区块高度
    private int pendingTransactions;//交易池大小
    private long blocksMined;//本节点已挖出区块数
    private long currentNonce;//当前尝试的nonce
}
