package com.zia.ziacoinsystem.application.service.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkStatusVO {

    private String nodeId;//节点ID 十六进制
    private String host;
    private int port;
    private int version;//协议版本
    private long height;//最新区块高度
    private String latestBlockHash;
    private int difficulty;
    private int knownPeers;//路由表节点数
    private int activePeers;//在线节点数
    private int pendingTransactions;
    private boolean mining;
}
