package com.zia.ziacoinsystem.config;

import com.zia.ziacoinsystem.constant.BlockChainConstants;
import com.zia.ziacoinsystem.network.common.BootstrapNode;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {

    private int netVersion = 1;

    private String storagePath = "data/";

    //本节点对外地址
    private String host = "127.0.0.1";
    private int port = 5000;

    // 引导节点列表（从配置文件读取）
    private List<BootstrapNode> bootstrap = new ArrayList<>();

    private int bucketSize = 20;

    private int initialDifficulty = BlockChainConstants.INITIAL_DIFFICULTY;
    //目标出块时间 毫秒
    private long targetBlockTime = BlockChainConstants.TARGET_BLOCK_TIME;
    //启动后是否持续挖矿
    private boolean miningEnabled = false;

    //定时任务间隔 秒
    private long discoveryInterval = 300;
    private long cleanupInterval = 300;
    private long syncInterval = 60;
    private long healthCheckInterval = 600;

    //节点过期时间 毫秒
    private long nodeExpirationTime = BlockChainConstants.NODE_EXPIRATION_TIME;
    //网络请求超时 毫秒
    private int requestTimeout = BlockChainConstants.REQUEST_TIMEOUT;

    @PostConstruct
    public void init() {
        log.info("网络版本:{}", netVersion);
        log.info("存储路径:{}", storagePath);
        log.info("节点地址:{}:{}", host, port);
        log.info("引导节点:{}", bootstrap);
        log.info("初始难度:{} 目标出块时间:{}ms 自动挖矿:{}", initialDifficulty, targetBlockTime, miningEnabled);
    }
}
