package com.zia.ziacoinsystem.constant;

public class BlockChainConstants {

    //创世区块前序hash 64个0
    public static final String GENESIS_PREV_BLOCK_HASH = "0".repeat(64);

    //创世区块时间 固定值 保证所有节点创世hash一致
    public static final long GENESIS_TIMESTAMP = 0L;

    //创世区块难度
    public static final int GENESIS_DIFFICULTY = 1;

    //初始挖矿难度（前导0个数）
    public static final int INITIAL_DIFFICULTY = 4;

    //目标出块时间 毫秒
    public static final long TARGET_BLOCK_TIME = 60 * 1000L;

    //最低难度
    public static final int MIN_DIFFICULTY = 1;

    //交易时间有效窗口 1小时
    public static final long TRANSACTION_FRESHNESS_WINDOW = 60 * 60 * 1000L;

    //节点过期时间 1小时未响应
    public static final long NODE_EXPIRATION_TIME = 60 * 60 * 1000L;

    //网络请求超时 毫秒
    public static final int REQUEST_TIMEOUT = 5000;

    //单次get_blocks返回的最大区块数
    public static final int MAX_BLOCKS_PER_REQUEST = 500;

    //健康检查使用的备份名
    public static final String LATEST_BACKUP_NAME = "latest";
}
