package com.zia.ziacoinsystem.storage;

import org.rocksdb.ColumnFamilyOptions;

public enum ColumnFamily {
    //hash -> 区块
    BLOCK("CF_BLOCK", "block", new ColumnFamilyOptions()),
    //区块链信息 链状态等
    BLOCK_CHAIN("CF_BLOCK_CHAIN", "blockChain", new ColumnFamilyOptions()),
    ;
    final String logicalName;
    final String actualName;
    final ColumnFamilyOptions options;
    ColumnFamily(String logicalName, String actualName, ColumnFamilyOptions options) {
        this.logicalName = logicalName;
        this.actualName = actualName;
        this.options = options;
    }
}
