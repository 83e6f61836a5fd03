package com.zia.ziacoinsystem.network.enums;

public enum NodeStatus {
    ACTIVE,//在线
    INACTIVE//离线 网络请求失败后标记
}
