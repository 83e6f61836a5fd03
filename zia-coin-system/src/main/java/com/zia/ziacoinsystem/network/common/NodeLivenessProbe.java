package com.zia.ziacoinsystem.network.common;

/**
 * 探测节点是否在线 在路由表锁之外调用 可能阻塞
 */
@FunctionalInterface
public interface NodeLivenessProbe {

    boolean isAlive(ExternalNodeInfo node);
}
