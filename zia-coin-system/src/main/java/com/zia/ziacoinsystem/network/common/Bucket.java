package com.zia.ziacoinsystem.network.common;

import com.zia.ziacoinsystem.network.enums.NodeStatus;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * K桶 头部为最近活跃的节点，尾部为最久未活跃的节点
 * 不做同步，由RoutingTable的锁保护
 */
@Data
public class Bucket {
    // 桶ID
    private int id;
    //存储节点ID 保证节点顺序
    private LinkedList<BigInteger> nodeIds = new LinkedList<>();
    //ID与节点信息的映射
    private final Map<BigInteger, ExternalNodeInfo> nodeMap = new HashMap<>();
    //最后访问时间
    private long lastAccessTime;


    public Bucket(int id) {
        this.id = id;
    }

    public int size() {
        return nodeIds.size();
    }

    public boolean contains(BigInteger id) {
        return nodeMap.containsKey(id);
    }

    /**
     * 推送到头部 已存在时刷新节点信息
     */
    public void pushToFront(ExternalNodeInfo node) {
        BigInteger nodeId = node.getId();
        nodeIds.remove(nodeId);
        nodeIds.addFirst(nodeId);
        ExternalNodeInfo existingNode = nodeMap.get(nodeId);
        if (existingNode != null) {
            existingNode.setLastSeen(node.getLastSeen());
            existingNode.setNodeStatus(node.getNodeStatus());
            existingNode.setVersion(node.getVersion());
            existingNode.setHeight(node.getHeight());
        } else {
            nodeMap.put(nodeId, node);
        }
        this.lastAccessTime = System.currentTimeMillis();
    }

    /**
     * 添加节点到头部
     */
    public void add(ExternalNodeInfo node) {
        BigInteger nodeId = node.getId();
        if (!nodeMap.containsKey(nodeId)) {
            nodeIds.addFirst(nodeId);
            nodeMap.put(nodeId, node);
            this.lastAccessTime = System.currentTimeMillis();
        }
    }

    public ExternalNodeInfo getNode(BigInteger id) {
        return nodeMap.get(id);
    }

    public void remove(BigInteger nodeId) {
        nodeIds.remove(nodeId);
        nodeMap.remove(nodeId);
        this.lastAccessTime = System.currentTimeMillis();
    }

    /**
     * 推送到末尾 表示活跃度较低
     */
    public void pushToAfter(ExternalNodeInfo node) {
        BigInteger nodeId = node.getId();
        nodeIds.remove(nodeId);
        nodeIds.addLast(nodeId);
        nodeMap.putIfAbsent(nodeId, node);
        this.lastAccessTime = System.currentTimeMillis();
    }

    /**
     * 第一个离线节点 没有返回null
     */
    public ExternalNodeInfo findInactive() {
        for (BigInteger nodeId : nodeIds) {
            ExternalNodeInfo node = nodeMap.get(nodeId);
            if (node.getNodeStatus() == NodeStatus.INACTIVE) {
                return node;
            }
        }
        return null;
    }

    /**
     * 最久未活跃的节点
     */
    public ExternalNodeInfo getOldest() {
        return nodeIds.isEmpty() ? null : nodeMap.get(nodeIds.getLast());
    }

    public List<ExternalNodeInfo> getNodes() {
        List<ExternalNodeInfo> nodes = new ArrayList<>(nodeIds.size());
        for (BigInteger nodeId : nodeIds) {
            nodes.add(nodeMap.get(nodeId));
        }
        return nodes;
    }
}
