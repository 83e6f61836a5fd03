package com.zia.ziacoinsystem.network.common;

import com.zia.ziacoinsystem.exception.FullBucketException;
import com.zia.ziacoinsystem.network.enums.NodeStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Kademlia路由表
 * 所有修改由同一把锁串行化；读操作返回副本；节点探活在锁外进行
 */
@Slf4j
public class RoutingTable {
    /* 路由表所有者的ID（节点ID） */
    @Getter
    private final BigInteger localNodeId;
    private final List<Bucket> buckets;
    private final NodeSettings nodeSettings;
    private final ReentrantLock lock = new ReentrantLock();
    //桶满时探测最久未活跃节点
    private volatile NodeLivenessProbe livenessProbe = node -> true;

    public RoutingTable(BigInteger localNodeId, NodeSettings nodeSettings) {
        log.debug("初始化路由表");
        this.localNodeId = localNodeId;
        this.nodeSettings = nodeSettings;
        this.buckets = new ArrayList<>(nodeSettings.getIdentifierSize());
        for (int i = 0; i < nodeSettings.getIdentifierSize(); i++) {
            buckets.add(new Bucket(i));
        }
    }

    public void setLivenessProbe(NodeLivenessProbe livenessProbe) {
        this.livenessProbe = livenessProbe;
    }

    /**
     * 桶序号 = 160 - bitLength(local XOR id) 相同ID落在最后一个桶
     */
    public int bucketIndex(BigInteger id) {
        int index = nodeSettings.getIdentifierSize() - localNodeId.xor(id).bitLength();
        return Math.min(index, nodeSettings.getIdentifierSize() - 1);
    }

    public Bucket findBucket(BigInteger id) {
        return buckets.get(bucketIndex(id));
    }

    /**
     * 更新路由表 添加或移动节点到桶头部
     * @return 是否为新加入的节点
     * @throws FullBucketException 节点不在桶中且桶已满
     */
    public boolean update(ExternalNodeInfo node) throws FullBucketException {
        lock.lock();
        try {
            node.setNodeStatus(NodeStatus.ACTIVE);
            node.setLastSeen(new Date());
            node.setDistance(node.getId().xor(localNodeId));
            Bucket bucket = findBucket(node.getId());
            if (bucket.contains(node.getId())) {
                bucket.pushToFront(node);
                return false;
            } else if (bucket.size() < nodeSettings.getBucketSize()) {
                bucket.add(node);
                return true;
            }
            throw new FullBucketException(bucket.getId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 添加节点
     * 已存在则刷新；桶未满直接加入；桶满时先替换离线节点，否则探测最久未活跃节点，失联则替换，在线则丢弃新节点
     * @return 新节点是否在路由表中
     */
    public boolean addNode(ExternalNodeInfo node) {
        if (node.getId().equals(localNodeId)) {
            return false;
        }
        ExternalNodeInfo oldest;
        lock.lock();
        try {
            try {
                update(node);
                return true;
            } catch (FullBucketException e) {
                Bucket bucket = findBucket(node.getId());
                ExternalNodeInfo inactive = bucket.findInactive();
                if (inactive != null) {
                    bucket.remove(inactive.getId());
                    bucket.add(node);
                    log.debug("桶{}已满，离线节点{}被替换", bucket.getId(), inactive.address());
                    return true;
                }
                oldest = bucket.getOldest();
            }
        } finally {
            lock.unlock();
        }

        boolean alive = probe(oldest);

        lock.lock();
        try {
            Bucket bucket = findBucket(node.getId());
            if (bucket.contains(node.getId())) {
                return true;
            }
            if (alive) {
                if (bucket.contains(oldest.getId())) {
                    oldest.setLastSeen(new Date());
                    bucket.pushToFront(oldest);
                }
                log.debug("桶{}已满且最久节点在线，丢弃新节点{}", bucket.getId(), node.address());
                return false;
            }
            bucket.remove(oldest.getId());
            if (bucket.size() < nodeSettings.getBucketSize()) {
                bucket.add(node);
                log.debug("节点{}失联，替换为{}", oldest.address(), node.address());
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private boolean probe(ExternalNodeInfo node) {
        try {
            return livenessProbe.isAlive(node);
        } catch (RuntimeException e) {
            log.debug("探测节点{}失败: {}", node.address(), e.getMessage());
            return false;
        }
    }

    /**
     * 查找与目标最接近的至多k个节点
     * 从目标所在桶开始向两侧扩展，按异或距离升序返回
     */
    public List<ExternalNodeInfo> findNode(BigInteger target) {
        int limit = nodeSettings.getFindNodeSize();
        List<ExternalNodeInfo> result = new ArrayList<>();
        lock.lock();
        try {
            int start = bucketIndex(target);
            addToAnswer(buckets.get(start), result, target);
            for (int i = 1; result.size() < limit; i++) {
                boolean hasPrev = start - i >= 0;
                boolean hasNext = start + i < buckets.size();
                if (!hasPrev && !hasNext) {
                    break;
                }
                if (hasPrev) {
                    addToAnswer(buckets.get(start - i), result, target);
                }
                if (hasNext) {
                    addToAnswer(buckets.get(start + i), result, target);
                }
            }
        } finally {
            lock.unlock();
        }
        Collections.sort(result);
        while (result.size() > limit) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private void addToAnswer(Bucket bucket, List<ExternalNodeInfo> answer, BigInteger target) {
        for (ExternalNodeInfo node : bucket.getNodes()) {
            answer.add(new ExternalNodeInfo(node, target.xor(node.getId())));
        }
    }

    public ExternalNodeInfo getNode(BigInteger id) {
        lock.lock();
        try {
            ExternalNodeInfo node = findBucket(id).getNode(id);
            return node == null ? null : new ExternalNodeInfo(node, node.getDistance());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(BigInteger nodeId) {
        lock.lock();
        try {
            return findBucket(nodeId).contains(nodeId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清理lastSeen超过expirationTime毫秒的节点
     * @return 删除的节点数
     */
    public int cleanExpiredNodes(long expirationTime) {
        if (expirationTime <= 0) {
            log.warn("过期时间阈值无效，跳过清理");
            return 0;
        }
        long now = System.currentTimeMillis();
        int deletedCount = 0;
        lock.lock();
        try {
            for (Bucket bucket : buckets) {
                for (ExternalNodeInfo node : bucket.getNodes()) {
                    long inactiveTime = now - node.getLastSeen().getTime();
                    if (inactiveTime > expirationTime) {
                        bucket.remove(node.getId());
                        deletedCount++;
                        log.debug("删除过期节点：{}（不活跃时间：{}ms）", node.address(), inactiveTime);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("过期节点清理完成，共删除 {} 个节点", deletedCount);
        return deletedCount;
    }

    /**
     * 网络请求失败后标记节点离线并移到桶尾
     */
    public void offlineNode(BigInteger id) {
        if (id == null || id.equals(localNodeId)) {
            return;
        }
        lock.lock();
        try {
            Bucket bucket = findBucket(id);
            ExternalNodeInfo node = bucket.getNode(id);
            if (node == null) {
                log.debug("节点不存在于路由表中，无需处理下线：{}", id);
                return;
            }
            node.setNodeStatus(NodeStatus.INACTIVE);
            bucket.pushToAfter(node);
            log.info("节点下线：{}", node.address());
        } finally {
            lock.unlock();
        }
    }

    public List<ExternalNodeInfo> getAllNodes() {
        return snapshot(false);
    }

    public List<ExternalNodeInfo> getActiveNodes() {
        return snapshot(true);
    }

    private List<ExternalNodeInfo> snapshot(boolean activeOnly) {
        List<ExternalNodeInfo> nodes = new ArrayList<>();
        lock.lock();
        try {
            for (Bucket bucket : buckets) {
                for (ExternalNodeInfo node : bucket.getNodes()) {
                    if (!activeOnly || node.getNodeStatus() == NodeStatus.ACTIVE) {
                        nodes.add(new ExternalNodeInfo(node, node.getDistance()));
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        return nodes;
    }

    public int size() {
        lock.lock();
        try {
            int size = 0;
            for (Bucket bucket : buckets) {
                size += bucket.size();
            }
            return size;
        } finally {
            lock.unlock();
        }
    }
}
