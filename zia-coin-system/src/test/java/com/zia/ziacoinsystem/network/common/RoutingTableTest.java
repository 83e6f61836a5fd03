package com.zia.ziacoinsystem.network.common;

import com.zia.ziacoinsystem.exception.FullBucketException;
import com.zia.ziacoinsystem.network.enums.NodeStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Date;
import java.util.List;

public class RoutingTableTest {

    private static final BigInteger LOCAL_ID = BigInteger.ZERO;
    //最高位为1 与本地ID异或后bitLength=160 全部落在0号桶
    private static final BigInteger FAR = BigInteger.ONE.shiftLeft(159);

    private static RoutingTable table(int bucketSize) {
        return new RoutingTable(LOCAL_ID, NodeSettings.Default.build(bucketSize));
    }

    private static ExternalNodeInfo node(BigInteger id) {
        return ExternalNodeInfo.builder()
                .id(id)
                .host("10.0.0." + id.mod(BigInteger.valueOf(250)))
                .port(5000)
                .version(1)
                .lastSeen(new Date())
                .nodeStatus(NodeStatus.ACTIVE)
                .distance(BigInteger.ZERO)
                .build();
    }

    @Test
    void bucketIndexFollowsXorBitLength() {
        RoutingTable table = table(20);
        Assertions.assertEquals(0, table.bucketIndex(FAR));
        Assertions.assertEquals(159, table.bucketIndex(BigInteger.ONE));
        Assertions.assertEquals(158, table.bucketIndex(BigInteger.valueOf(2)));
        Assertions.assertEquals(159, table.bucketIndex(LOCAL_ID));
    }

    @Test
    void nodeIdIsFirst160BitsOfAddressHash() {
        BigInteger id = ExternalNodeInfo.nodeIdOf("127.0.0.1", 5000);
        Assertions.assertTrue(id.bitLength() <= 160);
        Assertions.assertEquals(id, ExternalNodeInfo.nodeIdOf("127.0.0.1", 5000));
        Assertions.assertNotEquals(id, ExternalNodeInfo.nodeIdOf("127.0.0.1", 5001));
    }

    @Test
    void localNodeIsNeverAdded() {
        RoutingTable table = table(20);
        Assertions.assertFalse(table.addNode(node(LOCAL_ID)));
        Assertions.assertEquals(0, table.size());
    }

    @Test
    void updateThrowsWhenBucketIsFull() throws Exception {
        RoutingTable table = table(2);
        table.update(node(FAR.add(BigInteger.ONE)));
        table.update(node(FAR.add(BigInteger.TWO)));
        Assertions.assertThrows(FullBucketException.class, () -> table.update(node(FAR.add(BigInteger.valueOf(3)))));
        Assertions.assertFalse(table.update(node(FAR.add(BigInteger.ONE))));
    }

    @Test
    void fullBucketKeepsLiveOldestAndDropsNewcomer() {
        RoutingTable table = table(2);
        table.setLivenessProbe(node -> true);
        table.addNode(node(FAR.add(BigInteger.ONE)));
        table.addNode(node(FAR.add(BigInteger.TWO)));

        Assertions.assertFalse(table.addNode(node(FAR.add(BigInteger.valueOf(3)))));
        Assertions.assertEquals(2, table.findBucket(FAR).size());
        Assertions.assertFalse(table.contains(FAR.add(BigInteger.valueOf(3))));
        //最久节点被探测后移到头部
        Assertions.assertEquals(FAR.add(BigInteger.TWO), table.findBucket(FAR).getOldest().getId());
    }

    @Test
    void fullBucketEvictsDeadOldest() {
        RoutingTable table = table(2);
        table.setLivenessProbe(node -> false);
        table.addNode(node(FAR.add(BigInteger.ONE)));
        table.addNode(node(FAR.add(BigInteger.TWO)));

        Assertions.assertTrue(table.addNode(node(FAR.add(BigInteger.valueOf(3)))));
        Assertions.assertFalse(table.contains(FAR.add(BigInteger.ONE)));
        Assertions.assertTrue(table.contains(FAR.add(BigInteger.valueOf(3))));
        Assertions.assertEquals(2, table.findBucket(FAR).size());
    }

    @Test
    void fullBucketReplacesInactiveNodeWithoutProbing() {
        RoutingTable table = table(2);
        table.setLivenessProbe(node -> {
            throw new AssertionError("不应探测");
        });
        table.addNode(node(FAR.add(BigInteger.ONE)));
        table.addNode(node(FAR.add(BigInteger.TWO)));
        table.offlineNode(FAR.add(BigInteger.TWO));

        Assertions.assertTrue(table.addNode(node(FAR.add(BigInteger.valueOf(3)))));
        Assertions.assertFalse(table.contains(FAR.add(BigInteger.TWO)));
    }

    @Test
    void bucketNeverExceedsK() {
        RoutingTable table = table(3);
        for (int i = 1; i <= 10; i++) {
            table.addNode(node(FAR.add(BigInteger.valueOf(i))));
        }
        Assertions.assertEquals(3, table.findBucket(FAR).size());
        Assertions.assertEquals(3, table.size());
    }

    @Test
    void findNodeReturnsClosestInXorOrder() {
        RoutingTable table = table(20);
        for (int i = 1; i <= 40; i++) {
            table.addNode(node(BigInteger.valueOf(i).shiftLeft(i)));
        }
        BigInteger target = BigInteger.valueOf(12345);
        List<ExternalNodeInfo> closest = table.findNode(target);

        Assertions.assertEquals(20, closest.size());
        for (int i = 1; i < closest.size(); i++) {
            Assertions.assertTrue(closest.get(i - 1).getDistance().compareTo(closest.get(i).getDistance()) <= 0);
        }
        Assertions.assertEquals(target.xor(closest.get(0).getId()), closest.get(0).getDistance());
    }

    @Test
    void findNodeReturnsAtMostK() {
        RoutingTable table = table(5);
        for (int i = 1; i <= 40; i++) {
            table.addNode(node(BigInteger.valueOf(i).shiftLeft(i)));
        }
        Assertions.assertTrue(table.size() > 5);
        Assertions.assertEquals(5, table.findNode(BigInteger.valueOf(12345)).size());
    }

    @Test
    void findNodeOnSmallTableReturnsEverything() {
        RoutingTable table = table(20);
        table.addNode(node(BigInteger.valueOf(7)));
        table.addNode(node(FAR.add(BigInteger.ONE)));
        List<ExternalNodeInfo> closest = table.findNode(BigInteger.valueOf(6));
        Assertions.assertEquals(2, closest.size());
        Assertions.assertEquals(BigInteger.valueOf(7), closest.get(0).getId());
    }

    @Test
    void offlineNodeIsExcludedFromActiveNodes() {
        RoutingTable table = table(20);
        table.addNode(node(BigInteger.valueOf(7)));
        table.addNode(node(BigInteger.valueOf(9)));
        table.offlineNode(BigInteger.valueOf(7));

        Assertions.assertEquals(2, table.getAllNodes().size());
        Assertions.assertEquals(1, table.getActiveNodes().size());
        Assertions.assertEquals(NodeStatus.INACTIVE, table.getNode(BigInteger.valueOf(7)).getNodeStatus());

        table.addNode(node(BigInteger.valueOf(7)));
        Assertions.assertEquals(2, table.getActiveNodes().size());
    }

    @Test
    void cleanupRemovesExpiredNodes() {
        RoutingTable table = table(20);
        table.addNode(node(BigInteger.valueOf(7)));
        table.addNode(node(BigInteger.valueOf(9)));
        table.findBucket(BigInteger.valueOf(7)).getNode(BigInteger.valueOf(7))
                .setLastSeen(new Date(System.currentTimeMillis() - 2 * 3_600_000L));

        Assertions.assertEquals(1, table.cleanExpiredNodes(3_600_000L));
        Assertions.assertFalse(table.contains(BigInteger.valueOf(7)));
        Assertions.assertTrue(table.contains(BigInteger.valueOf(9)));
    }

    @Test
    void snapshotsAreCopies() {
        RoutingTable table = table(20);
        table.addNode(node(BigInteger.valueOf(7)));
        table.getAllNodes().get(0).setNodeStatus(NodeStatus.INACTIVE);
        Assertions.assertEquals(1, table.getActiveNodes().size());
    }
}
