package com.zia.ziacoinsystem.network.common;

import com.zia.ziacoinsystem.network.enums.NodeStatus;
import com.zia.ziacoinsystem.util.CryptoUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jetbrains.annotations.NotNull;

import java.io.Serializable;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Date;

/**
 * 路由表中的远端节点
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ExternalNodeInfo implements Comparable<ExternalNodeInfo>, Serializable {

    private BigInteger id;//节点ID
    private String host;//地址
    private int port;//TCP端口
    private int version;//协议版本
    private long height;//对方报告的区块高度
    private Date lastSeen;//最后活跃时间
    private NodeStatus nodeStatus;//节点状态
    private BigInteger distance;//与查找目标的距离


    public ExternalNodeInfo(String host, int port, int version, long height) {
        this.id = nodeIdOf(host, port);
        this.host = host;
        this.port = port;
        this.version = version;
        this.height = height;
        this.lastSeen = new Date();
        this.nodeStatus = NodeStatus.ACTIVE;
        this.distance = BigInteger.ZERO;
    }

    /**
     * 复制节点并设置与目标的距离 查找结果使用副本
     */
    public ExternalNodeInfo(ExternalNodeInfo node, BigInteger distance) {
        this.id = node.getId();
        this.host = node.getHost();
        this.port = node.getPort();
        this.version = node.getVersion();
        this.height = node.getHeight();
        this.lastSeen = node.getLastSeen() == null ? null : new Date(node.getLastSeen().getTime());
        this.nodeStatus = node.getNodeStatus();
        this.distance = distance;
    }

    /**
     * 节点ID：SHA-256("host:port")的前160位 无符号整数
     */
    public static BigInteger nodeIdOf(String host, int port) {
        byte[] digest = CryptoUtil.applySHA256((host + ":" + port).getBytes(StandardCharsets.UTF_8));
        return new BigInteger(1, Arrays.copyOf(digest, 20));
    }

    public String address() {
        return host + ":" + port;
    }

    @Override
    public int compareTo(@NotNull ExternalNodeInfo o) {
        return distance.compareTo(o.distance);
    }
}
