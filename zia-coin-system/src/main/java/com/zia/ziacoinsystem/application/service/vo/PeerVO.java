package com.zia.ziacoinsystem.application.service.vo;

import com.zia.ziacoinsystem.network.common.ExternalNodeInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeerVO {

    private String nodeId;
    private String host;
    private int port;
    private int version;
    private long height;
    private String status;
    private Date lastSeen;

    public static PeerVO fromNode(ExternalNodeInfo node) {
        return PeerVO.builder()
                .nodeId(node.getId().toString(16))
                .host(node.getHost())
                .port(node.getPort())
                .version(node.getVersion())
                .height(node.getHeight())
                .status(node.getNodeStatus() == null ? null : node.getNodeStatus().name())
                .lastSeen(node.getLastSeen())
                .build();
    }
}
