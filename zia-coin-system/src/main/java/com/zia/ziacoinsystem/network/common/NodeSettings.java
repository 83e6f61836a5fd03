package com.zia.ziacoinsystem.network.common;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 路由表参数
 */
@Builder
@Data
@AllArgsConstructor
@NoArgsConstructor
public class NodeSettings {

    public int identifierSize;
    /* Maximum size of the buckets */
    public int bucketSize;
    public int findNodeSize;


    public static class Default {
        public static int IDENTIFIER_SIZE = 160;
        public static int BUCKET_SIZE = 20;
        public static int FIND_NODE_SIZE = 20;

        public static NodeSettings build() {
            return NodeSettings.builder()
                    .identifierSize(IDENTIFIER_SIZE)
                    .bucketSize(BUCKET_SIZE)
                    .findNodeSize(FIND_NODE_SIZE)
                    .build();
        }

        /**
         * 桶大小与查找返回数量同为k
         */
        public static NodeSettings build(int k) {
            NodeSettings settings = build();
            settings.setBucketSize(k);
            settings.setFindNodeSize(k);
            return settings;
        }
    }
}
