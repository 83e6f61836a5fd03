package com.zia.ziacoinsystem.network.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BootstrapNode {
    private String host;
    private int port;
}
