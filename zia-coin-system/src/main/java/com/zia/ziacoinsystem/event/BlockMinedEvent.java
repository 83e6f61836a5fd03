package com.zia.ziacoinsystem.event;

import com.zia.ziacoinsystem.data.block.Block;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 本地挖出新区块并已上链
 */
@Getter
public class BlockMinedEvent extends ApplicationEvent {

    private final Block block;

    public BlockMinedEvent(Object source, Block block) {
        super(source);
        this.block = block;
    }
}
