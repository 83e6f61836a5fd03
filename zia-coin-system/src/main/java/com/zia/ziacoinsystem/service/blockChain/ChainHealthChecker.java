package com.zia.ziacoinsystem.service.blockChain;

import com.zia.ziacoinsystem.exception.RecoveryFailedException;
import com.zia.ziacoinsystem.exception.StorageException;
import com.zia.ziacoinsystem.storage.ChainStorage;
import lombok.extern.slf4j.Slf4j;

import static com.zia.ziacoinsystem.constant.BlockChainConstants.LATEST_BACKUP_NAME;

/**
 * 定期检查区块链：有效则覆盖最近备份，无效则尝试一次从备份恢复
 */
@Slf4j
public class ChainHealthChecker {

    public enum HealthStatus {
        HEALTHY,//有效并已备份
        BACKUP_FAILED,//有效但备份失败
        RECOVERED,//无效 已从备份恢复
        RECOVERY_FAILED//无效 恢复失败
    }

    private final BlockChainService blockChainService;
    private final ChainStorage storage;

    public ChainHealthChecker(BlockChainService blockChainService, ChainStorage storage) {
        this.blockChainService = blockChainService;
        this.storage = storage;
    }

    public HealthStatus check() {
        if (blockChainService.isChainValid()) {
            try {
                storage.backup(LATEST_BACKUP_NAME);
                log.debug("区块链有效，已备份 高度:{}", blockChainService.getHeight());
                return HealthStatus.HEALTHY;
            } catch (StorageException e) {
                log.error("区块链备份失败", e);
                return HealthStatus.BACKUP_FAILED;
            }
        }
        log.warn("区块链校验失败，尝试从备份恢复");
        try {
            blockChainService.recoverChain();
            return HealthStatus.RECOVERED;
        } catch (RecoveryFailedException e) {
            log.error("区块链恢复失败", e);
            return HealthStatus.RECOVERY_FAILED;
        }
    }
}
