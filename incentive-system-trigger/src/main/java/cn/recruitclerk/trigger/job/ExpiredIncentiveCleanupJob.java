package cn.recruitclerk.trigger.job;

import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.service.lifecycle.IIncentiveLifecycleService;
import cn.recruitclerk.domain.incentive.service.rule.IncentiveRules;
import com.alibaba.fastjson.JSON;
import com.xxl.job.core.biz.model.ReturnT;
import com.xxl.job.core.handler.annotation.XxlJob;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;
import java.util.concurrent.TimeUnit;

/**
 * 过期激励清理任务
 * <p>
 * 删除创建时间超过激励有效天数的激励，多实例部署时以分布式锁保证同一时刻只有一个实例执行。
 * 建议每天凌晨执行一次。
 * </p>
 */
@Slf4j
@Component
public class ExpiredIncentiveCleanupJob {

    private static final String LOCK_KEY = "incentive_system_expired_cleanup_job";

    @Resource
    private IIncentiveLifecycleService lifecycleService;
    @Resource
    private IncentiveRules rules;
    @Resource
    private RedissonClient redissonClient;

    @XxlJob("expiredIncentiveCleanupJob")
    public ReturnT<String> exec() {
        RLock lock = redissonClient.getLock(LOCK_KEY);
        boolean locked = false;
        try {
            locked = lock.tryLock(3, 0, TimeUnit.SECONDS);
            if (!locked) {
                log.warn("过期激励清理任务获取锁失败，跳过本次执行");
                return ReturnT.SUCCESS;
            }

            int expiryDays = rules.getPolicy().getExpiryDays();
            log.info("过期激励清理任务开始执行 olderThanDays:{}", expiryDays);
            IncentiveOperationResult<Integer> result = lifecycleService.cleanupExpiredIncentives(expiryDays);
            if (!result.isSuccess()) {
                log.error("过期激励清理任务执行失败 code:{} errors:{}", result.getCode(), JSON.toJSONString(result.getErrors()));
                return ReturnT.FAIL;
            }

            log.info("过期激励清理任务执行完成 deleted:{}", result.getData());
            return ReturnT.SUCCESS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("过期激励清理任务获取锁被中断", e);
            return ReturnT.FAIL;
        } catch (Exception e) {
            log.error("过期激励清理任务执行异常", e);
            return ReturnT.FAIL;
        } finally {
            if (locked && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

}
