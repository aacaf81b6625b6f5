package cn.recruitclerk.domain.incentive.service;

import cn.recruitclerk.domain.incentive.adapter.port.IAuditLogger;
import cn.recruitclerk.domain.incentive.adapter.port.IIncentiveEventBus;
import cn.recruitclerk.domain.incentive.adapter.repository.IIncentiveRepository;
import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.event.IncentiveDomainEvent;
import cn.recruitclerk.domain.incentive.service.rule.IncentiveRules;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Resource;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 激励服务抽象基类
 * 提供共用的依赖注入、持久化后发布事件、审计记录
 *
 * @create 2026-10-17
 */
@Slf4j
public abstract class AbstractIncentiveService {

    protected static final String CONCURRENT_MODIFICATION_ERROR = "Incentive was modified concurrently, please retry";
    protected static final String NOT_FOUND_ERROR = "Incentive not found";

    @Resource
    protected IIncentiveRepository repository;

    @Resource
    protected IIncentiveEventBus eventBus;

    @Resource
    protected IAuditLogger auditLogger;

    @Resource
    protected IncentiveRules rules;

    /**
     * 保存 -> 按产生顺序发布事件 -> 清空事件缓冲
     *
     * @return false 表示乐观锁冲突，事件未发布
     */
    protected boolean saveAndPublish(IncentiveAggregate incentive) {
        boolean saved = repository.save(incentive);
        if (!saved) {
            log.warn("激励保存失败，版本冲突 incentiveId:{} version:{}", incentive.getId(), incentive.getVersion());
            auditSecurity("INCENTIVE_CONCURRENT_MODIFICATION", mapOf(
                    "incentiveId", incentive.getId(),
                    "version", incentive.getVersion()));
            return false;
        }

        for (IncentiveDomainEvent event : incentive.getUncommittedEvents()) {
            eventBus.publish(event);
        }
        incentive.markEventsAsCommitted();
        return true;
    }

    protected void auditBusiness(String eventName, Map<String, Object> data) {
        try {
            auditLogger.logBusinessEvent(eventName, data);
        } catch (Exception e) {
            log.warn("审计日志记录失败 eventName:{} data:{}", eventName, JSON.toJSONString(data), e);
        }
    }

    protected void auditSecurity(String eventName, Map<String, Object> data) {
        try {
            auditLogger.logSecurityEvent(eventName, data);
        } catch (Exception e) {
            log.warn("安全审计记录失败 eventName:{} data:{}", eventName, JSON.toJSONString(data), e);
        }
    }

    protected void auditError(String eventName, Map<String, Object> data, Exception cause) {
        data.put("error", null == cause.getMessage() ? cause.getClass().getSimpleName() : cause.getMessage());
        try {
            auditLogger.logError(eventName, data);
        } catch (Exception e) {
            log.warn("错误审计记录失败 eventName:{} data:{}", eventName, JSON.toJSONString(data), e);
        }
    }

    protected static Map<String, Object> mapOf(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

}
