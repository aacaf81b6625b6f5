package cn.recruitclerk.infrastructure.adapter.port;

import cn.recruitclerk.domain.incentive.adapter.port.IIncentiveEventBus;
import cn.recruitclerk.domain.incentive.model.event.IncentiveDomainEvent;
import cn.recruitclerk.infrastructure.mq.producer.StreamProducer;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;

/**
 * 激励领域事件发布，事件类型作为消息标签
 * <p>
 * 事件在聚合持久化之后发布，发送失败只记录日志，不回滚已提交的状态变更。
 * </p>
 */
@Slf4j
@Component
public class IncentiveEventBus implements IIncentiveEventBus {

    @Value("${incentive.event.binding:incentiveEvent-out-0}")
    private String bindingName;

    @Resource
    private StreamProducer streamProducer;

    @Override
    public void publish(IncentiveDomainEvent event) {
        String identifier = identifierOf(event);
        try {
            boolean success = streamProducer.send(bindingName, event.getEventType(), identifier, JSON.toJSONString(event));
            if (!success) {
                log.warn("激励事件发布失败 eventType:{} incentiveId:{} identifier:{}", event.getEventType(), event.getIncentiveId(), identifier);
            }
        } catch (Exception e) {
            log.error("激励事件发布异常 eventType:{} incentiveId:{} identifier:{}", event.getEventType(), event.getIncentiveId(), identifier, e);
        }
    }

    /**
     * 激励ID:事件类型:发生时间，重复发布同一事件时幂等号不变
     */
    static String identifierOf(IncentiveDomainEvent event) {
        long occurredAt = null == event.getOccurredAt() ? 0L : event.getOccurredAt().getTime();
        return event.getIncentiveId() + ":" + event.getEventType() + ":" + occurredAt;
    }

}
