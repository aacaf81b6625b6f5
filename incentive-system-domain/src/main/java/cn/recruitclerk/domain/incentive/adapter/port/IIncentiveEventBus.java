package cn.recruitclerk.domain.incentive.adapter.port;

import cn.recruitclerk.domain.incentive.model.event.IncentiveDomainEvent;

/**
 * @description 激励领域事件发布端口
 * @create 2026-10-17
 */
public interface IIncentiveEventBus {

    /**
     * 发布单个领域事件，调用方按事件产生顺序逐个发布
     */
    void publish(IncentiveDomainEvent event);

}
