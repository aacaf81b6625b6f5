package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.util.Date;

/**
 * @description 激励领域事件基类。聚合只负责缓存事件，发布由领域服务完成
 * @create 2026-10-17
 */
@Getter
@ToString
public abstract class IncentiveDomainEvent {

    /** 事件类型 */
    private final String eventType;
    /** 发生时间 */
    private final Date occurredAt;
    /** 激励ID */
    private final String incentiveId;
    /** 收款人IP */
    private final String recipientIP;

    protected IncentiveDomainEvent(String eventType, String incentiveId, String recipientIP, Date occurredAt) {
        this.eventType = eventType;
        this.incentiveId = incentiveId;
        this.recipientIP = recipientIP;
        this.occurredAt = occurredAt;
    }

}
