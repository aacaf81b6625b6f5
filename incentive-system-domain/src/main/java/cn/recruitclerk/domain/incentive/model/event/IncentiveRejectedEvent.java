package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.util.Date;

/**
 * @description 激励已拒绝
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentiveRejectedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentiveRejected";

    /** 拒绝原因 */
    private final String reason;

    public IncentiveRejectedEvent(String incentiveId, String recipientIP, String reason, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.reason = reason;
    }

}
