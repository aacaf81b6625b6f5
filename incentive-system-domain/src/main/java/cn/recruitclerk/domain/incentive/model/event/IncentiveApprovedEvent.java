package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 激励已审核通过
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentiveApprovedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentiveApproved";

    /** 奖励金额 */
    private final BigDecimal rewardAmount;
    /** 审核原因 */
    private final String reason;

    public IncentiveApprovedEvent(String incentiveId, String recipientIP, BigDecimal rewardAmount, String reason, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.rewardAmount = rewardAmount;
        this.reason = reason;
    }

}
