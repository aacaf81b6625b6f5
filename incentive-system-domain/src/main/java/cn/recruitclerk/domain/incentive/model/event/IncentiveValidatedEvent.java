package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 激励校验通过
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentiveValidatedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentiveValidated";

    /** 奖励金额 */
    private final BigDecimal rewardAmount;

    public IncentiveValidatedEvent(String incentiveId, String recipientIP, BigDecimal rewardAmount, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.rewardAmount = rewardAmount;
    }

}
