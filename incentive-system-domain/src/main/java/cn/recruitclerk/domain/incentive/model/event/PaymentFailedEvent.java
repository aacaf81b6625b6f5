package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.util.Date;

/**
 * @description 激励支付失败（前置条件不满足）
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class PaymentFailedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "PaymentFailed";

    /** 失败原因 */
    private final String error;

    public PaymentFailedEvent(String incentiveId, String recipientIP, String error, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.error = error;
    }

}
