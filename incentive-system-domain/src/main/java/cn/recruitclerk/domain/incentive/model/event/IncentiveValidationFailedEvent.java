package cn.recruitclerk.domain.incentive.model.event;

import lombok.Getter;
import lombok.ToString;

import java.util.Date;
import java.util.List;

/**
 * @description 激励校验失败
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentiveValidationFailedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentiveValidationFailed";

    /** 失败原因 */
    private final List<String> errors;

    public IncentiveValidationFailedEvent(String incentiveId, String recipientIP, List<String> errors, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.errors = errors;
    }

}
