package cn.recruitclerk.domain.incentive.model.event;

import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TriggerTypeEnumVO;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 激励已创建
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentiveCreatedEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentiveCreated";

    /** 奖励金额 */
    private final BigDecimal rewardAmount;
    /** 币种 */
    private final CurrencyEnumVO currency;
    /** 触发类型 */
    private final TriggerTypeEnumVO triggerType;

    public IncentiveCreatedEvent(String incentiveId, String recipientIP, BigDecimal rewardAmount, CurrencyEnumVO currency, TriggerTypeEnumVO triggerType, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.rewardAmount = rewardAmount;
        this.currency = currency;
        this.triggerType = triggerType;
    }

}
