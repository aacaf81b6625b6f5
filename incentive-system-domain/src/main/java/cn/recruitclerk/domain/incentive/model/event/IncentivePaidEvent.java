package cn.recruitclerk.domain.incentive.model.event;

import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 激励已支付
 * @create 2026-10-17
 */
@Getter
@ToString(callSuper = true)
public class IncentivePaidEvent extends IncentiveDomainEvent {

    public static final String EVENT_TYPE = "IncentivePaid";

    /** 支付金额 */
    private final BigDecimal amount;
    /** 币种 */
    private final CurrencyEnumVO currency;
    /** 支付方式 */
    private final PaymentMethodEnumVO paymentMethod;
    /** 交易流水号 */
    private final String transactionId;

    public IncentivePaidEvent(String incentiveId, String recipientIP, BigDecimal amount, CurrencyEnumVO currency, PaymentMethodEnumVO paymentMethod, String transactionId, Date occurredAt) {
        super(EVENT_TYPE, incentiveId, recipientIP, occurredAt);
        this.amount = amount;
        this.currency = currency;
        this.paymentMethod = paymentMethod;
        this.transactionId = transactionId;
    }

}
