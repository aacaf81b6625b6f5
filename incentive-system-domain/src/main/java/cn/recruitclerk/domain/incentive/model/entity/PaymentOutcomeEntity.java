package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @description 单笔支付结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PaymentOutcomeEntity {

    /** 激励ID */
    private String incentiveId;
    /** 交易流水号 */
    private String transactionId;
    /** 支付金额 */
    private BigDecimal amount;
    /** 币种 */
    private CurrencyEnumVO currency;
    /** 支付方式 */
    private PaymentMethodEnumVO paymentMethod;
    /** 支付后状态 */
    private IncentiveStatusEnumVO status;

}
