package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @description 支付网关请求
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PaymentRequestEntity {

    /** 金额 */
    private BigDecimal amount;
    /** 币种 */
    private CurrencyEnumVO currency;
    /** 支付方式 */
    private PaymentMethodEnumVO paymentMethod;
    /** 收款人联系方式 */
    private ContactInfoVO recipientInfo;
    /** 业务单号，即激励ID */
    private String reference;
    /** 幂等键：激励ID:版本号 */
    private String idempotencyKey;

}
