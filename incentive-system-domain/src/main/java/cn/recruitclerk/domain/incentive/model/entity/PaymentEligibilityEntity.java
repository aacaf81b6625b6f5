package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * @description 支付资格校验结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PaymentEligibilityEntity {

    private boolean eligible;
    private List<String> errors;
    /** 可支付金额，不满足时为0 */
    private BigDecimal approvedAmount;

}
