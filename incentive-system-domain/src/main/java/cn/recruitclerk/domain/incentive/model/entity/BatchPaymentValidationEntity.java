package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * @description 批量支付校验结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BatchPaymentValidationEntity {

    private boolean valid;
    /** 阻断性错误 */
    private List<String> errors;
    /** 提示性告警 */
    private List<String> warnings;
    /** 可支付笔数 */
    private int validIncentiveCount;
    /** 可支付总金额 */
    private BigDecimal totalAmount;

}
