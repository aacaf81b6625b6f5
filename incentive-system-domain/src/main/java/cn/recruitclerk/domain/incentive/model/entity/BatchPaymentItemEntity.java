package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @description 批量支付单项结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BatchPaymentItemEntity {

    private String incentiveId;
    private boolean success;
    private String transactionId;
    private BigDecimal amount;
    /** 失败原因 */
    private String error;

}
