package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * @description 批量支付汇总
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class BatchPaymentSummaryEntity {

    /** 请求笔数 */
    private int totalIncentives;
    private int successCount;
    private int failureCount;
    /** 实付总金额 */
    private BigDecimal totalPaidAmount;
    /** 按请求顺序的单项结果 */
    private List<BatchPaymentItemEntity> results;

}
