package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @description 系统整体激励统计
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SystemStatisticsEntity {

    private int totalIncentives;
    /** 去重收款IP数 */
    private int uniqueRecipients;
    private BigDecimal totalAmount;
    private BigDecimal paidAmount;
    /** 总金额-已支付金额 */
    private BigDecimal pendingAmount;
    private StatusBreakdownEntity statusBreakdown;
    private BigDecimal averageRewardPerIncentive;
    private BigDecimal averageRewardPerIP;
    /** 支付转化率（百分比） */
    private BigDecimal conversionRate;

}
