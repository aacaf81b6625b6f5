package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 单个 IP 的激励统计
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveStatisticsEntity {

    private String ip;
    private int totalIncentives;
    private BigDecimal totalAmount;
    private BigDecimal paidAmount;
    /** 待校验+已审核金额 */
    private BigDecimal pendingAmount;
    private StatusBreakdownEntity statusBreakdown;
    private BigDecimal averageReward;
    private Date lastIncentiveDate;

}
