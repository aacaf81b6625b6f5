package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

/**
 * @description IP 激励使用历史，用于风险评估
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveUsageHistoryEntity {

    private String ip;
    /** 今日激励数 */
    private int totalIncentivesToday;
    /** 近7日激励数 */
    private int totalIncentivesThisWeek;
    /** 近30日激励数 */
    private int totalIncentivesThisMonth;
    /** 连续活跃天数 */
    private int consecutiveDaysActive;
    /** 最近激励时间 */
    private Date lastIncentiveDate;
    /** 问卷平均质量分 */
    private Double averageQualityScore;

}
