package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @description 激励统计报告，按IP查询时填充 individual，否则填充 system
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveStatisticsReportEntity {

    private IncentiveStatisticsEntity individual;
    private SystemStatisticsEntity system;

}
