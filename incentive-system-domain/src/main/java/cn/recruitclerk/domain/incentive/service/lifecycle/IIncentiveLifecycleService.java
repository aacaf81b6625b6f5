package cn.recruitclerk.domain.incentive.service.lifecycle;

import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveStatisticsReportEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.PendingIncentiveEntity;
import cn.recruitclerk.domain.incentive.model.entity.RiskAssessmentEntity;
import cn.recruitclerk.domain.incentive.model.entity.TransitionOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.entity.ValidationOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TimeRangeVO;

import java.util.List;

/**
 * @description 激励生命周期服务：创建、校验、审核、拒绝、查询统计
 * @create 2026-10-17
 */
public interface IIncentiveLifecycleService {

    /**
     * 问卷完成激励
     *
     * @param ip              收款人IP
     * @param questionnaireId 问卷ID
     * @param qualityScore    质量分 0-100
     * @param contactInfo     联系方式
     * @return 激励摘要
     */
    IncentiveOperationResult<IncentiveSummaryEntity> createQuestionnaireIncentive(String ip, String questionnaireId, Integer qualityScore, ContactInfoVO contactInfo);

    /**
     * 推荐激励，同一推荐人/被推荐人IP对只发放一次
     */
    IncentiveOperationResult<IncentiveSummaryEntity> createReferralIncentive(String referrerIP, String referredIP, ContactInfoVO contactInfo);

    IncentiveOperationResult<IncentiveSummaryEntity> getIncentive(String incentiveId);

    IncentiveOperationResult<ValidationOutcomeEntity> validateIncentive(String incentiveId);

    IncentiveOperationResult<TransitionOutcomeEntity> approveIncentive(String incentiveId, String reason);

    IncentiveOperationResult<TransitionOutcomeEntity> rejectIncentive(String incentiveId, String reason);

    /**
     * @param ip        为空时统计全系统
     * @param timeRange 可为空
     */
    IncentiveOperationResult<IncentiveStatisticsReportEntity> getIncentiveStatistics(String ip, TimeRangeVO timeRange);

    /**
     * 按处理优先级降序返回待处理激励，同分保持仓储返回顺序
     *
     * @param status 可为空
     * @param limit  为空时取策略默认值
     */
    IncentiveOperationResult<List<PendingIncentiveEntity>> getPendingIncentives(IncentiveStatusEnumVO status, Integer limit);

    IncentiveOperationResult<RiskAssessmentEntity> assessIncentiveRisk(String incentiveId);

    /**
     * 清理过期激励
     *
     * @param olderThanDays 不得小于策略有效天数
     * @return 删除条数
     */
    IncentiveOperationResult<Integer> cleanupExpiredIncentives(int olderThanDays);

}
