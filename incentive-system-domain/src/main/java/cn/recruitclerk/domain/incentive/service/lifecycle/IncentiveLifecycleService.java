package cn.recruitclerk.domain.incentive.service.lifecycle;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.CreationEligibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.EligibilityCheckEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveStatisticsEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveStatisticsReportEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveUsageHistoryEntity;
import cn.recruitclerk.domain.incentive.model.entity.PendingIncentiveEntity;
import cn.recruitclerk.domain.incentive.model.entity.RiskAssessmentEntity;
import cn.recruitclerk.domain.incentive.model.entity.StatusBreakdownEntity;
import cn.recruitclerk.domain.incentive.model.entity.SystemStatisticsEntity;
import cn.recruitclerk.domain.incentive.model.entity.TransitionOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.entity.TransitionResultEntity;
import cn.recruitclerk.domain.incentive.model.entity.ValidationOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.QuestionnaireTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.ReferralTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.RiskLevelEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TimeRangeVO;
import cn.recruitclerk.domain.incentive.model.valobj.TriggerTypeEnumVO;
import cn.recruitclerk.domain.incentive.service.AbstractIncentiveService;
import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.utils.IsoDateUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 激励生命周期服务
 * <p>
 * 每个方法都不向调用方抛出异常：业务规则失败直接返回失败结果，意外异常记录审计后转为通用错误信息。
 * </p>
 *
 * @create 2026-10-17
 */
@Slf4j
@Service
public class IncentiveLifecycleService extends AbstractIncentiveService implements IIncentiveLifecycleService {

    private static final int USAGE_HISTORY_DAYS = 30;
    private static final String DUPLICATE_REFERRAL_ERROR = "Referral incentive already exists for this IP pair";

    @Override
    public IncentiveOperationResult<IncentiveSummaryEntity> createQuestionnaireIncentive(String ip, String questionnaireId, Integer qualityScore, ContactInfoVO contactInfo) {
        log.info("创建问卷激励 ip:{} questionnaireId:{} qualityScore:{}", ip, questionnaireId, qualityScore);
        try {
            int todayCount = repository.countTodayIncentives(ip);

            Map<String, Object> triggerData = new HashMap<>();
            triggerData.put(QuestionnaireTriggerVO.KEY_QUESTIONNAIRE_ID, questionnaireId);
            triggerData.put(QuestionnaireTriggerVO.KEY_QUALITY_SCORE, qualityScore);
            CreationEligibilityEntity eligibility = rules.canCreateIncentive(ip, TriggerTypeEnumVO.QUESTIONNAIRE_COMPLETION, triggerData, todayCount);
            if (!eligibility.isEligible()) {
                log.info("问卷激励不满足资格 ip:{} questionnaireId:{} errors:{}", ip, questionnaireId, eligibility.getErrors());
                auditBusiness("INCENTIVE_CREATION_DENIED", mapOf(
                        "ip", ip,
                        "questionnaireId", questionnaireId,
                        "qualityScore", qualityScore,
                        "errors", eligibility.getErrors()));
                return IncentiveOperationResult.failed(ResponseCode.E0102, eligibility.getErrors());
            }

            IncentiveAggregate incentive = IncentiveAggregate.createQuestionnaireIncentive(ip, questionnaireId, qualityScore, contactInfo, rules.getPolicy());
            if (!saveAndPublish(incentive)) {
                return IncentiveOperationResult.failed(ResponseCode.E0106, CONCURRENT_MODIFICATION_ERROR);
            }

            auditBusiness("INCENTIVE_CREATED", mapOf(
                    "incentiveId", incentive.getId(),
                    "ip", ip,
                    "questionnaireId", questionnaireId,
                    "qualityScore", qualityScore,
                    "rewardAmount", incentive.getRewardAmount(),
                    "status", incentive.getStatus().getCode()));
            log.info("创建问卷激励完成 incentiveId:{} rewardAmount:{} status:{}", incentive.getId(), incentive.getRewardAmount(), incentive.getStatus());
            return IncentiveOperationResult.success(incentive.getIncentiveSummary());
        } catch (Exception e) {
            log.error("创建问卷激励失败 ip:{} questionnaireId:{}", ip, questionnaireId, e);
            auditError("CREATE_QUESTIONNAIRE_INCENTIVE_ERROR", mapOf("ip", ip, "questionnaireId", questionnaireId, "qualityScore", qualityScore), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while creating incentive");
        }
    }

    @Override
    public IncentiveOperationResult<IncentiveSummaryEntity> createReferralIncentive(String referrerIP, String referredIP, ContactInfoVO contactInfo) {
        log.info("创建推荐激励 referrerIP:{} referredIP:{}", referrerIP, referredIP);
        try {
            int todayCount = repository.countTodayIncentives(referrerIP);

            Map<String, Object> triggerData = new HashMap<>();
            triggerData.put(ReferralTriggerVO.KEY_REFERRED_IP, referredIP);
            CreationEligibilityEntity eligibility = rules.canCreateIncentive(referrerIP, TriggerTypeEnumVO.REFERRAL, triggerData, todayCount);
            if (!eligibility.isEligible()) {
                log.info("推荐激励不满足资格 referrerIP:{} referredIP:{} errors:{}", referrerIP, referredIP, eligibility.getErrors());
                auditBusiness("REFERRAL_INCENTIVE_DENIED", mapOf(
                        "referrerIP", referrerIP,
                        "referredIP", referredIP,
                        "errors", eligibility.getErrors()));
                return IncentiveOperationResult.failed(ResponseCode.E0102, eligibility.getErrors());
            }

            IncentiveAggregate existing = repository.findReferralIncentive(referrerIP, referredIP);
            if (null != existing) {
                log.info("推荐激励重复 referrerIP:{} referredIP:{} existingId:{}", referrerIP, referredIP, existing.getId());
                auditBusiness("REFERRAL_INCENTIVE_DENIED", mapOf(
                        "referrerIP", referrerIP,
                        "referredIP", referredIP,
                        "existingIncentiveId", existing.getId(),
                        "errors", Collections.singletonList(DUPLICATE_REFERRAL_ERROR)));
                return IncentiveOperationResult.failed(ResponseCode.E0102, DUPLICATE_REFERRAL_ERROR);
            }

            IncentiveAggregate incentive = IncentiveAggregate.createReferralIncentive(referrerIP, referredIP, contactInfo, rules.getPolicy());
            if (!saveAndPublish(incentive)) {
                return IncentiveOperationResult.failed(ResponseCode.E0106, CONCURRENT_MODIFICATION_ERROR);
            }

            auditBusiness("REFERRAL_INCENTIVE_CREATED", mapOf(
                    "incentiveId", incentive.getId(),
                    "referrerIP", referrerIP,
                    "referredIP", referredIP,
                    "rewardAmount", incentive.getRewardAmount()));
            return IncentiveOperationResult.success(incentive.getIncentiveSummary());
        } catch (Exception e) {
            log.error("创建推荐激励失败 referrerIP:{} referredIP:{}", referrerIP, referredIP, e);
            auditError("CREATE_REFERRAL_INCENTIVE_ERROR", mapOf("referrerIP", referrerIP, "referredIP", referredIP), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while creating referral incentive");
        }
    }

    @Override
    public IncentiveOperationResult<IncentiveSummaryEntity> getIncentive(String incentiveId) {
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }
            return IncentiveOperationResult.success(incentive.getIncentiveSummary());
        } catch (Exception e) {
            log.error("查询激励失败 incentiveId:{}", incentiveId, e);
            auditError("GET_INCENTIVE_ERROR", mapOf("incentiveId", incentiveId), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while getting incentive");
        }
    }

    @Override
    public IncentiveOperationResult<ValidationOutcomeEntity> validateIncentive(String incentiveId) {
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }

            EligibilityCheckEntity check = incentive.validateEligibility();
            if (!saveAndPublish(incentive)) {
                return IncentiveOperationResult.failed(ResponseCode.E0106, CONCURRENT_MODIFICATION_ERROR);
            }

            auditBusiness("INCENTIVE_VALIDATED", mapOf(
                    "incentiveId", incentiveId,
                    "isValid", check.isValid(),
                    "errors", check.getErrors()));
            return IncentiveOperationResult.success(ValidationOutcomeEntity.builder()
                    .incentiveId(incentiveId)
                    .valid(check.isValid())
                    .errors(check.getErrors())
                    .status(incentive.getStatus())
                    .build());
        } catch (Exception e) {
            log.error("校验激励失败 incentiveId:{}", incentiveId, e);
            auditError("VALIDATE_INCENTIVE_ERROR", mapOf("incentiveId", incentiveId), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while validating incentive");
        }
    }

    @Override
    public IncentiveOperationResult<TransitionOutcomeEntity> approveIncentive(String incentiveId, String reason) {
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }

            TransitionResultEntity transition = incentive.approveForProcessing(reason);
            if (transition.isConflict()) {
                return stateConflict(incentiveId, transition);
            }
            if (!saveAndPublish(incentive)) {
                return IncentiveOperationResult.failed(ResponseCode.E0106, CONCURRENT_MODIFICATION_ERROR);
            }

            auditBusiness("INCENTIVE_APPROVED", mapOf(
                    "incentiveId", incentiveId,
                    "reason", reason,
                    "rewardAmount", incentive.getRewardAmount()));
            return IncentiveOperationResult.success(TransitionOutcomeEntity.builder()
                    .incentiveId(incentiveId)
                    .status(incentive.getStatus())
                    .rewardAmount(incentive.getRewardAmount())
                    .reason(reason)
                    .build());
        } catch (Exception e) {
            log.error("审核激励失败 incentiveId:{}", incentiveId, e);
            auditError("APPROVE_INCENTIVE_ERROR", mapOf("incentiveId", incentiveId, "reason", reason), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while approving incentive");
        }
    }

    @Override
    public IncentiveOperationResult<TransitionOutcomeEntity> rejectIncentive(String incentiveId, String reason) {
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }

            TransitionResultEntity transition = incentive.reject(reason);
            if (transition.isConflict()) {
                return stateConflict(incentiveId, transition);
            }
            if (!saveAndPublish(incentive)) {
                return IncentiveOperationResult.failed(ResponseCode.E0106, CONCURRENT_MODIFICATION_ERROR);
            }

            auditBusiness("INCENTIVE_REJECTED", mapOf(
                    "incentiveId", incentiveId,
                    "reason", reason));
            return IncentiveOperationResult.success(TransitionOutcomeEntity.builder()
                    .incentiveId(incentiveId)
                    .status(incentive.getStatus())
                    .rewardAmount(incentive.getRewardAmount())
                    .reason(reason)
                    .build());
        } catch (Exception e) {
            log.error("拒绝激励失败 incentiveId:{}", incentiveId, e);
            auditError("REJECT_INCENTIVE_ERROR", mapOf("incentiveId", incentiveId, "reason", reason), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while rejecting incentive");
        }
    }

    @Override
    public IncentiveOperationResult<IncentiveStatisticsReportEntity> getIncentiveStatistics(String ip, TimeRangeVO timeRange) {
        try {
            if (null != ip) {
                if (!rules.isValidIpAddress(ip)) {
                    return IncentiveOperationResult.failed(ResponseCode.E0101, "Invalid IP address format");
                }
                List<IncentiveAggregate> incentives = repository.findByIP(ip, timeRange);
                return IncentiveOperationResult.success(IncentiveStatisticsReportEntity.builder()
                        .individual(calculateIndividualStatistics(ip, incentives))
                        .build());
            }

            List<IncentiveAggregate> incentives = repository.findAll(timeRange);
            return IncentiveOperationResult.success(IncentiveStatisticsReportEntity.builder()
                    .system(calculateSystemStatistics(incentives))
                    .build());
        } catch (Exception e) {
            log.error("查询激励统计失败 ip:{}", ip, e);
            auditError("GET_INCENTIVE_STATISTICS_ERROR", mapOf("ip", ip, "timeRange", timeRange), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while getting statistics");
        }
    }

    @Override
    public IncentiveOperationResult<List<PendingIncentiveEntity>> getPendingIncentives(IncentiveStatusEnumVO status, Integer limit) {
        int effectiveLimit = null == limit || limit <= 0 ? rules.getPolicy().getDefaultPendingLimit() : limit;
        try {
            List<IncentiveAggregate> incentives = repository.findPendingIncentives(status, effectiveLimit);
            List<PendingIncentiveEntity> pending = new ArrayList<>(incentives.size());
            for (IncentiveAggregate incentive : incentives) {
                pending.add(PendingIncentiveEntity.builder()
                        .summary(incentive.getIncentiveSummary())
                        .priority(rules.calculateProcessingPriority(incentive))
                        .build());
            }
            // List.sort 为稳定排序，同分保持仓储返回顺序
            pending.sort(Comparator.comparingInt((PendingIncentiveEntity p) -> p.getPriority().getScore()).reversed());
            return IncentiveOperationResult.success(pending);
        } catch (Exception e) {
            log.error("查询待处理激励失败 status:{} limit:{}", status, effectiveLimit, e);
            auditError("GET_PENDING_INCENTIVES_ERROR", mapOf("status", status, "limit", effectiveLimit), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while getting pending incentives");
        }
    }

    @Override
    public IncentiveOperationResult<RiskAssessmentEntity> assessIncentiveRisk(String incentiveId) {
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }

            IncentiveUsageHistoryEntity usageHistory = buildUsageHistory(incentive.getRecipientIP(), new Date());
            RiskAssessmentEntity assessment = rules.generateRiskAssessment(incentive, usageHistory);
            if (RiskLevelEnumVO.HIGH.equals(assessment.getRiskLevel()) || RiskLevelEnumVO.CRITICAL.equals(assessment.getRiskLevel())) {
                log.warn("激励风险偏高 incentiveId:{} riskScore:{} factors:{}", incentiveId, assessment.getRiskScore(), assessment.getRiskFactors());
                auditSecurity("HIGH_RISK_INCENTIVE_DETECTED", mapOf(
                        "incentiveId", incentiveId,
                        "ip", incentive.getRecipientIP(),
                        "riskScore", assessment.getRiskScore(),
                        "riskLevel", assessment.getRiskLevel().getCode(),
                        "riskFactors", assessment.getRiskFactors()));
            }
            return IncentiveOperationResult.success(assessment);
        } catch (Exception e) {
            log.error("激励风险评估失败 incentiveId:{}", incentiveId, e);
            auditError("ASSESS_INCENTIVE_RISK_ERROR", mapOf("incentiveId", incentiveId), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while assessing incentive risk");
        }
    }

    @Override
    public IncentiveOperationResult<Integer> cleanupExpiredIncentives(int olderThanDays) {
        IncentivePolicyVO policy = rules.getPolicy();
        if (olderThanDays < policy.getExpiryDays()) {
            return IncentiveOperationResult.failed(ResponseCode.E0101,
                    "Cleanup threshold must be at least " + policy.getExpiryDays() + " days");
        }
        try {
            int deleted = repository.deleteExpired(olderThanDays);
            log.info("清理过期激励完成 olderThanDays:{} deleted:{}", olderThanDays, deleted);
            auditBusiness("EXPIRED_INCENTIVES_CLEANED", mapOf(
                    "olderThanDays", olderThanDays,
                    "deletedCount", deleted));
            return IncentiveOperationResult.success(deleted);
        } catch (Exception e) {
            log.error("清理过期激励失败 olderThanDays:{}", olderThanDays, e);
            auditError("CLEANUP_EXPIRED_INCENTIVES_ERROR", mapOf("olderThanDays", olderThanDays), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while cleaning up expired incentives");
        }
    }

    private <T> IncentiveOperationResult<T> stateConflict(String incentiveId, TransitionResultEntity transition) {
        log.info("激励状态冲突 incentiveId:{} from:{} to:{}", incentiveId, transition.getFromStatus(), transition.getToStatus());
        auditSecurity("INCENTIVE_STATE_CONFLICT", mapOf(
                "incentiveId", incentiveId,
                "fromStatus", transition.getFromStatus().getCode(),
                "toStatus", transition.getToStatus().getCode(),
                "message", transition.getMessage()));
        return IncentiveOperationResult.failed(ResponseCode.E0103, transition.getMessage());
    }

    /**
     * 近30天该IP的激励使用情况
     */
    IncentiveUsageHistoryEntity buildUsageHistory(String ip, Date now) {
        TimeRangeVO lastMonth = TimeRangeVO.builder()
                .start(IsoDateUtil.daysAgo(now, USAGE_HISTORY_DAYS))
                .end(now)
                .build();
        List<IncentiveAggregate> incentives = repository.findByIP(ip, lastMonth);

        ZoneId zone = ZoneId.systemDefault();
        LocalDate today = now.toInstant().atZone(zone).toLocalDate();
        Date weekStart = IsoDateUtil.daysAgo(now, 7);

        int todayCount = 0;
        int weekCount = 0;
        Date lastIncentiveDate = null;
        Set<LocalDate> activeDays = new HashSet<>();
        int scoredCount = 0;
        long scoreSum = 0;
        for (IncentiveAggregate incentive : incentives) {
            Date createdAt = incentive.getCreatedAt();
            LocalDate day = createdAt.toInstant().atZone(zone).toLocalDate();
            activeDays.add(day);
            if (day.equals(today)) todayCount++;
            if (!createdAt.before(weekStart)) weekCount++;
            if (null == lastIncentiveDate || createdAt.after(lastIncentiveDate)) lastIncentiveDate = createdAt;
            if (incentive.getTrigger() instanceof QuestionnaireTriggerVO) {
                Integer score = ((QuestionnaireTriggerVO) incentive.getTrigger()).getQualityScore();
                if (null != score) {
                    scoredCount++;
                    scoreSum += score;
                }
            }
        }

        int consecutiveDays = 0;
        LocalDate cursor = today;
        while (activeDays.contains(cursor)) {
            consecutiveDays++;
            cursor = cursor.minusDays(1);
        }

        return IncentiveUsageHistoryEntity.builder()
                .ip(ip)
                .totalIncentivesToday(todayCount)
                .totalIncentivesThisWeek(weekCount)
                .totalIncentivesThisMonth(incentives.size())
                .consecutiveDaysActive(consecutiveDays)
                .lastIncentiveDate(lastIncentiveDate)
                .averageQualityScore(scoredCount == 0 ? null : (double) scoreSum / scoredCount)
                .build();
    }

    private IncentiveStatisticsEntity calculateIndividualStatistics(String ip, List<IncentiveAggregate> incentives) {
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal paidAmount = BigDecimal.ZERO;
        BigDecimal pendingAmount = BigDecimal.ZERO;
        StatusBreakdownEntity breakdown = new StatusBreakdownEntity();
        Date lastIncentiveDate = null;

        for (IncentiveAggregate incentive : incentives) {
            BigDecimal amount = incentive.getRewardAmount();
            totalAmount = totalAmount.add(amount);
            countStatus(breakdown, incentive.getStatus());
            if (IncentiveStatusEnumVO.PAID.equals(incentive.getStatus())) {
                paidAmount = paidAmount.add(amount);
            } else if (IncentiveStatusEnumVO.PENDING_VALIDATION.equals(incentive.getStatus())
                    || IncentiveStatusEnumVO.APPROVED.equals(incentive.getStatus())) {
                pendingAmount = pendingAmount.add(amount);
            }
            if (null == lastIncentiveDate || incentive.getCreatedAt().after(lastIncentiveDate)) {
                lastIncentiveDate = incentive.getCreatedAt();
            }
        }

        return IncentiveStatisticsEntity.builder()
                .ip(ip)
                .totalIncentives(incentives.size())
                .totalAmount(totalAmount)
                .paidAmount(paidAmount)
                .pendingAmount(pendingAmount)
                .statusBreakdown(breakdown)
                .averageReward(average(totalAmount, incentives.size()))
                .lastIncentiveDate(lastIncentiveDate)
                .build();
    }

    private SystemStatisticsEntity calculateSystemStatistics(List<IncentiveAggregate> incentives) {
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal paidAmount = BigDecimal.ZERO;
        Set<String> uniqueIPs = new HashSet<>();
        StatusBreakdownEntity breakdown = new StatusBreakdownEntity();

        for (IncentiveAggregate incentive : incentives) {
            BigDecimal amount = incentive.getRewardAmount();
            totalAmount = totalAmount.add(amount);
            uniqueIPs.add(incentive.getRecipientIP());
            countStatus(breakdown, incentive.getStatus());
            if (IncentiveStatusEnumVO.PAID.equals(incentive.getStatus())) {
                paidAmount = paidAmount.add(amount);
            }
        }

        BigDecimal conversionRate = incentives.isEmpty()
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(breakdown.getPaid()).multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(incentives.size()), 2, RoundingMode.HALF_UP);

        return SystemStatisticsEntity.builder()
                .totalIncentives(incentives.size())
                .uniqueRecipients(uniqueIPs.size())
                .totalAmount(totalAmount)
                .paidAmount(paidAmount)
                .pendingAmount(totalAmount.subtract(paidAmount))
                .statusBreakdown(breakdown)
                .averageRewardPerIncentive(average(totalAmount, incentives.size()))
                .averageRewardPerIP(average(totalAmount, uniqueIPs.size()))
                .conversionRate(conversionRate)
                .build();
    }

    private static void countStatus(StatusBreakdownEntity breakdown, IncentiveStatusEnumVO status) {
        switch (status) {
            case PENDING_VALIDATION:
                breakdown.setPending(breakdown.getPending() + 1);
                break;
            case APPROVED:
                breakdown.setApproved(breakdown.getApproved() + 1);
                break;
            case PAID:
                breakdown.setPaid(breakdown.getPaid() + 1);
                break;
            case REJECTED:
                breakdown.setRejected(breakdown.getRejected() + 1);
                break;
            case EXPIRED:
                breakdown.setExpired(breakdown.getExpired() + 1);
                break;
            default:
                break;
        }
    }

    private static BigDecimal average(BigDecimal total, int count) {
        if (count == 0) return BigDecimal.ZERO;
        return total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

}
