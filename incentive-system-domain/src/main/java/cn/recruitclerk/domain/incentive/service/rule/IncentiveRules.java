package cn.recruitclerk.domain.incentive.service.rule;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentValidationEntity;
import cn.recruitclerk.domain.incentive.model.entity.CreationEligibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveUsageHistoryEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentEligibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentMethodCompatibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.ProcessingPriorityEntity;
import cn.recruitclerk.domain.incentive.model.entity.RiskAssessmentEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveRewardVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PriorityLevelEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.QuestionnaireTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.ReferralTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.RiskLevelEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TriggerTypeEnumVO;
import cn.recruitclerk.types.utils.IpAddressUtil;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * @description 激励业务规则引擎，无副作用，所有阈值来自注入的 {@link IncentivePolicyVO}
 * @create 2026-10-17
 */
@Component
public class IncentiveRules {

    private static final int PRIORITY_CAP = 100;
    private static final int RISK_CAP = 100;
    private static final int SUSTAINED_ACTIVITY_DAYS = 5;

    private final IncentivePolicyVO policy;

    public IncentiveRules(IncentivePolicyVO policy) {
        this.policy = policy;
    }

    public IncentivePolicyVO getPolicy() {
        return policy;
    }

    /**
     * 激励创建资格
     *
     * @param ip               收款人IP
     * @param triggerType      触发类型
     * @param triggerData      触发数据：问卷为 questionnaireId/qualityScore，推荐为 referredIP
     * @param todayCountForIP  该IP今日已有激励数
     */
    public CreationEligibilityEntity canCreateIncentive(String ip, TriggerTypeEnumVO triggerType, Map<String, Object> triggerData,
                                                        int todayCountForIP) {
        List<String> errors = new ArrayList<>();
        Map<String, Object> data = null == triggerData ? Collections.<String, Object>emptyMap() : triggerData;

        if (!isValidIpAddress(ip)) {
            errors.add("Valid IP address is required");
        }
        if (todayCountForIP >= policy.getMaxDailyIncentivesPerIp()) {
            errors.add("Daily incentive limit reached (" + policy.getMaxDailyIncentivesPerIp() + " per IP)");
        }

        if (TriggerTypeEnumVO.QUESTIONNAIRE_COMPLETION.equals(triggerType)) {
            Object questionnaireId = data.get(QuestionnaireTriggerVO.KEY_QUESTIONNAIRE_ID);
            if (null == questionnaireId || StringUtils.isBlank(String.valueOf(questionnaireId))) {
                errors.add("Questionnaire ID is required");
            }
            Double qualityScore = asScore(data.get(QuestionnaireTriggerVO.KEY_QUALITY_SCORE));
            if (null == qualityScore || qualityScore < 0 || qualityScore > 100) {
                errors.add("Valid quality score (0-100) is required");
            }
            if (null != qualityScore && qualityScore < policy.getMinQualityScore()) {
                errors.add("Quality score must be at least " + policy.getMinQualityScore() + " to qualify for reward");
            }
        } else if (TriggerTypeEnumVO.REFERRAL.equals(triggerType)) {
            Object referred = data.get(ReferralTriggerVO.KEY_REFERRED_IP);
            String referredIP = null == referred ? null : String.valueOf(referred);
            if (StringUtils.isBlank(referredIP)) {
                errors.add("Referred IP address is required");
            }
            if (!isValidIpAddress(referredIP)) {
                errors.add("Referred IP address must be valid");
            }
            if (null != referredIP && referredIP.equals(ip)) {
                errors.add("Cannot refer yourself");
            }
        } else {
            errors.add("Unsupported trigger type: " + (null == triggerType ? null : triggerType.getCode()));
        }

        boolean eligible = errors.isEmpty();
        return CreationEligibilityEntity.builder()
                .eligible(eligible)
                .errors(errors)
                .expectedReward(eligible ? calculateExpectedReward(triggerType, data) : BigDecimal.ZERO)
                .build();
    }

    public BigDecimal calculateExpectedReward(TriggerTypeEnumVO triggerType, Map<String, Object> triggerData) {
        if (TriggerTypeEnumVO.QUESTIONNAIRE_COMPLETION.equals(triggerType)) {
            Double qualityScore = asScore(null == triggerData ? null : triggerData.get(QuestionnaireTriggerVO.KEY_QUALITY_SCORE));
            return null == qualityScore ? BigDecimal.ZERO : calculateQuestionnaireReward(qualityScore.intValue());
        }
        if (TriggerTypeEnumVO.REFERRAL.equals(triggerType)) {
            return policy.getReferralRewardAmount();
        }
        return BigDecimal.ZERO;
    }

    public BigDecimal calculateQuestionnaireReward(int qualityScore) {
        return IncentiveRewardVO.forQuestionnaire(qualityScore, policy).getAmount();
    }

    public PaymentEligibilityEntity canPayIncentive(IncentiveAggregate incentive) {
        List<String> errors = new ArrayList<>();

        if (!IncentiveStatusEnumVO.APPROVED.equals(incentive.getStatus())) {
            errors.add("Incentive must be approved for payment (current status: " + incentive.getStatus().getCode() + ")");
        }

        BigDecimal rewardAmount = incentive.getRewardAmount();
        if (rewardAmount.compareTo(policy.getMinPayoutAmount()) < 0) {
            errors.add("Reward amount (" + rewardAmount.toPlainString() + ") is below minimum payout threshold ("
                    + policy.getMinPayoutAmount().toPlainString() + ")");
        }
        if (rewardAmount.compareTo(policy.getMaxRewardAmount()) > 0) {
            errors.add("Reward amount (" + rewardAmount.toPlainString() + ") exceeds maximum allowed ("
                    + policy.getMaxRewardAmount().toPlainString() + ")");
        }

        long daysSinceCreation = incentive.getDaysSinceCreation();
        if (daysSinceCreation > policy.getExpiryDays()) {
            errors.add("Incentive has expired (" + daysSinceCreation + " days old, limit: " + policy.getExpiryDays() + ")");
        }

        boolean eligible = errors.isEmpty();
        return PaymentEligibilityEntity.builder()
                .eligible(eligible)
                .errors(errors)
                .approvedAmount(eligible ? rewardAmount : BigDecimal.ZERO)
                .build();
    }

    public PaymentMethodCompatibilityEntity validatePaymentMethodCompatibility(PaymentMethodEnumVO paymentMethod, ContactInfoVO contactInfo) {
        List<String> errors = new ArrayList<>();
        ContactInfoVO contact = null == contactInfo ? ContactInfoVO.empty() : contactInfo;

        if (null == paymentMethod) {
            errors.add("Unsupported payment method: null");
        } else {
            switch (paymentMethod) {
                case WECHAT_PAY:
                    if (StringUtils.isBlank(contact.getWechat())) {
                        errors.add("WeChat ID is required for WeChat Pay");
                    }
                    break;
                case ALIPAY:
                    if (StringUtils.isBlank(contact.getAlipay())) {
                        errors.add("Alipay account is required for Alipay payment");
                    }
                    break;
                case BANK_TRANSFER:
                    if (StringUtils.isBlank(contact.getPhone()) && StringUtils.isBlank(contact.getEmail())) {
                        errors.add("Phone or email is required for bank transfer verification");
                    }
                    break;
                case MANUAL:
                    if (!contact.isValid()) {
                        errors.add("Valid contact information is required for manual payment");
                    }
                    break;
                default:
                    errors.add("Unsupported payment method: " + paymentMethod.getCode());
            }
        }

        return PaymentMethodCompatibilityEntity.builder()
                .compatible(errors.isEmpty())
                .errors(errors)
                .build();
    }

    /**
     * 处理优先级 = 金额档 + 等待时长档 + 状态档 + 过期风险档，封顶 100
     */
    public ProcessingPriorityEntity calculateProcessingPriority(IncentiveAggregate incentive) {
        int priority = 0;
        List<String> factors = new ArrayList<>();

        BigDecimal rewardAmount = incentive.getRewardAmount();
        BigDecimal highTier = policy.getBaseQuestionnaireReward().add(policy.getHighQualityBonus());
        BigDecimal standardTier = policy.getBaseQuestionnaireReward();
        long daysSinceCreation = incentive.getDaysSinceCreation();

        // 金额
        if (rewardAmount.compareTo(highTier) >= 0) {
            priority += 30;
            factors.add("High reward amount");
        } else if (rewardAmount.compareTo(standardTier) >= 0) {
            priority += 20;
            factors.add("Standard reward amount");
        } else {
            priority += 10;
            factors.add("Basic reward amount");
        }

        // 等待时长
        if (daysSinceCreation >= 7) {
            priority += 25;
            factors.add("Long pending time");
        } else if (daysSinceCreation >= 3) {
            priority += 15;
            factors.add("Moderate pending time");
        } else {
            priority += 5;
            factors.add("Recent creation");
        }

        // 状态
        if (IncentiveStatusEnumVO.APPROVED.equals(incentive.getStatus())) {
            priority += 20;
            factors.add("Ready for payment");
        } else if (IncentiveStatusEnumVO.PENDING_VALIDATION.equals(incentive.getStatus())) {
            priority += 10;
            factors.add("Awaiting validation");
        }

        // 过期风险
        long daysUntilExpiry = policy.getExpiryDays() - daysSinceCreation;
        if (daysUntilExpiry <= 3) {
            priority += 25;
            factors.add("Expiry risk - urgent processing needed");
        } else if (daysUntilExpiry <= 7) {
            priority += 15;
            factors.add("Moderate expiry risk");
        }

        int score = Math.min(PRIORITY_CAP, priority);
        return ProcessingPriorityEntity.builder()
                .score(score)
                .level(getPriorityLevel(score))
                .factors(factors)
                .build();
    }

    /**
     * 风险评估，usageHistory 为空时只评估金额与时效
     */
    public RiskAssessmentEntity generateRiskAssessment(IncentiveAggregate incentive, IncentiveUsageHistoryEntity usageHistory) {
        int riskScore = 0;
        List<String> riskFactors = new ArrayList<>();

        BigDecimal highAmountLine = policy.getMaxRewardAmount().multiply(new BigDecimal("0.5"));
        if (incentive.getRewardAmount().compareTo(highAmountLine) >= 0) {
            riskScore += 30;
            riskFactors.add("High reward amount");
        }

        if (null != usageHistory) {
            if (usageHistory.getTotalIncentivesToday() >= policy.getMaxDailyIncentivesPerIp() * 0.8) {
                riskScore += 25;
                riskFactors.add("High daily usage");
            }
            if (usageHistory.getTotalIncentivesThisWeek() >= policy.getMaxDailyIncentivesPerIp() * 5) {
                riskScore += 20;
                riskFactors.add("High weekly usage");
            }
            if (usageHistory.getConsecutiveDaysActive() >= SUSTAINED_ACTIVITY_DAYS) {
                riskScore += 15;
                riskFactors.add("Sustained high activity");
            }
        }

        if (incentive.getDaysSinceCreation() >= policy.getExpiryDays() * 0.9) {
            riskScore += 10;
            riskFactors.add("Near expiry");
        }

        int score = Math.min(RISK_CAP, riskScore);
        RiskLevelEnumVO riskLevel = getRiskLevel(score);
        return RiskAssessmentEntity.builder()
                .incentiveId(incentive.getId())
                .recipientIP(incentive.getRecipientIP())
                .riskScore(score)
                .riskLevel(riskLevel)
                .riskFactors(riskFactors)
                .recommendedActions(getRecommendedActions(riskLevel))
                .build();
    }

    public BatchPaymentValidationEntity validateBatchPayment(List<IncentiveAggregate> incentives) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (null == incentives || incentives.isEmpty()) {
            errors.add("No incentives provided for batch payment");
            return BatchPaymentValidationEntity.builder()
                    .valid(false)
                    .errors(errors)
                    .warnings(warnings)
                    .validIncentiveCount(0)
                    .totalAmount(BigDecimal.ZERO)
                    .build();
        }

        if (incentives.size() > policy.getMaxBatchSize()) {
            errors.add("Batch payment limited to " + policy.getMaxBatchSize() + " incentives per operation");
        }

        int validCount = 0;
        BigDecimal totalAmount = BigDecimal.ZERO;
        for (IncentiveAggregate incentive : incentives) {
            PaymentEligibilityEntity eligibility = canPayIncentive(incentive);
            if (eligibility.isEligible()) {
                validCount++;
                totalAmount = totalAmount.add(eligibility.getApprovedAmount());
            } else {
                warnings.add("Incentive " + incentive.getId() + ": " + String.join(", ", eligibility.getErrors()));
            }
        }

        if (validCount == 0) {
            errors.add("No valid incentives found for payment");
        }
        if (totalAmount.compareTo(policy.getLargeBatchWarningAmount()) > 0) {
            warnings.add("Large batch payment amount: ¥" + totalAmount.toPlainString() + ". Consider splitting into smaller batches.");
        }

        return BatchPaymentValidationEntity.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .validIncentiveCount(validCount)
                .totalAmount(totalAmount)
                .build();
    }

    public boolean isValidIpAddress(String ip) {
        return IpAddressUtil.isValidIpAddress(ip);
    }

    private PriorityLevelEnumVO getPriorityLevel(int score) {
        if (score >= 80) return PriorityLevelEnumVO.URGENT;
        if (score >= 60) return PriorityLevelEnumVO.HIGH;
        if (score >= 40) return PriorityLevelEnumVO.MEDIUM;
        return PriorityLevelEnumVO.LOW;
    }

    private RiskLevelEnumVO getRiskLevel(int score) {
        if (score >= 75) return RiskLevelEnumVO.CRITICAL;
        if (score >= 50) return RiskLevelEnumVO.HIGH;
        if (score >= 25) return RiskLevelEnumVO.MEDIUM;
        return RiskLevelEnumVO.LOW;
    }

    private List<String> getRecommendedActions(RiskLevelEnumVO riskLevel) {
        switch (riskLevel) {
            case CRITICAL:
                return new ArrayList<>(Arrays.asList("Require manual approval", "Enhanced verification", "Flag for audit"));
            case HIGH:
                return new ArrayList<>(Arrays.asList("Additional verification", "Monitor closely"));
            case MEDIUM:
                return new ArrayList<>(Arrays.asList("Standard verification", "Routine monitoring"));
            default:
                return new ArrayList<>(Collections.singletonList("Standard processing"));
        }
    }

    private static Double asScore(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

}
