package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * @description 激励奖励值对象
 * @create 2026-10-17
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder
@AllArgsConstructor
public class IncentiveRewardVO {

    /** 奖励金额 */
    private final BigDecimal amount;
    /** 币种 */
    private final CurrencyEnumVO currency;
    /** 奖励类型 */
    private final RewardTypeEnumVO rewardType;
    /** 计算说明 */
    private final String calculationMethod;

    /**
     * 按质量分分档计算问卷奖励
     */
    public static IncentiveRewardVO forQuestionnaire(int qualityScore, IncentivePolicyVO policy) {
        BigDecimal amount;
        String calculationMethod;
        if (qualityScore >= policy.getHighQualityThreshold()) {
            amount = policy.getBaseQuestionnaireReward().add(policy.getHighQualityBonus());
            calculationMethod = "High quality bonus (≥" + policy.getHighQualityThreshold() + " score)";
        } else if (qualityScore >= policy.getStandardQualityThreshold()) {
            amount = policy.getBaseQuestionnaireReward();
            calculationMethod = "Standard quality bonus (≥" + policy.getStandardQualityThreshold() + " score)";
        } else if (qualityScore >= policy.getMinQualityScore()) {
            amount = policy.getBaseQuestionnaireReward().subtract(policy.getBasicQualityPenalty());
            calculationMethod = "Basic completion bonus (≥" + policy.getMinQualityScore() + " score)";
        } else {
            amount = BigDecimal.ZERO;
            calculationMethod = "No reward (score <" + policy.getMinQualityScore() + ")";
        }
        return IncentiveRewardVO.builder()
                .amount(amount)
                .currency(CurrencyEnumVO.CNY)
                .rewardType(RewardTypeEnumVO.QUESTIONNAIRE_COMPLETION)
                .calculationMethod(calculationMethod)
                .build();
    }

    public static IncentiveRewardVO forReferral(IncentivePolicyVO policy) {
        return IncentiveRewardVO.builder()
                .amount(policy.getReferralRewardAmount())
                .currency(CurrencyEnumVO.CNY)
                .rewardType(RewardTypeEnumVO.REFERRAL)
                .calculationMethod("Fixed referral reward")
                .build();
    }

    public List<String> validate(IncentivePolicyVO policy) {
        List<String> errors = new ArrayList<>();
        if (null == amount || amount.signum() < 0) {
            errors.add("Reward amount cannot be negative");
        } else if (amount.compareTo(policy.getMaxRewardAmount()) > 0) {
            errors.add("Reward amount cannot exceed " + policy.getMaxRewardAmount().toPlainString() + " CNY");
        }
        if (null == currency) {
            errors.add("Invalid currency");
        }
        return errors;
    }

    public boolean isPositive() {
        return null != amount && amount.signum() > 0;
    }

}
