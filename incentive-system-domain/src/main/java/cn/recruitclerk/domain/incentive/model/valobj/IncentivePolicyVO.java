package cn.recruitclerk.domain.incentive.model.valobj;

import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * @description 激励策略，阈值、额度与时间窗口的不可变配置；规则引擎以此为输入
 * @create 2026-10-17
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor
public class IncentivePolicyVO {

    /** 问卷基础奖励（元） */
    private final BigDecimal baseQuestionnaireReward;
    /** 高质量额外奖励 */
    private final BigDecimal highQualityBonus;
    /** 基础质量扣减 */
    private final BigDecimal basicQualityPenalty;
    /** 获得奖励的最低质量分 */
    private final int minQualityScore;
    /** 标准质量阈值 */
    private final int standardQualityThreshold;
    /** 高质量阈值 */
    private final int highQualityThreshold;
    /** 问卷创建即自动审核的质量分 */
    private final int autoApproveQualityScore;
    /** 推荐奖励 */
    private final BigDecimal referralRewardAmount;
    /** 单笔最大奖励 */
    private final BigDecimal maxRewardAmount;
    /** 单笔最小奖励 */
    private final BigDecimal minRewardAmount;
    /** 最低提现金额 */
    private final BigDecimal minPayoutAmount;
    /** 激励有效天数 */
    private final int expiryDays;
    /** 每IP每日激励上限 */
    private final int maxDailyIncentivesPerIp;
    /** 单批支付上限笔数 */
    private final int maxBatchSize;
    /** 大额批次告警金额 */
    private final BigDecimal largeBatchWarningAmount;
    /** 待处理列表默认条数 */
    private final int defaultPendingLimit;

    public static IncentivePolicyVO defaultPolicy() {
        return IncentivePolicyVO.builder()
                .baseQuestionnaireReward(new BigDecimal("5"))
                .highQualityBonus(new BigDecimal("3"))
                .basicQualityPenalty(new BigDecimal("2"))
                .minQualityScore(50)
                .standardQualityThreshold(70)
                .highQualityThreshold(90)
                .autoApproveQualityScore(70)
                .referralRewardAmount(new BigDecimal("3"))
                .maxRewardAmount(new BigDecimal("100"))
                .minRewardAmount(new BigDecimal("1"))
                .minPayoutAmount(new BigDecimal("5"))
                .expiryDays(30)
                .maxDailyIncentivesPerIp(3)
                .maxBatchSize(100)
                .largeBatchWarningAmount(new BigDecimal("10000"))
                .defaultPendingLimit(50)
                .build();
    }

    /**
     * 配置自检，阈值必须有序、金额必须非负
     */
    public IncentivePolicyVO verify() {
        if (!(minQualityScore >= 0 && minQualityScore <= standardQualityThreshold
                && standardQualityThreshold <= highQualityThreshold && highQualityThreshold <= 100)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "质量分阈值必须满足 0 <= min <= standard <= high <= 100");
        }
        if (isNegative(baseQuestionnaireReward) || isNegative(highQualityBonus) || isNegative(basicQualityPenalty)
                || isNegative(referralRewardAmount) || isNegative(minPayoutAmount) || isNegative(minRewardAmount)
                || isNegative(largeBatchWarningAmount)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "激励金额配置不能为负数");
        }
        if (autoApproveQualityScore < 0 || autoApproveQualityScore > 100) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "自动审核质量分必须在 0-100 之间");
        }
        if (null == maxRewardAmount || maxRewardAmount.signum() <= 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "单笔最大奖励必须大于0");
        }
        // 各档奖励都必须落在 [0, 单笔最大奖励] 内
        if (baseQuestionnaireReward.add(highQualityBonus).compareTo(maxRewardAmount) > 0
                || referralRewardAmount.compareTo(maxRewardAmount) > 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "问卷最高档奖励与推荐奖励不能超过单笔最大奖励");
        }
        if (baseQuestionnaireReward.compareTo(basicQualityPenalty) < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "基础质量扣减不能大于问卷基础奖励");
        }
        if (expiryDays <= 0 || maxDailyIncentivesPerIp <= 0 || maxBatchSize <= 0 || defaultPendingLimit <= 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "天数、上限类配置必须大于0");
        }
        return this;
    }

    private static boolean isNegative(BigDecimal amount) {
        return null == amount || amount.signum() < 0;
    }

}
