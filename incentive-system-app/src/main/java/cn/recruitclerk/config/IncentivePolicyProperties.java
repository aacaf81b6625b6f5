package cn.recruitclerk.config;

import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * 激励策略配置属性，未配置的项取默认策略
 */
@Data
@ConfigurationProperties(prefix = "incentive.policy")
public class IncentivePolicyProperties {

    /** 问卷基础奖励（元） */
    private BigDecimal baseQuestionnaireReward = new BigDecimal("5");
    /** 高质量额外奖励 */
    private BigDecimal highQualityBonus = new BigDecimal("3");
    /** 基础质量扣减 */
    private BigDecimal basicQualityPenalty = new BigDecimal("2");
    /** 获得奖励的最低质量分 */
    private int minQualityScore = 50;
    /** 标准质量阈值 */
    private int standardQualityThreshold = 70;
    /** 高质量阈值 */
    private int highQualityThreshold = 90;
    /** 问卷创建即自动审核的质量分 */
    private int autoApproveQualityScore = 70;
    /** 推荐奖励 */
    private BigDecimal referralRewardAmount = new BigDecimal("3");
    /** 单笔最大奖励 */
    private BigDecimal maxRewardAmount = new BigDecimal("100");
    /** 单笔最小奖励 */
    private BigDecimal minRewardAmount = new BigDecimal("1");
    /** 最低提现金额 */
    private BigDecimal minPayoutAmount = new BigDecimal("5");
    /** 激励有效天数 */
    private int expiryDays = 30;
    /** 每IP每日激励上限 */
    private int maxDailyIncentivesPerIp = 3;
    /** 单批支付上限笔数 */
    private int maxBatchSize = 100;
    /** 大额批次告警金额 */
    private BigDecimal largeBatchWarningAmount = new BigDecimal("10000");
    /** 待处理列表默认条数 */
    private int defaultPendingLimit = 50;

    public IncentivePolicyVO toPolicy() {
        return IncentivePolicyVO.builder()
                .baseQuestionnaireReward(baseQuestionnaireReward)
                .highQualityBonus(highQualityBonus)
                .basicQualityPenalty(basicQualityPenalty)
                .minQualityScore(minQualityScore)
                .standardQualityThreshold(standardQualityThreshold)
                .highQualityThreshold(highQualityThreshold)
                .autoApproveQualityScore(autoApproveQualityScore)
                .referralRewardAmount(referralRewardAmount)
                .maxRewardAmount(maxRewardAmount)
                .minRewardAmount(minRewardAmount)
                .minPayoutAmount(minPayoutAmount)
                .expiryDays(expiryDays)
                .maxDailyIncentivesPerIp(maxDailyIncentivesPerIp)
                .maxBatchSize(maxBatchSize)
                .largeBatchWarningAmount(largeBatchWarningAmount)
                .defaultPendingLimit(defaultPendingLimit)
                .build()
                .verify();
    }

}
