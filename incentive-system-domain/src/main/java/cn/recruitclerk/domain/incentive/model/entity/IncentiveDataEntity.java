package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * @description 激励持久化数据结构，时间统一为 ISO-8601 字符串
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveDataEntity {

    /** 激励ID */
    private String id;
    /** 收款人 */
    private Recipient recipient;
    /** 奖励 */
    private Reward reward;
    /** 触发条件 */
    private Trigger trigger;
    /** 状态 */
    private String status;
    /** 创建时间 */
    private String createdAt;
    /** 处理时间 */
    private String processedAt;
    /** 支付时间 */
    private String paidAt;
    /** 乐观锁版本号 */
    private Long version;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Recipient {
        private String ip;
        private ContactInfoVO contactInfo;
        private String verificationStatus;
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Reward {
        private BigDecimal amount;
        private String currency;
        private String rewardType;
        private String calculationMethod;
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Trigger {
        private String triggerType;
        private Map<String, Object> triggerData;
        private String qualifiedAt;
    }

}
