package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TriggerTypeEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Date;

/**
 * @description 激励摘要（只读投影）
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveSummaryEntity {

    /** 激励ID */
    private String id;
    /** 收款人IP */
    private String recipientIP;
    /** 奖励金额 */
    private BigDecimal rewardAmount;
    /** 币种 */
    private CurrencyEnumVO rewardCurrency;
    /** 触发类型 */
    private TriggerTypeEnumVO triggerType;
    /** 状态 */
    private IncentiveStatusEnumVO status;
    /** 创建时间 */
    private Date createdAt;
    /** 处理时间 */
    private Date processedAt;
    /** 支付时间 */
    private Date paidAt;
    /** 是否可支付 */
    private boolean canBePaid;
    /** 创建至今天数 */
    private long daysSinceCreation;

}
