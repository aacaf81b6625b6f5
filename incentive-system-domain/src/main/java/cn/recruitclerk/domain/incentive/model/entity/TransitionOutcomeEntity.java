package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * @description 审核/拒绝结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TransitionOutcomeEntity {

    private String incentiveId;
    private IncentiveStatusEnumVO status;
    private BigDecimal rewardAmount;
    /** 审核或拒绝原因 */
    private String reason;

}
