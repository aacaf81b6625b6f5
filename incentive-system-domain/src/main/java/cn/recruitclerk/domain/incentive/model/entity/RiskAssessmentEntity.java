package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.RiskLevelEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * @description 风险评估结果
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RiskAssessmentEntity {

    private String incentiveId;
    private String recipientIP;
    /** 风险分 0-100 */
    private int riskScore;
    /** 风险等级 */
    private RiskLevelEnumVO riskLevel;
    /** 风险因素 */
    private List<String> riskFactors;
    /** 建议动作 */
    private List<String> recommendedActions;

}
