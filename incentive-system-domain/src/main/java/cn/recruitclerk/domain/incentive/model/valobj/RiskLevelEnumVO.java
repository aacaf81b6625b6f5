package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 风险等级枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum RiskLevelEnumVO {

    LOW("LOW", "低风险"),
    MEDIUM("MEDIUM", "中风险"),
    HIGH("HIGH", "高风险"),
    CRITICAL("CRITICAL", "严重风险"),
    ;

    private final String code;
    private final String info;

}
