package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 处理优先级枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum PriorityLevelEnumVO {

    LOW("LOW", "低"),
    MEDIUM("MEDIUM", "中"),
    HIGH("HIGH", "高"),
    URGENT("URGENT", "紧急"),
    ;

    private final String code;
    private final String info;

}
