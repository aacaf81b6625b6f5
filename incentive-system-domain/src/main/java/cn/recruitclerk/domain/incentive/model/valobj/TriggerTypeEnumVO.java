package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 激励触发类型枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum TriggerTypeEnumVO {

    QUESTIONNAIRE_COMPLETION("QUESTIONNAIRE_COMPLETION", "问卷完成"),
    REFERRAL("REFERRAL", "推荐"),
    SYSTEM_PROMOTION("SYSTEM_PROMOTION", "系统推广"),
    ;

    private final String code;
    private final String info;

    public static TriggerTypeEnumVO getByCode(String code) {
        for (TriggerTypeEnumVO value : TriggerTypeEnumVO.values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }

}
