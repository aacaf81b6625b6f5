package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 奖励类型枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum RewardTypeEnumVO {

    QUESTIONNAIRE_COMPLETION("QUESTIONNAIRE_COMPLETION", "问卷完成奖励"),
    REFERRAL("REFERRAL", "推荐奖励"),
    PROMOTION("PROMOTION", "推广奖励"),
    ;

    private final String code;
    private final String info;

    public static RewardTypeEnumVO getByCode(String code) {
        for (RewardTypeEnumVO value : RewardTypeEnumVO.values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }

}
