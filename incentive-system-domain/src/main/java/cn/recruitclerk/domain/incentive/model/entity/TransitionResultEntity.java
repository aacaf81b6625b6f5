package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * @description 状态流转结果。非法流转返回状态冲突，不抛异常
 * @create 2026-10-17
 */
@Getter
@ToString
@AllArgsConstructor
public class TransitionResultEntity {

    /** 是否流转成功 */
    private final boolean success;
    /** 流转前状态 */
    private final IncentiveStatusEnumVO fromStatus;
    /** 目标状态 */
    private final IncentiveStatusEnumVO toStatus;
    /** 冲突说明 */
    private final String message;

    public static TransitionResultEntity accepted(IncentiveStatusEnumVO from, IncentiveStatusEnumVO to) {
        return new TransitionResultEntity(true, from, to, null);
    }

    public static TransitionResultEntity conflict(IncentiveStatusEnumVO from, IncentiveStatusEnumVO to, String message) {
        return new TransitionResultEntity(false, from, to, message);
    }

    public boolean isConflict() {
        return !success;
    }

}
