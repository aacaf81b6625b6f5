package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * @description 激励状态枚举，合法流转关系以数据形式维护
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum IncentiveStatusEnumVO {

    PENDING_VALIDATION("PENDING_VALIDATION", "待校验"),
    APPROVED("APPROVED", "已审核，待支付"),
    REJECTED("REJECTED", "已拒绝"),
    PAID("PAID", "已支付"),
    EXPIRED("EXPIRED", "已过期"),
    ;

    private final String code;
    private final String info;

    private static final Map<IncentiveStatusEnumVO, Set<IncentiveStatusEnumVO>> TRANSITIONS = new EnumMap<>(IncentiveStatusEnumVO.class);

    static {
        TRANSITIONS.put(PENDING_VALIDATION, EnumSet.of(APPROVED, REJECTED, EXPIRED));
        TRANSITIONS.put(APPROVED, EnumSet.of(PAID, REJECTED, EXPIRED));
        // 已拒绝可重复拒绝（刷新拒绝原因），已过期可被拒绝归档；只有已支付不可再拒绝
        TRANSITIONS.put(REJECTED, EnumSet.of(REJECTED));
        TRANSITIONS.put(EXPIRED, EnumSet.of(REJECTED));
        TRANSITIONS.put(PAID, EnumSet.noneOf(IncentiveStatusEnumVO.class));
    }

    public boolean canTransitionTo(IncentiveStatusEnumVO target) {
        return null != target && TRANSITIONS.get(this).contains(target);
    }

    public Set<IncentiveStatusEnumVO> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public static IncentiveStatusEnumVO getByCode(String code) {
        for (IncentiveStatusEnumVO status : IncentiveStatusEnumVO.values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        return null;
    }

}
