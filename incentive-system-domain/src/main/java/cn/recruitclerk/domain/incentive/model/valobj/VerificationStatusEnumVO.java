package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 收款人核验状态枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum VerificationStatusEnumVO {

    PENDING("PENDING", "待核验"),
    VERIFIED("VERIFIED", "已核验"),
    FAILED("FAILED", "核验失败"),
    ;

    private final String code;
    private final String info;

    public static VerificationStatusEnumVO getByCode(String code) {
        for (VerificationStatusEnumVO value : VerificationStatusEnumVO.values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }

}
