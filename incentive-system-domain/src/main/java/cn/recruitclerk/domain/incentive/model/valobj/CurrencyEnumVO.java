package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 币种枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum CurrencyEnumVO {

    CNY("CNY", "人民币"),
    USD("USD", "美元"),
    ;

    private final String code;
    private final String info;

    public static CurrencyEnumVO getByCode(String code) {
        for (CurrencyEnumVO value : CurrencyEnumVO.values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }

}
