package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 支付方式枚举
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum PaymentMethodEnumVO {

    WECHAT_PAY("WECHAT_PAY", "微信支付"),
    ALIPAY("ALIPAY", "支付宝"),
    BANK_TRANSFER("BANK_TRANSFER", "银行转账"),
    MANUAL("MANUAL", "人工发放"),
    ;

    private final String code;
    private final String info;

    public static PaymentMethodEnumVO getByCode(String code) {
        for (PaymentMethodEnumVO value : PaymentMethodEnumVO.values()) {
            if (value.getCode().equals(code)) {
                return value;
            }
        }
        return null;
    }

}
