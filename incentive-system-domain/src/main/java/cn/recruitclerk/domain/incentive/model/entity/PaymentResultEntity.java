package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * @description 聚合执行支付的结果
 * @create 2026-10-17
 */
@Getter
@ToString
@AllArgsConstructor
public class PaymentResultEntity {

    private final boolean success;
    private final String transactionId;
    private final BigDecimal amount;
    private final CurrencyEnumVO currency;
    private final String error;

    public static PaymentResultEntity success(String transactionId, BigDecimal amount, CurrencyEnumVO currency) {
        return new PaymentResultEntity(true, transactionId, amount, currency, null);
    }

    public static PaymentResultEntity failed(String error) {
        return new PaymentResultEntity(false, null, null, null, error);
    }

}
