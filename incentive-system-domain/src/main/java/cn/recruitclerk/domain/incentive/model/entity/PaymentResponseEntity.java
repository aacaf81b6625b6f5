package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @description 支付网关响应
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PaymentResponseEntity {

    private boolean success;
    /** 交易流水号 */
    private String transactionId;
    /** 失败原因 */
    private String error;

}
