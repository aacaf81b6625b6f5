package cn.recruitclerk.domain.incentive.adapter.port;

import cn.recruitclerk.domain.incentive.model.entity.PaymentRequestEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentResponseEntity;

/**
 * @description 支付网关端口。重试、对账由网关自身负责
 * @create 2026-10-17
 */
public interface IPaymentGateway {

    /**
     * 发起支付，相同 idempotencyKey 的请求最多结算一次
     */
    PaymentResponseEntity processPayment(PaymentRequestEntity request);

}
