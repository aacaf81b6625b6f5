package cn.recruitclerk.domain.incentive.service.payment;

import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.model.entity.PaymentOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;

import java.util.List;

/**
 * @description 激励支付服务
 * @create 2026-10-17
 */
public interface IIncentivePaymentService {

    /**
     * 单笔支付
     *
     * @param incentiveId   激励ID
     * @param paymentMethod 支付方式
     * @param contactInfo   收款联系方式，为空时使用收款人登记的联系方式
     */
    IncentiveOperationResult<PaymentOutcomeEntity> processPayment(String incentiveId, PaymentMethodEnumVO paymentMethod, ContactInfoVO contactInfo);

    /**
     * 批量支付，逐笔顺序处理，单笔失败不影响其他笔；结果按请求ID顺序返回
     */
    IncentiveOperationResult<BatchPaymentSummaryEntity> processBatchPayment(List<String> incentiveIds, PaymentMethodEnumVO paymentMethod);

}
