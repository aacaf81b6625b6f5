package cn.recruitclerk.domain.incentive.service.payment;

import cn.recruitclerk.domain.incentive.adapter.port.IPaymentGateway;
import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentItemEntity;
import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentValidationEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.model.entity.PaymentEligibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentMethodCompatibilityEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentRequestEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentResponseEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentResultEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import cn.recruitclerk.domain.incentive.service.AbstractIncentiveService;
import cn.recruitclerk.types.enums.ResponseCode;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.Resource;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 激励支付服务
 * <p>
 * 1. 支付资格、支付方式与联系方式匹配、聚合前置条件全部通过后才调用网关
 * 2. 网关返回成功后才执行聚合支付
 * 3. 网关请求携带幂等键 incentiveId:version，持久化时做乐观锁校验，防止重复支付
 * </p>
 *
 * @create 2026-10-17
 */
@Slf4j
@Service
public class IncentivePaymentService extends AbstractIncentiveService implements IIncentivePaymentService {

    @Resource
    private IPaymentGateway paymentGateway;

    @Override
    public IncentiveOperationResult<PaymentOutcomeEntity> processPayment(String incentiveId, PaymentMethodEnumVO paymentMethod, ContactInfoVO contactInfo) {
        log.info("激励支付开始 incentiveId:{} paymentMethod:{}", incentiveId, paymentMethod);
        try {
            IncentiveAggregate incentive = repository.findById(incentiveId);
            if (null == incentive) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, NOT_FOUND_ERROR);
            }

            ContactInfoVO recipientInfo = null == contactInfo ? incentive.getContactInfo() : contactInfo;
            PaymentAttempt attempt = pay(incentive, paymentMethod, recipientInfo);
            if (!attempt.success) {
                auditBusiness("INCENTIVE_PAYMENT_FAILED", mapOf(
                        "incentiveId", incentiveId,
                        "paymentMethod", null == paymentMethod ? null : paymentMethod.getCode(),
                        "errors", attempt.errors));
                return IncentiveOperationResult.failed(attempt.code, attempt.errors);
            }

            auditBusiness("INCENTIVE_PAID", mapOf(
                    "incentiveId", incentiveId,
                    "amount", attempt.amount,
                    "currency", incentive.getRewardCurrency().getCode(),
                    "paymentMethod", paymentMethod.getCode(),
                    "transactionId", attempt.transactionId));
            log.info("激励支付完成 incentiveId:{} transactionId:{} amount:{}", incentiveId, attempt.transactionId, attempt.amount);
            return IncentiveOperationResult.success(PaymentOutcomeEntity.builder()
                    .incentiveId(incentiveId)
                    .transactionId(attempt.transactionId)
                    .amount(attempt.amount)
                    .currency(incentive.getRewardCurrency())
                    .paymentMethod(paymentMethod)
                    .status(incentive.getStatus())
                    .build());
        } catch (Exception e) {
            log.error("激励支付失败 incentiveId:{} paymentMethod:{}", incentiveId, paymentMethod, e);
            auditError("PROCESS_PAYMENT_ERROR", mapOf("incentiveId", incentiveId, "paymentMethod", paymentMethod), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while processing payment");
        }
    }

    @Override
    public IncentiveOperationResult<BatchPaymentSummaryEntity> processBatchPayment(List<String> incentiveIds, PaymentMethodEnumVO paymentMethod) {
        List<String> requestIds = null == incentiveIds ? Collections.<String>emptyList() : incentiveIds;
        log.info("批量支付开始 count:{} paymentMethod:{}", requestIds.size(), paymentMethod);
        try {
            int maxBatchSize = rules.getPolicy().getMaxBatchSize();
            if (requestIds.size() > maxBatchSize) {
                log.info("批量支付笔数超限 count:{} maxBatchSize:{}", requestIds.size(), maxBatchSize);
                return IncentiveOperationResult.failed(ResponseCode.E0102,
                        "Batch payment limited to " + maxBatchSize + " incentives per operation");
            }

            List<IncentiveAggregate> incentives = requestIds.isEmpty() ? Collections.<IncentiveAggregate>emptyList() : repository.findByIds(requestIds);
            if (null == incentives || incentives.isEmpty()) {
                return IncentiveOperationResult.failed(ResponseCode.E0104, "No valid incentives found");
            }

            BatchPaymentValidationEntity validation = rules.validateBatchPayment(incentives);
            if (!validation.isValid()) {
                log.info("批量支付校验未通过 errors:{} warnings:{}", validation.getErrors(), validation.getWarnings());
                return IncentiveOperationResult.failed(ResponseCode.E0102, validation.getErrors());
            }
            if (!validation.getWarnings().isEmpty()) {
                log.warn("批量支付校验告警 warnings:{}", JSON.toJSONString(validation.getWarnings()));
            }

            Map<String, IncentiveAggregate> incentiveMap = new LinkedHashMap<>();
            for (IncentiveAggregate incentive : incentives) {
                incentiveMap.put(incentive.getId(), incentive);
            }

            List<BatchPaymentItemEntity> results = new ArrayList<>(requestIds.size());
            Set<String> processed = new HashSet<>();
            int successCount = 0;
            BigDecimal totalPaidAmount = BigDecimal.ZERO;
            for (String incentiveId : requestIds) {
                BatchPaymentItemEntity item;
                if (!processed.add(incentiveId)) {
                    item = failedItem(incentiveId, "Duplicate incentive id in batch");
                } else {
                    item = payItem(incentiveId, incentiveMap.get(incentiveId), paymentMethod);
                }
                results.add(item);
                if (item.isSuccess()) {
                    successCount++;
                    totalPaidAmount = totalPaidAmount.add(item.getAmount());
                }
            }

            BatchPaymentSummaryEntity summary = BatchPaymentSummaryEntity.builder()
                    .totalIncentives(requestIds.size())
                    .successCount(successCount)
                    .failureCount(requestIds.size() - successCount)
                    .totalPaidAmount(totalPaidAmount)
                    .results(results)
                    .build();

            auditBusiness("BATCH_PAYMENT_PROCESSED", mapOf(
                    "totalIncentives", summary.getTotalIncentives(),
                    "successCount", summary.getSuccessCount(),
                    "failureCount", summary.getFailureCount(),
                    "totalPaidAmount", summary.getTotalPaidAmount(),
                    "paymentMethod", null == paymentMethod ? null : paymentMethod.getCode()));
            log.info("批量支付完成 total:{} success:{} failure:{} totalPaidAmount:{}",
                    summary.getTotalIncentives(), summary.getSuccessCount(), summary.getFailureCount(), summary.getTotalPaidAmount());
            return IncentiveOperationResult.success(summary);
        } catch (Exception e) {
            log.error("批量支付失败 incentiveIds:{} paymentMethod:{}", JSON.toJSONString(requestIds), paymentMethod, e);
            auditError("PROCESS_BATCH_PAYMENT_ERROR", mapOf("incentiveIds", requestIds, "paymentMethod", paymentMethod), e);
            return IncentiveOperationResult.failed(ResponseCode.UN_ERROR, "Internal error occurred while processing batch payment");
        }
    }

    private BatchPaymentItemEntity payItem(String incentiveId, IncentiveAggregate incentive, PaymentMethodEnumVO paymentMethod) {
        if (null == incentive) {
            return failedItem(incentiveId, NOT_FOUND_ERROR);
        }
        try {
            PaymentAttempt attempt = pay(incentive, paymentMethod, incentive.getContactInfo());
            if (!attempt.success) {
                log.info("批量支付单笔失败 incentiveId:{} errors:{}", incentiveId, attempt.errors);
                return failedItem(incentiveId, String.join(", ", attempt.errors));
            }
            return BatchPaymentItemEntity.builder()
                    .incentiveId(incentiveId)
                    .success(true)
                    .transactionId(attempt.transactionId)
                    .amount(attempt.amount)
                    .build();
        } catch (Exception e) {
            log.error("批量支付单笔异常 incentiveId:{}", incentiveId, e);
            return failedItem(incentiveId, "Payment processing failed: " + (null == e.getMessage() ? e.getClass().getSimpleName() : e.getMessage()));
        }
    }

    /**
     * 单笔支付主流程，业务失败以结果返回，异常交由调用方处理
     */
    private PaymentAttempt pay(IncentiveAggregate incentive, PaymentMethodEnumVO paymentMethod, ContactInfoVO recipientInfo) {
        // 1. 支付资格
        PaymentEligibilityEntity eligibility = rules.canPayIncentive(incentive);
        if (!eligibility.isEligible()) {
            return PaymentAttempt.failed(ResponseCode.E0102, eligibility.getErrors());
        }

        // 2. 支付方式与联系方式
        PaymentMethodCompatibilityEntity compatibility = rules.validatePaymentMethodCompatibility(paymentMethod, recipientInfo);
        if (!compatibility.isCompatible()) {
            return PaymentAttempt.failed(ResponseCode.E0101, compatibility.getErrors());
        }

        // 3. 聚合前置条件，未通过时不调用网关
        String preconditionError = incentive.checkPaymentPreconditions(new Date());
        if (null != preconditionError) {
            return PaymentAttempt.failed(ResponseCode.E0102, Collections.singletonList(preconditionError));
        }

        // 4. 网关
        PaymentRequestEntity request = PaymentRequestEntity.builder()
                .amount(eligibility.getApprovedAmount())
                .currency(incentive.getRewardCurrency())
                .paymentMethod(paymentMethod)
                .recipientInfo(recipientInfo)
                .reference(incentive.getId())
                .idempotencyKey(incentive.getId() + ":" + incentive.getVersion())
                .build();
        PaymentResponseEntity response = paymentGateway.processPayment(request);
        if (null == response || !response.isSuccess()) {
            String error = null == response ? "empty response" : response.getError();
            log.warn("支付网关返回失败 incentiveId:{} error:{}", incentive.getId(), error);
            return PaymentAttempt.failed(ResponseCode.E0105, Collections.singletonList("Payment gateway error: " + error));
        }

        // 5. 聚合支付
        PaymentResultEntity result = incentive.executePayment(paymentMethod, response.getTransactionId());
        if (!result.isSuccess()) {
            log.error("网关已扣款但激励支付失败，需人工对账 incentiveId:{} transactionId:{} error:{}",
                    incentive.getId(), response.getTransactionId(), result.getError());
            auditSecurity("PAYMENT_SETTLED_WITHOUT_STATE_CHANGE", mapOf(
                    "incentiveId", incentive.getId(),
                    "transactionId", response.getTransactionId(),
                    "error", result.getError()));
            return PaymentAttempt.failed(ResponseCode.E0103, Collections.singletonList(result.getError()));
        }

        // 6. 持久化（乐观锁）并发布事件
        if (!saveAndPublish(incentive)) {
            return PaymentAttempt.failed(ResponseCode.E0106, Collections.singletonList(CONCURRENT_MODIFICATION_ERROR));
        }
        return PaymentAttempt.succeeded(result.getTransactionId(), result.getAmount());
    }

    private static BatchPaymentItemEntity failedItem(String incentiveId, String error) {
        return BatchPaymentItemEntity.builder()
                .incentiveId(incentiveId)
                .success(false)
                .error(error)
                .build();
    }

    private static class PaymentAttempt {
        private final boolean success;
        private final ResponseCode code;
        private final List<String> errors;
        private final String transactionId;
        private final BigDecimal amount;

        private PaymentAttempt(boolean success, ResponseCode code, List<String> errors, String transactionId, BigDecimal amount) {
            this.success = success;
            this.code = code;
            this.errors = errors;
            this.transactionId = transactionId;
            this.amount = amount;
        }

        static PaymentAttempt succeeded(String transactionId, BigDecimal amount) {
            return new PaymentAttempt(true, ResponseCode.SUCCESS, Collections.<String>emptyList(), transactionId, amount);
        }

        static PaymentAttempt failed(ResponseCode code, List<String> errors) {
            return new PaymentAttempt(false, code, errors, null, null);
        }
    }

}
