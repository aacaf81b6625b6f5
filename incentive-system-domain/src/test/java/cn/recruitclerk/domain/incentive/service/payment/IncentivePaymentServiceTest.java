package cn.recruitclerk.domain.incentive.service.payment;

import cn.recruitclerk.domain.incentive.IncentiveFixtures;
import cn.recruitclerk.domain.incentive.adapter.port.IAuditLogger;
import cn.recruitclerk.domain.incentive.adapter.port.IIncentiveEventBus;
import cn.recruitclerk.domain.incentive.adapter.port.IPaymentGateway;
import cn.recruitclerk.domain.incentive.adapter.repository.IIncentiveRepository;
import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.BatchPaymentSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveOperationResult;
import cn.recruitclerk.domain.incentive.model.entity.PaymentOutcomeEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentRequestEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentResponseEntity;
import cn.recruitclerk.domain.incentive.model.event.IncentiveDomainEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentivePaidEvent;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import cn.recruitclerk.domain.incentive.service.rule.IncentiveRules;
import cn.recruitclerk.types.enums.ResponseCode;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.MockitoJUnitRunner;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
@RunWith(MockitoJUnitRunner.class)
public class IncentivePaymentServiceTest {

    @Mock
    private IIncentiveRepository repository;

    @Mock
    private IIncentiveEventBus eventBus;

    @Mock
    private IAuditLogger auditLogger;

    @Mock
    private IPaymentGateway paymentGateway;

    @Spy
    private IncentiveRules rules = new IncentiveRules(IncentivePolicyVO.defaultPolicy());

    @InjectMocks
    private IncentivePaymentService paymentService;

    @Test
    public void test_processPayment_success() {
        IncentiveAggregate incentive = IncentiveFixtures.approved("i1", "8");
        when(repository.findById("i1")).thenReturn(incentive);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenReturn(success("tx-1"));
        when(repository.save(incentive)).thenReturn(true);

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);
        log.info("测试结果: {}", JSON.toJSONString(result));

        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals("tx-1", result.getData().getTransactionId());
        Assert.assertEquals(0, new BigDecimal("8").compareTo(result.getData().getAmount()));
        Assert.assertEquals(IncentiveStatusEnumVO.PAID, result.getData().getStatus());

        ArgumentCaptor<PaymentRequestEntity> captor = ArgumentCaptor.forClass(PaymentRequestEntity.class);
        verify(paymentGateway).processPayment(captor.capture());
        PaymentRequestEntity request = captor.getValue();
        Assert.assertEquals("i1", request.getReference());
        Assert.assertEquals("i1:1", request.getIdempotencyKey());
        Assert.assertEquals("wx_user_01", request.getRecipientInfo().getWechat());
        Assert.assertEquals(0, new BigDecimal("8").compareTo(request.getAmount()));

        verify(eventBus).publish(any(IncentivePaidEvent.class));
        verify(auditLogger).logBusinessEvent(eq("INCENTIVE_PAID"), anyMap());
    }

    @Test
    public void test_processPayment_explicitContact() {
        IncentiveAggregate incentive = IncentiveFixtures.approved("i1", "8");
        when(repository.findById("i1")).thenReturn(incentive);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenReturn(success("tx-2"));
        when(repository.save(incentive)).thenReturn(true);

        ContactInfoVO alipay = ContactInfoVO.builder().alipay("user@alipay").build();
        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.ALIPAY, alipay);

        Assert.assertTrue(result.isSuccess());
        Assert.assertEquals(PaymentMethodEnumVO.ALIPAY, result.getData().getPaymentMethod());
    }

    @Test
    public void test_processPayment_belowMinimumPayout() {
        when(repository.findById("i1")).thenReturn(IncentiveFixtures.approved("i1", "3"));

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);

        Assert.assertEquals(ResponseCode.E0102.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Reward amount (3) is below minimum payout threshold (5)"), result.getErrors());
        verify(paymentGateway, never()).processPayment(any(PaymentRequestEntity.class));
        verify(auditLogger).logBusinessEvent(eq("INCENTIVE_PAYMENT_FAILED"), anyMap());
    }

    @Test
    public void test_processPayment_incompatibleMethod() {
        when(repository.findById("i1")).thenReturn(IncentiveFixtures.approved("i1", "8"));

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.ALIPAY, null);

        Assert.assertEquals(ResponseCode.E0101.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Alipay account is required for Alipay payment"), result.getErrors());
        verify(paymentGateway, never()).processPayment(any(PaymentRequestEntity.class));
    }

    @Test
    public void test_processPayment_expiredWithinLastDay_gatewayNotCalled() {
        IncentiveAggregate incentive = IncentiveFixtures.incentive("i1", IncentiveStatusEnumVO.APPROVED, "8", 30.5);
        when(repository.findById("i1")).thenReturn(incentive);

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);

        Assert.assertEquals(ResponseCode.E0102.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Incentive has expired (>30 days old)"), result.getErrors());
        Assert.assertEquals(IncentiveStatusEnumVO.APPROVED, incentive.getStatus());
        verify(paymentGateway, never()).processPayment(any(PaymentRequestEntity.class));
    }

    @Test
    public void test_processPayment_gatewayRejected() {
        IncentiveAggregate incentive = IncentiveFixtures.approved("i1", "8");
        when(repository.findById("i1")).thenReturn(incentive);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class)))
                .thenReturn(PaymentResponseEntity.builder().success(false).error("insufficient balance").build());

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);

        Assert.assertEquals(ResponseCode.E0105.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Payment gateway error: insufficient balance"), result.getErrors());
        Assert.assertEquals(IncentiveStatusEnumVO.APPROVED, incentive.getStatus());
        verify(repository, never()).save(any(IncentiveAggregate.class));
        verify(eventBus, never()).publish(any(IncentiveDomainEvent.class));
    }

    @Test
    public void test_processPayment_gatewayException() {
        when(repository.findById("i1")).thenReturn(IncentiveFixtures.approved("i1", "8"));
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenThrow(new IllegalStateException("connect timeout"));

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);

        Assert.assertEquals(ResponseCode.UN_ERROR.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Internal error occurred while processing payment"), result.getErrors());
        verify(auditLogger).logError(eq("PROCESS_PAYMENT_ERROR"), anyMap());
    }

    @Test
    public void test_processPayment_concurrentModification() {
        IncentiveAggregate incentive = IncentiveFixtures.approved("i1", "8");
        when(repository.findById("i1")).thenReturn(incentive);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenReturn(success("tx-3"));
        when(repository.save(incentive)).thenReturn(false);

        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("i1", PaymentMethodEnumVO.WECHAT_PAY, null);

        Assert.assertEquals(ResponseCode.E0106.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Incentive was modified concurrently, please retry"), result.getErrors());
        verify(eventBus, never()).publish(any(IncentiveDomainEvent.class));
    }

    @Test
    public void test_processPayment_notFound() {
        IncentiveOperationResult<PaymentOutcomeEntity> result = paymentService.processPayment("missing", PaymentMethodEnumVO.WECHAT_PAY, null);
        Assert.assertEquals(ResponseCode.E0104.getCode(), result.getCode());
    }

    @Test
    public void test_processBatchPayment_partialFailure() {
        IncentiveAggregate first = IncentiveFixtures.approved("id1", "8");
        IncentiveAggregate second = IncentiveFixtures.approved("id2", "8");
        when(repository.findByIds(Arrays.asList("id1", "id2"))).thenReturn(Arrays.asList(first, second));
        when(repository.save(first)).thenReturn(true);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenAnswer(invocation -> {
            PaymentRequestEntity request = invocation.getArgument(0);
            if ("id2".equals(request.getReference())) {
                throw new IllegalStateException("gateway timeout");
            }
            return success("tx-" + request.getReference());
        });

        IncentiveOperationResult<BatchPaymentSummaryEntity> result = paymentService.processBatchPayment(
                Arrays.asList("id1", "id2"), PaymentMethodEnumVO.WECHAT_PAY);
        log.info("测试结果: {}", JSON.toJSONString(result));

        BatchPaymentSummaryEntity summary = result.getData();
        Assert.assertEquals(2, summary.getTotalIncentives());
        Assert.assertEquals(1, summary.getSuccessCount());
        Assert.assertEquals(1, summary.getFailureCount());
        Assert.assertEquals(0, new BigDecimal("8").compareTo(summary.getTotalPaidAmount()));
        Assert.assertEquals("id1", summary.getResults().get(0).getIncentiveId());
        Assert.assertEquals("tx-id1", summary.getResults().get(0).getTransactionId());
        Assert.assertEquals("id2", summary.getResults().get(1).getIncentiveId());
        Assert.assertEquals("Payment processing failed: gateway timeout", summary.getResults().get(1).getError());
        Assert.assertEquals(IncentiveStatusEnumVO.PAID, first.getStatus());
        Assert.assertEquals(IncentiveStatusEnumVO.APPROVED, second.getStatus());
        verify(auditLogger).logBusinessEvent(eq("BATCH_PAYMENT_PROCESSED"), anyMap());
    }

    @Test
    public void test_processBatchPayment_duplicateAndMissingIds() {
        IncentiveAggregate first = IncentiveFixtures.approved("id1", "8");
        when(repository.findByIds(anyList())).thenReturn(Collections.singletonList(first));
        when(repository.save(first)).thenReturn(true);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenReturn(success("tx-1"));

        BatchPaymentSummaryEntity summary = paymentService.processBatchPayment(
                Arrays.asList("id1", "id1", "ghost"), PaymentMethodEnumVO.WECHAT_PAY).getData();

        Assert.assertEquals(3, summary.getTotalIncentives());
        Assert.assertEquals(1, summary.getSuccessCount());
        Assert.assertEquals(2, summary.getFailureCount());
        Assert.assertEquals("Duplicate incentive id in batch", summary.getResults().get(1).getError());
        Assert.assertEquals("ghost", summary.getResults().get(2).getIncentiveId());
        Assert.assertEquals("Incentive not found", summary.getResults().get(2).getError());
        verify(paymentGateway).processPayment(any(PaymentRequestEntity.class));
    }

    @Test
    public void test_processBatchPayment_ineligibleItemReported() {
        IncentiveAggregate payable = IncentiveFixtures.approved("id1", "8");
        IncentiveAggregate small = IncentiveFixtures.approved("id2", "3");
        when(repository.findByIds(anyList())).thenReturn(Arrays.asList(payable, small));
        when(repository.save(payable)).thenReturn(true);
        when(paymentGateway.processPayment(any(PaymentRequestEntity.class))).thenReturn(success("tx-1"));

        BatchPaymentSummaryEntity summary = paymentService.processBatchPayment(
                Arrays.asList("id1", "id2"), PaymentMethodEnumVO.WECHAT_PAY).getData();

        Assert.assertEquals(1, summary.getSuccessCount());
        Assert.assertEquals("Reward amount (3) is below minimum payout threshold (5)", summary.getResults().get(1).getError());
    }

    @Test
    public void test_processBatchPayment_emptyInput() {
        IncentiveOperationResult<BatchPaymentSummaryEntity> empty = paymentService.processBatchPayment(
                Collections.<String>emptyList(), PaymentMethodEnumVO.WECHAT_PAY);
        Assert.assertEquals(ResponseCode.E0104.getCode(), empty.getCode());
        Assert.assertEquals(Collections.singletonList("No valid incentives found"), empty.getErrors());

        IncentiveOperationResult<BatchPaymentSummaryEntity> nothingFound = paymentService.processBatchPayment(null, PaymentMethodEnumVO.WECHAT_PAY);
        Assert.assertEquals(ResponseCode.E0104.getCode(), nothingFound.getCode());
    }

    @Test
    public void test_processBatchPayment_noPayableIncentive() {
        when(repository.findByIds(anyList())).thenReturn(Collections.singletonList(IncentiveFixtures.approved("id1", "3")));

        IncentiveOperationResult<BatchPaymentSummaryEntity> result = paymentService.processBatchPayment(
                Collections.singletonList("id1"), PaymentMethodEnumVO.WECHAT_PAY);

        Assert.assertEquals(ResponseCode.E0102.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("No valid incentives found for payment"), result.getErrors());
        verify(paymentGateway, never()).processPayment(any(PaymentRequestEntity.class));
    }

    @Test
    public void test_processBatchPayment_requestOverLimit() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            ids.add("id" + i);
        }

        IncentiveOperationResult<BatchPaymentSummaryEntity> result = paymentService.processBatchPayment(ids, PaymentMethodEnumVO.WECHAT_PAY);

        Assert.assertFalse(result.isSuccess());
        Assert.assertEquals(ResponseCode.E0102.getCode(), result.getCode());
        Assert.assertEquals(Collections.singletonList("Batch payment limited to 100 incentives per operation"), result.getErrors());
        verify(repository, never()).findByIds(anyList());
        verify(paymentGateway, never()).processPayment(any(PaymentRequestEntity.class));
    }

    private static PaymentResponseEntity success(String transactionId) {
        return PaymentResponseEntity.builder().success(true).transactionId(transactionId).build();
    }

}
