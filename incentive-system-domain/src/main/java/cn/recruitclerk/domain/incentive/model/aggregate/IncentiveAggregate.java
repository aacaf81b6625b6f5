package cn.recruitclerk.domain.incentive.model.aggregate;

import cn.recruitclerk.domain.incentive.model.entity.EligibilityCheckEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveDataEntity;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveSummaryEntity;
import cn.recruitclerk.domain.incentive.model.entity.PaymentResultEntity;
import cn.recruitclerk.domain.incentive.model.entity.TransitionResultEntity;
import cn.recruitclerk.domain.incentive.model.event.IncentiveApprovedEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentiveCreatedEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentiveDomainEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentivePaidEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentiveRejectedEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentiveValidatedEvent;
import cn.recruitclerk.domain.incentive.model.event.IncentiveValidationFailedEvent;
import cn.recruitclerk.domain.incentive.model.event.PaymentFailedEvent;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.CurrencyEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveRecipientVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveRewardVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.PaymentMethodEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.QuestionnaireTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.ReferralTriggerVO;
import cn.recruitclerk.domain.incentive.model.valobj.RewardTypeEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TriggerTypeEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.VerificationStatusEnumVO;
import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;
import cn.recruitclerk.types.utils.IncentiveIdUtil;
import cn.recruitclerk.types.utils.IpAddressUtil;
import cn.recruitclerk.types.utils.IsoDateUtil;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * @description 激励聚合根
 * <p>
 * 状态机：PENDING_VALIDATION -> APPROVED -> PAID，任一未支付状态可被拒绝，EXPIRED 由外部置位。
 * 每次变更都会把领域事件写入未提交缓冲区，由领域服务在持久化后按顺序发布。
 * </p>
 * @create 2026-10-17
 */
@Getter
public class IncentiveAggregate {

    /** 激励ID */
    private final String id;
    /** 收款人 */
    private final IncentiveRecipientVO recipient;
    /** 奖励 */
    private final IncentiveRewardVO reward;
    /** 触发条件 */
    private final IncentiveTriggerVO trigger;
    /** 状态 */
    private IncentiveStatusEnumVO status;
    /** 创建时间 */
    @Getter(AccessLevel.NONE)
    private final Date createdAt;
    /** 审核/拒绝时间 */
    @Getter(AccessLevel.NONE)
    private Date processedAt;
    /** 支付时间 */
    @Getter(AccessLevel.NONE)
    private Date paidAt;
    /** 乐观锁版本号，加载时的持久化版本 */
    private final long version;

    @Getter(AccessLevel.NONE)
    private final IncentivePolicyVO policy;

    @Getter(AccessLevel.NONE)
    private final List<IncentiveDomainEvent> uncommittedEvents = new ArrayList<>();

    private IncentiveAggregate(String id, IncentiveRecipientVO recipient, IncentiveRewardVO reward, IncentiveTriggerVO trigger,
                               IncentiveStatusEnumVO status, Date createdAt, Date processedAt, Date paidAt, long version,
                               IncentivePolicyVO policy) {
        this.id = id;
        this.recipient = recipient;
        this.reward = reward;
        this.trigger = trigger;
        this.status = status;
        this.createdAt = createdAt;
        this.processedAt = processedAt;
        this.paidAt = paidAt;
        this.version = version;
        this.policy = policy;
    }

    public static IncentiveAggregate createQuestionnaireIncentive(String ip, String questionnaireId, int qualityScore, ContactInfoVO contactInfo) {
        return createQuestionnaireIncentive(ip, questionnaireId, qualityScore, contactInfo, IncentivePolicyVO.defaultPolicy());
    }

    /**
     * 创建问卷激励。质量分达到自动审核线时，创建后立即审核通过
     */
    public static IncentiveAggregate createQuestionnaireIncentive(String ip, String questionnaireId, int qualityScore,
                                                                  ContactInfoVO contactInfo, IncentivePolicyVO policy) {
        Date now = new Date();
        IncentiveAggregate incentive = new IncentiveAggregate(
                IncentiveIdUtil.nextId(now.getTime()),
                IncentiveRecipientVO.create(ip, contactInfo),
                IncentiveRewardVO.forQuestionnaire(qualityScore, policy),
                new QuestionnaireTriggerVO(questionnaireId, qualityScore, now),
                IncentiveStatusEnumVO.PENDING_VALIDATION,
                now, null, null, 0L, policy);
        incentive.addCreatedEvent(now);

        if (qualityScore >= policy.getAutoApproveQualityScore()) {
            incentive.approveForProcessing("High quality questionnaire completion");
        }
        return incentive;
    }

    public static IncentiveAggregate createReferralIncentive(String referrerIP, String referredIP, ContactInfoVO contactInfo) {
        return createReferralIncentive(referrerIP, referredIP, contactInfo, IncentivePolicyVO.defaultPolicy());
    }

    /**
     * 创建推荐激励，固定奖励，不自动审核
     */
    public static IncentiveAggregate createReferralIncentive(String referrerIP, String referredIP, ContactInfoVO contactInfo,
                                                             IncentivePolicyVO policy) {
        Date now = new Date();
        IncentiveAggregate incentive = new IncentiveAggregate(
                IncentiveIdUtil.nextId(now.getTime()),
                IncentiveRecipientVO.create(referrerIP, contactInfo),
                IncentiveRewardVO.forReferral(policy),
                new ReferralTriggerVO(referrerIP, referredIP, now),
                IncentiveStatusEnumVO.PENDING_VALIDATION,
                now, null, null, 0L, policy);
        incentive.addCreatedEvent(now);
        return incentive;
    }

    public static IncentiveAggregate restore(IncentiveDataEntity data) {
        return restore(data, IncentivePolicyVO.defaultPolicy());
    }

    /**
     * 从持久化数据还原，不产生事件；数据不完整时抛出 AppException
     */
    public static IncentiveAggregate restore(IncentiveDataEntity data, IncentivePolicyVO policy) {
        if (null == data || StringUtils.isBlank(data.getId())) {
            throw new AppException(ResponseCode.E0107, "Incentive data id is required");
        }
        if (null == data.getRecipient() || null == data.getReward() || null == data.getTrigger()) {
            throw new AppException(ResponseCode.E0107, "Incentive data is incomplete: " + data.getId());
        }

        IncentiveStatusEnumVO status = IncentiveStatusEnumVO.getByCode(data.getStatus());
        if (null == status) {
            throw new AppException(ResponseCode.E0107, "Invalid incentive status: " + data.getStatus());
        }
        Date createdAt = IsoDateUtil.parse(data.getCreatedAt());
        if (null == createdAt) {
            throw new AppException(ResponseCode.E0107, "Incentive createdAt is required: " + data.getId());
        }

        IncentiveDataEntity.Recipient recipientData = data.getRecipient();
        VerificationStatusEnumVO verificationStatus = VerificationStatusEnumVO.getByCode(recipientData.getVerificationStatus());
        IncentiveRecipientVO recipient = IncentiveRecipientVO.builder()
                .ip(recipientData.getIp())
                .contactInfo(null == recipientData.getContactInfo() ? ContactInfoVO.empty() : recipientData.getContactInfo())
                .verificationStatus(null == verificationStatus ? VerificationStatusEnumVO.PENDING : verificationStatus)
                .build();

        IncentiveDataEntity.Reward rewardData = data.getReward();
        IncentiveRewardVO reward = IncentiveRewardVO.builder()
                .amount(rewardData.getAmount())
                .currency(CurrencyEnumVO.getByCode(rewardData.getCurrency()))
                .rewardType(RewardTypeEnumVO.getByCode(rewardData.getRewardType()))
                .calculationMethod(rewardData.getCalculationMethod())
                .build();

        IncentiveDataEntity.Trigger triggerData = data.getTrigger();
        IncentiveTriggerVO trigger = IncentiveTriggerVO.fromData(
                triggerData.getTriggerType(), triggerData.getTriggerData(), IsoDateUtil.parse(triggerData.getQualifiedAt()));

        IncentiveAggregate incentive = new IncentiveAggregate(data.getId(), recipient, reward, trigger, status, createdAt,
                IsoDateUtil.parse(data.getProcessedAt()), IsoDateUtil.parse(data.getPaidAt()),
                null == data.getVersion() ? 0L : data.getVersion(), policy);
        incentive.checkInvariants(new Date());
        return incentive;
    }

    public IncentiveDataEntity toData() {
        return IncentiveDataEntity.builder()
                .id(id)
                .recipient(IncentiveDataEntity.Recipient.builder()
                        .ip(recipient.getIp())
                        .contactInfo(recipient.getContactInfo())
                        .verificationStatus(null == recipient.getVerificationStatus() ? null : recipient.getVerificationStatus().getCode())
                        .build())
                .reward(IncentiveDataEntity.Reward.builder()
                        .amount(reward.getAmount())
                        .currency(null == reward.getCurrency() ? null : reward.getCurrency().getCode())
                        .rewardType(null == reward.getRewardType() ? null : reward.getRewardType().getCode())
                        .calculationMethod(reward.getCalculationMethod())
                        .build())
                .trigger(IncentiveDataEntity.Trigger.builder()
                        .triggerType(trigger.getTriggerType().getCode())
                        .triggerData(trigger.toTriggerData())
                        .qualifiedAt(IsoDateUtil.format(trigger.getQualifiedAt()))
                        .build())
                .status(status.getCode())
                .createdAt(IsoDateUtil.format(createdAt))
                .processedAt(IsoDateUtil.format(processedAt))
                .paidAt(IsoDateUtil.format(paidAt))
                .version(version)
                .build();
    }

    /**
     * 持久化数据的不变量：金额在 [0, 上限] 内、已支付必有支付时间且金额大于0、收款IP合法、创建时间不晚于当前
     */
    private void checkInvariants(Date now) {
        List<String> errors = new ArrayList<>(reward.validate(policy));
        if (IncentiveStatusEnumVO.PAID.equals(status)) {
            if (null == paidAt) {
                errors.add("Paid incentive must have payment timestamp");
            }
            if (!reward.isPositive()) {
                errors.add("Paid incentive must have positive amount");
            }
        }
        if (!IpAddressUtil.isValidIpAddress(recipient.getIp())) {
            errors.add("Valid IP address is required");
        }
        if (createdAt.after(now)) {
            errors.add("Incentive createdAt cannot be in the future");
        }
        if (!errors.isEmpty()) {
            throw new AppException(ResponseCode.E0107, "Incentive data violates invariants: " + id + " " + String.join(", ", errors));
        }
    }

    /**
     * 复核激励资格，只产生事件，不改变状态
     */
    public EligibilityCheckEntity validateEligibility() {
        List<String> errors = new ArrayList<>();
        errors.addAll(trigger.validate());
        errors.addAll(recipient.validate());
        errors.addAll(reward.validate(policy));
        if (IncentiveStatusEnumVO.PAID.equals(status) && null == paidAt) {
            errors.add("Paid incentive must have payment timestamp");
        }

        Date now = new Date();
        if (errors.isEmpty()) {
            uncommittedEvents.add(new IncentiveValidatedEvent(id, recipient.getIp(), reward.getAmount(), now));
        } else {
            uncommittedEvents.add(new IncentiveValidationFailedEvent(id, recipient.getIp(), new ArrayList<>(errors), now));
        }
        return EligibilityCheckEntity.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .build();
    }

    public TransitionResultEntity approveForProcessing(String reason) {
        IncentiveStatusEnumVO from = status;
        if (!IncentiveStatusEnumVO.PENDING_VALIDATION.equals(from)) {
            return TransitionResultEntity.conflict(from, IncentiveStatusEnumVO.APPROVED,
                    "Cannot approve incentive in " + from.getCode() + " status");
        }

        Date now = new Date();
        status = IncentiveStatusEnumVO.APPROVED;
        processedAt = now;
        uncommittedEvents.add(new IncentiveApprovedEvent(id, recipient.getIp(), reward.getAmount(), reason, now));
        return TransitionResultEntity.accepted(from, status);
    }

    public TransitionResultEntity reject(String reason) {
        IncentiveStatusEnumVO from = status;
        if (IncentiveStatusEnumVO.PAID.equals(from)) {
            return TransitionResultEntity.conflict(from, IncentiveStatusEnumVO.REJECTED, "Cannot reject already paid incentive");
        }
        if (!from.canTransitionTo(IncentiveStatusEnumVO.REJECTED)) {
            return TransitionResultEntity.conflict(from, IncentiveStatusEnumVO.REJECTED,
                    "Cannot reject incentive in " + from.getCode() + " status");
        }

        Date now = new Date();
        status = IncentiveStatusEnumVO.REJECTED;
        processedAt = now;
        uncommittedEvents.add(new IncentiveRejectedEvent(id, recipient.getIp(), reason, now));
        return TransitionResultEntity.accepted(from, status);
    }

    /**
     * 执行支付。前置条件不满足时状态不变，并记录支付失败事件
     */
    public PaymentResultEntity executePayment(PaymentMethodEnumVO paymentMethod, String transactionId) {
        if (!IncentiveStatusEnumVO.APPROVED.equals(status)) {
            return PaymentResultEntity.failed("Cannot pay incentive in " + status.getCode() + " status");
        }

        Date now = new Date();
        String error = checkPaymentPreconditions(now);
        if (null != error) {
            uncommittedEvents.add(new PaymentFailedEvent(id, recipient.getIp(), error, now));
            return PaymentResultEntity.failed(error);
        }

        status = IncentiveStatusEnumVO.PAID;
        paidAt = now;
        uncommittedEvents.add(new IncentivePaidEvent(id, recipient.getIp(), reward.getAmount(), reward.getCurrency(),
                paymentMethod, transactionId, now));
        return PaymentResultEntity.success(transactionId, reward.getAmount(), reward.getCurrency());
    }

    /**
     * 支付前置条件（金额、联系方式、时效），满足时返回 null。不改变状态也不产生事件
     */
    public String checkPaymentPreconditions(Date now) {
        if (!reward.isPositive()) {
            return "Invalid reward amount for payment";
        }
        if (!recipient.contactInfoOrEmpty().isValid()) {
            return "Valid contact information required for payment";
        }
        if (IsoDateUtil.daysBetween(createdAt, now) > policy.getExpiryDays()) {
            return "Incentive has expired (>" + policy.getExpiryDays() + " days old)";
        }
        return null;
    }

    public IncentiveSummaryEntity getIncentiveSummary() {
        return IncentiveSummaryEntity.builder()
                .id(id)
                .recipientIP(recipient.getIp())
                .rewardAmount(reward.getAmount())
                .rewardCurrency(reward.getCurrency())
                .triggerType(trigger.getTriggerType())
                .status(status)
                .createdAt(getCreatedAt())
                .processedAt(getProcessedAt())
                .paidAt(getPaidAt())
                .canBePaid(canBePaid())
                .daysSinceCreation(getDaysSinceCreation())
                .build();
    }

    public boolean canBePaid() {
        return IncentiveStatusEnumVO.APPROVED.equals(status)
                && recipient.contactInfoOrEmpty().isValid()
                && reward.isPositive();
    }

    public List<IncentiveDomainEvent> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    public Date getCreatedAt() {
        return copyOf(createdAt);
    }

    public Date getProcessedAt() {
        return copyOf(processedAt);
    }

    public Date getPaidAt() {
        return copyOf(paidAt);
    }

    public String getRecipientIP() {
        return recipient.getIp();
    }

    public ContactInfoVO getContactInfo() {
        return recipient.contactInfoOrEmpty();
    }

    public BigDecimal getRewardAmount() {
        return null == reward.getAmount() ? BigDecimal.ZERO : reward.getAmount();
    }

    public CurrencyEnumVO getRewardCurrency() {
        return reward.getCurrency();
    }

    public TriggerTypeEnumVO getTriggerType() {
        return trigger.getTriggerType();
    }

    /**
     * 创建至今的整天数（向下取整）
     */
    public long getDaysSinceCreation() {
        return IsoDateUtil.wholeDaysBetween(createdAt, new Date());
    }

    private static Date copyOf(Date date) {
        return null == date ? null : new Date(date.getTime());
    }

    private void addCreatedEvent(Date now) {
        uncommittedEvents.add(new IncentiveCreatedEvent(id, recipient.getIp(), reward.getAmount(), reward.getCurrency(),
                trigger.getTriggerType(), now));
    }

}
