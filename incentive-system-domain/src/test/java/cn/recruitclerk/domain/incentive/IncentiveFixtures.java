package cn.recruitclerk.domain.incentive;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveDataEntity;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.types.utils.IsoDateUtil;

import java.math.BigDecimal;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 测试数据构造
 */
public class IncentiveFixtures {

    public static ContactInfoVO wechatContact() {
        return ContactInfoVO.builder().wechat("wx_user_01").phone("13800138000").build();
    }

    public static IncentiveDataEntity data(String id, IncentiveStatusEnumVO status, String amount, double ageDays, ContactInfoVO contactInfo) {
        Date createdAt = IsoDateUtil.daysAgo(new Date(), ageDays);
        Map<String, Object> triggerData = new LinkedHashMap<>();
        triggerData.put("questionnaireId", "q-" + id);
        triggerData.put("qualityScore", 95);
        return IncentiveDataEntity.builder()
                .id(id)
                .recipient(IncentiveDataEntity.Recipient.builder()
                        .ip("10.0.0.1")
                        .contactInfo(contactInfo)
                        .verificationStatus("PENDING")
                        .build())
                .reward(IncentiveDataEntity.Reward.builder()
                        .amount(new BigDecimal(amount))
                        .currency("CNY")
                        .rewardType("QUESTIONNAIRE_COMPLETION")
                        .calculationMethod("test")
                        .build())
                .trigger(IncentiveDataEntity.Trigger.builder()
                        .triggerType("QUESTIONNAIRE_COMPLETION")
                        .triggerData(triggerData)
                        .qualifiedAt(IsoDateUtil.format(createdAt))
                        .build())
                .status(status.getCode())
                .createdAt(IsoDateUtil.format(createdAt))
                .processedAt(IncentiveStatusEnumVO.PENDING_VALIDATION.equals(status) ? null : IsoDateUtil.format(createdAt))
                .paidAt(IncentiveStatusEnumVO.PAID.equals(status) ? IsoDateUtil.format(new Date()) : null)
                .version(1L)
                .build();
    }

    public static IncentiveAggregate incentive(String id, IncentiveStatusEnumVO status, String amount, double ageDays) {
        return IncentiveAggregate.restore(data(id, status, amount, ageDays, wechatContact()));
    }

    public static IncentiveAggregate approved(String id, String amount) {
        return incentive(id, IncentiveStatusEnumVO.APPROVED, amount, 1);
    }

}
