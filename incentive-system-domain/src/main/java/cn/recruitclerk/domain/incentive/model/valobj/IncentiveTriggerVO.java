package cn.recruitclerk.domain.incentive.model.valobj;

import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;

import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * @description 激励触发条件。按触发类型分为问卷、推荐两个子类，持久化数据在还原时一次性校验
 * @create 2026-10-17
 */
public abstract class IncentiveTriggerVO {

    /** 满足条件时间 */
    private final Date qualifiedAt;

    protected IncentiveTriggerVO(Date qualifiedAt) {
        this.qualifiedAt = null == qualifiedAt ? null : new Date(qualifiedAt.getTime());
    }

    public Date getQualifiedAt() {
        return null == qualifiedAt ? null : new Date(qualifiedAt.getTime());
    }

    public abstract TriggerTypeEnumVO getTriggerType();

    public abstract List<String> validate();

    /**
     * 持久化用的触发数据
     */
    public abstract Map<String, Object> toTriggerData();

    /**
     * 从持久化数据还原触发条件
     */
    public static IncentiveTriggerVO fromData(String triggerType, Map<String, Object> triggerData, Date qualifiedAt) {
        TriggerTypeEnumVO type = TriggerTypeEnumVO.getByCode(triggerType);
        if (null == type) {
            throw new AppException(ResponseCode.E0107, "Invalid trigger type: " + triggerType);
        }
        if (null == triggerData) {
            throw new AppException(ResponseCode.E0107, "Trigger data is required");
        }
        switch (type) {
            case QUESTIONNAIRE_COMPLETION:
                return new QuestionnaireTriggerVO(
                        asString(triggerData.get(QuestionnaireTriggerVO.KEY_QUESTIONNAIRE_ID)),
                        asInteger(triggerData.get(QuestionnaireTriggerVO.KEY_QUALITY_SCORE)),
                        qualifiedAt);
            case REFERRAL:
                return new ReferralTriggerVO(
                        asString(triggerData.get(ReferralTriggerVO.KEY_REFERRER_IP)),
                        asString(triggerData.get(ReferralTriggerVO.KEY_REFERRED_IP)),
                        qualifiedAt);
            default:
                throw new AppException(ResponseCode.E0107, "Unsupported trigger type: " + triggerType);
        }
    }

    private static String asString(Object value) {
        return null == value ? null : String.valueOf(value);
    }

    private static Integer asInteger(Object value) {
        if (null == value) return null;
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.valueOf(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new AppException(ResponseCode.E0107, "Invalid quality score: " + value, e);
        }
    }

}
