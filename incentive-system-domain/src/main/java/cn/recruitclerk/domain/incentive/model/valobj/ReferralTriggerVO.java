package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @description 推荐触发，推荐人即激励收款人
 * @create 2026-10-17
 */
@Getter
public class ReferralTriggerVO extends IncentiveTriggerVO {

    public static final String KEY_REFERRER_IP = "referrerIP";
    public static final String KEY_REFERRED_IP = "referredIP";

    /** 推荐人IP */
    private final String referrerIP;
    /** 被推荐人IP */
    private final String referredIP;

    public ReferralTriggerVO(String referrerIP, String referredIP, Date qualifiedAt) {
        super(qualifiedAt);
        this.referrerIP = referrerIP;
        this.referredIP = referredIP;
    }

    @Override
    public TriggerTypeEnumVO getTriggerType() {
        return TriggerTypeEnumVO.REFERRAL;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (StringUtils.isBlank(referredIP)) {
            errors.add("Referred IP is required");
        }
        return errors;
    }

    @Override
    public Map<String, Object> toTriggerData() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (null != referrerIP) {
            data.put(KEY_REFERRER_IP, referrerIP);
        }
        data.put(KEY_REFERRED_IP, referredIP);
        return data;
    }

}
