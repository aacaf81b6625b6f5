package cn.recruitclerk.domain.incentive.model.valobj;

import cn.recruitclerk.types.utils.IpAddressUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * @description 激励收款人值对象，以 IP 标识
 * @create 2026-10-17
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder
@AllArgsConstructor
public class IncentiveRecipientVO {

    /** 收款人IP */
    private final String ip;
    /** 联系方式 */
    private final ContactInfoVO contactInfo;
    /** 核验状态 */
    private final VerificationStatusEnumVO verificationStatus;

    public static IncentiveRecipientVO create(String ip, ContactInfoVO contactInfo) {
        return IncentiveRecipientVO.builder()
                .ip(ip)
                .contactInfo(null == contactInfo ? ContactInfoVO.empty() : contactInfo)
                .verificationStatus(VerificationStatusEnumVO.PENDING)
                .build();
    }

    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!IpAddressUtil.isValidIpAddress(ip)) {
            errors.add("Valid IP address is required");
        }
        errors.addAll(contactInfoOrEmpty().validate());
        return errors;
    }

    public ContactInfoVO contactInfoOrEmpty() {
        return null == contactInfo ? ContactInfoVO.empty() : contactInfo;
    }

}
