package cn.recruitclerk.domain.incentive.model.valobj;

import com.alibaba.fastjson.annotation.JSONCreator;
import com.alibaba.fastjson.annotation.JSONField;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * @description 收款人联系方式值对象，不可变；修改渠道请用 toBuilder 生成新对象
 * @create 2026-10-17
 */
@Getter
@ToString
@EqualsAndHashCode
public class ContactInfoVO {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^1[3-9]\\d{9}$");
    private static final int WECHAT_MIN_LENGTH = 6;
    private static final int WECHAT_MAX_LENGTH = 20;

    private static final ContactInfoVO EMPTY = new ContactInfoVO(null, null, null, null);

    /** 邮箱 */
    private final String email;
    /** 手机号（中国大陆） */
    private final String phone;
    /** 微信号 */
    private final String wechat;
    /** 支付宝账号 */
    private final String alipay;

    @Builder(toBuilder = true)
    @JSONCreator
    public ContactInfoVO(@JSONField(name = "email") String email,
                         @JSONField(name = "phone") String phone,
                         @JSONField(name = "wechat") String wechat,
                         @JSONField(name = "alipay") String alipay) {
        this.email = email;
        this.phone = phone;
        this.wechat = wechat;
        this.alipay = alipay;
    }

    public static ContactInfoVO empty() {
        return EMPTY;
    }

    public boolean hasAnyChannel() {
        return StringUtils.isNotBlank(email) || StringUtils.isNotBlank(phone)
                || StringUtils.isNotBlank(wechat) || StringUtils.isNotBlank(alipay);
    }

    /**
     * 校验联系方式，无任何渠道时只返回一条错误
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!hasAnyChannel()) {
            errors.add("At least one contact method is required");
            return errors;
        }

        if (StringUtils.isNotBlank(email) && !EMAIL_PATTERN.matcher(email).matches()) {
            errors.add("Invalid email format");
        }
        if (StringUtils.isNotBlank(phone) && !PHONE_PATTERN.matcher(phone).matches()) {
            errors.add("Invalid phone number format");
        }
        if (StringUtils.isNotBlank(wechat) && (wechat.length() < WECHAT_MIN_LENGTH || wechat.length() > WECHAT_MAX_LENGTH)) {
            errors.add("WeChat ID must be 6-20 characters");
        }
        return errors;
    }

    @JSONField(serialize = false)
    public boolean isValid() {
        return validate().isEmpty();
    }

    @JSONField(serialize = false)
    public String getPrimaryContact() {
        if (StringUtils.isNotBlank(wechat)) return "WeChat: " + wechat;
        if (StringUtils.isNotBlank(alipay)) return "Alipay: " + alipay;
        if (StringUtils.isNotBlank(phone)) return "Phone: " + phone;
        if (StringUtils.isNotBlank(email)) return "Email: " + email;
        return "No contact info";
    }

}
