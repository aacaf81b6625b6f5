package cn.recruitclerk.config;

import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.types.exception.AppException;
import org.junit.Assert;
import org.junit.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

public class IncentivePolicyPropertiesTest {

    @Test
    public void test_toPolicy_defaults() {
        IncentivePolicyVO policy = new IncentivePolicyProperties().toPolicy();
        IncentivePolicyVO defaults = IncentivePolicyVO.defaultPolicy();

        Assert.assertEquals(defaults.toString(), policy.toString());
    }

    @Test
    public void test_bind() {
        Map<String, Object> source = new HashMap<>();
        source.put("incentive.policy.base-questionnaire-reward", "6.5");
        source.put("incentive.policy.max-daily-incentives-per-ip", "5");
        source.put("incentive.policy.expiry-days", "45");

        IncentivePolicyProperties properties = new Binder(new MapConfigurationPropertySource(source))
                .bind("incentive.policy", IncentivePolicyProperties.class)
                .get();
        IncentivePolicyVO policy = properties.toPolicy();

        Assert.assertEquals(0, new BigDecimal("6.5").compareTo(policy.getBaseQuestionnaireReward()));
        Assert.assertEquals(5, policy.getMaxDailyIncentivesPerIp());
        Assert.assertEquals(45, policy.getExpiryDays());
        Assert.assertEquals(90, policy.getHighQualityThreshold());
    }

    @Test(expected = AppException.class)
    public void test_toPolicy_invalid() {
        IncentivePolicyProperties properties = new IncentivePolicyProperties();
        properties.setMinPayoutAmount(new BigDecimal("-1"));
        properties.toPolicy();
    }

}
