package cn.recruitclerk.infrastructure.util;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.valobj.ContactInfoVO;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.domain.incentive.model.valobj.ReferralTriggerVO;
import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.junit.Assert;
import org.junit.Test;

@Slf4j
public class IncentiveDataJsonUtilTest {

    @Test
    public void test_toJson_restore() {
        IncentiveAggregate incentive = IncentiveAggregate.createReferralIncentive("1.2.3.4", "5.6.7.8",
                ContactInfoVO.builder().email("user@example.com").build());

        String json = IncentiveDataJsonUtil.toJson(incentive);
        log.info("测试结果: {}", json);
        IncentiveAggregate restored = IncentiveDataJsonUtil.restore(json, IncentivePolicyVO.defaultPolicy());

        Assert.assertEquals(incentive.getId(), restored.getId());
        Assert.assertEquals(incentive.getStatus(), restored.getStatus());
        Assert.assertEquals("5.6.7.8", ((ReferralTriggerVO) restored.getTrigger()).getReferredIP());
        Assert.assertEquals("user@example.com", restored.getContactInfo().getEmail());
        Assert.assertFalse(json.contains("primaryContact"));
    }

    @Test
    public void test_parse_invalid() {
        try {
            IncentiveDataJsonUtil.parse("{not json");
            Assert.fail();
        } catch (AppException e) {
            Assert.assertEquals(ResponseCode.E0107.getCode(), e.getCode());
        }
        try {
            IncentiveDataJsonUtil.parse(" ");
            Assert.fail();
        } catch (AppException e) {
            Assert.assertEquals(ResponseCode.E0107.getCode(), e.getCode());
        }
    }

}
