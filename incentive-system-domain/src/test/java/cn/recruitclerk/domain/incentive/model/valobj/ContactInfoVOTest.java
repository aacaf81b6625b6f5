package cn.recruitclerk.domain.incentive.model.valobj;

import com.alibaba.fastjson.JSON;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class ContactInfoVOTest {

    @Test
    public void test_validate_noChannel() {
        List<String> errors = ContactInfoVO.empty().validate();
        Assert.assertEquals(1, errors.size());
        Assert.assertEquals("At least one contact method is required", errors.get(0));
        Assert.assertEquals("No contact info", ContactInfoVO.empty().getPrimaryContact());
    }

    @Test
    public void test_validate_formats() {
        ContactInfoVO contact = ContactInfoVO.builder()
                .email("a@b")
                .phone("12800138000")
                .wechat("abc")
                .build();
        List<String> errors = contact.validate();
        Assert.assertEquals(3, errors.size());
        Assert.assertTrue(errors.contains("Invalid email format"));
        Assert.assertTrue(errors.contains("Invalid phone number format"));
        Assert.assertTrue(errors.contains("WeChat ID must be 6-20 characters"));

        Assert.assertTrue(ContactInfoVO.builder().email("user@example.com").build().isValid());
        Assert.assertTrue(ContactInfoVO.builder().wechat("abcdef").build().isValid());
        Assert.assertFalse(ContactInfoVO.builder().wechat("abcdefghijklmnopqrstu").build().isValid());
    }

    @Test
    public void test_primaryContact_order() {
        ContactInfoVO contact = ContactInfoVO.builder()
                .email("user@example.com")
                .phone("13800138000")
                .alipay("user@alipay")
                .build();
        Assert.assertEquals("Alipay: user@alipay", contact.getPrimaryContact());

        ContactInfoVO withWechat = contact.toBuilder().wechat("wx_user_01").build();
        Assert.assertEquals("WeChat: wx_user_01", withWechat.getPrimaryContact());
        Assert.assertEquals("Alipay: user@alipay", contact.getPrimaryContact());
    }

    @Test
    public void test_json_onlyChannels() {
        String json = JSON.toJSONString(ContactInfoVO.builder().phone("13800138000").build());
        Assert.assertEquals("{\"phone\":\"13800138000\"}", json);
    }

    @Test
    public void test_json_parse() {
        ContactInfoVO contact = JSON.parseObject("{\"wechat\":\"wx_user_01\",\"phone\":\"13800138000\"}", ContactInfoVO.class);
        Assert.assertEquals("wx_user_01", contact.getWechat());
        Assert.assertEquals("13800138000", contact.getPhone());
        Assert.assertNull(contact.getEmail());
        Assert.assertEquals(ContactInfoVO.builder().wechat("wx_user_01").phone("13800138000").build(), contact);
    }

}
