package cn.recruitclerk.domain.incentive.model.valobj;

import org.junit.Assert;
import org.junit.Test;

public class IncentiveStatusEnumVOTest {

    @Test
    public void test_transitions() {
        Assert.assertTrue(IncentiveStatusEnumVO.PENDING_VALIDATION.canTransitionTo(IncentiveStatusEnumVO.APPROVED));
        Assert.assertTrue(IncentiveStatusEnumVO.PENDING_VALIDATION.canTransitionTo(IncentiveStatusEnumVO.REJECTED));
        Assert.assertFalse(IncentiveStatusEnumVO.PENDING_VALIDATION.canTransitionTo(IncentiveStatusEnumVO.PAID));

        Assert.assertTrue(IncentiveStatusEnumVO.APPROVED.canTransitionTo(IncentiveStatusEnumVO.PAID));
        Assert.assertFalse(IncentiveStatusEnumVO.APPROVED.canTransitionTo(IncentiveStatusEnumVO.PENDING_VALIDATION));

        Assert.assertTrue(IncentiveStatusEnumVO.EXPIRED.canTransitionTo(IncentiveStatusEnumVO.REJECTED));
        Assert.assertFalse(IncentiveStatusEnumVO.EXPIRED.canTransitionTo(IncentiveStatusEnumVO.PAID));

        Assert.assertTrue(IncentiveStatusEnumVO.PAID.allowedTransitions().isEmpty());
        Assert.assertFalse(IncentiveStatusEnumVO.PAID.canTransitionTo(null));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void test_allowedTransitions_readOnly() {
        IncentiveStatusEnumVO.APPROVED.allowedTransitions().add(IncentiveStatusEnumVO.PENDING_VALIDATION);
    }

    @Test
    public void test_getByCode() {
        Assert.assertEquals(IncentiveStatusEnumVO.PAID, IncentiveStatusEnumVO.getByCode("PAID"));
        Assert.assertNull(IncentiveStatusEnumVO.getByCode("paid"));
        Assert.assertNull(IncentiveStatusEnumVO.getByCode(null));
    }

}
