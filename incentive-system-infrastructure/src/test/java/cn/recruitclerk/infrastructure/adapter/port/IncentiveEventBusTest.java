package cn.recruitclerk.infrastructure.adapter.port;

import cn.recruitclerk.domain.incentive.model.event.IncentiveRejectedEvent;
import cn.recruitclerk.infrastructure.mq.producer.StreamProducer;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Date;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class IncentiveEventBusTest {

    @Mock
    private StreamProducer streamProducer;

    @InjectMocks
    private IncentiveEventBus eventBus;

    @Before
    public void init() {
        ReflectionTestUtils.setField(eventBus, "bindingName", "incentiveEvent-out-0");
    }

    @Test
    public void test_publish() {
        IncentiveRejectedEvent event = new IncentiveRejectedEvent("incentive_1", "1.2.3.4", "spam", new Date(1700000000000L));
        when(streamProducer.send(anyString(), anyString(), anyString(), anyString())).thenReturn(true);

        eventBus.publish(event);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(streamProducer).send(eq("incentiveEvent-out-0"), eq(IncentiveRejectedEvent.EVENT_TYPE),
                eq("incentive_1:IncentiveRejected:1700000000000"), body.capture());
        JSONObject json = JSON.parseObject(body.getValue());
        Assert.assertEquals("incentive_1", json.getString("incentiveId"));
        Assert.assertEquals("spam", json.getString("reason"));
    }

    @Test
    public void test_publish_producerFailureDoesNotPropagate() {
        IncentiveRejectedEvent event = new IncentiveRejectedEvent("incentive_1", "1.2.3.4", "spam", new Date());
        when(streamProducer.send(anyString(), anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("broker down"));

        eventBus.publish(event);

        verify(streamProducer).send(anyString(), anyString(), anyString(), anyString());
    }

}
