package cn.recruitclerk.infrastructure.mq.producer;

import cn.recruitclerk.infrastructure.mq.param.MessageBody;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import javax.annotation.Resource;

/**
 * Stream 消息生产者
 */
@Slf4j
@Component
public class StreamProducer {

    public static final String TAGS = "TAGS";

    @Resource
    private StreamBridge streamBridge;

    /**
     * 发送消息
     *
     * @param bindingName binding 名称（如：incentiveEvent-out-0）
     * @param tag         消息标签，消费端按标签过滤
     * @param identifier  幂等号
     * @param msg         消息内容（JSON 字符串）
     * @return 是否成功
     */
    public boolean send(String bindingName, String tag, String identifier, String msg) {
        MessageBody message = new MessageBody()
                .setIdentifier(identifier)
                .setBody(msg);
        log.info("发送消息: bindingName={}, tag={}, message={}", bindingName, tag, JSON.toJSONString(message));
        boolean result = streamBridge.send(bindingName, MessageBuilder.withPayload(message)
                .setHeader(TAGS, tag)
                .build());
        log.info("发送消息结果: bindingName={}, tag={}, result={}", bindingName, tag, result);
        return result;
    }

}
