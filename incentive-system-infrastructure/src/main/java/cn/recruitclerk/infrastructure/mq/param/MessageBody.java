package cn.recruitclerk.infrastructure.mq.param;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * 消息体
 */
@Data
@Accessors(chain = true)
public class MessageBody {
    /**
     * 幂等号，同一领域事件重复投递时保持不变
     */
    private String identifier;
    /**
     * 消息体（JSON）
     */
    private String body;
}
