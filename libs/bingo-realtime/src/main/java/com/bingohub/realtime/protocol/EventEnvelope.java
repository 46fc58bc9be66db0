package com.bingohub.realtime.protocol;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * 传输消息外壳（v1）
 * - 最少字段：v / type / sessionId / ts / payload
 * - payload 发送时为强类型对象，接收时为 JSONObject，通过 payloadAs 转回强类型
 *
 * 用法示例：
 *   EventEnvelope env = EventEnvelope.of(EventType.NUMBER_CALLED, sessionId, payload, now);
 *   NumberCalledPayload p = env.payloadAs(NumberCalledPayload.class);
 */
@Data
@NoArgsConstructor
public class EventEnvelope {

    /** 当前协议版本；版本不符的消息直接丢弃 */
    public static final int SCHEMA_VERSION = 1;

    private int v;
    private String type;
    private String sessionId;
    private long ts;
    private Object payload;

    public static EventEnvelope of(EventType type, String sessionId, Object payload, long ts) {
        EventEnvelope env = new EventEnvelope();
        env.setV(SCHEMA_VERSION);
        env.setType(Objects.requireNonNull(type, "type").wire());
        env.setSessionId(Objects.requireNonNull(sessionId, "sessionId"));
        env.setTs(ts);
        env.setPayload(payload);
        return env;
    }

    /**
     * 将载荷转换为指定类型。
     */
    public <T> T payloadAs(Class<T> type) {
        if (payload == null) {
            return null;
        }
        if (type.isInstance(payload)) {
            return type.cast(payload);
        }
        if (payload instanceof JSONObject json) {
            return json.to(type);
        }
        return JSON.parseObject(JSON.toJSONString(payload), type);
    }

    public EventType eventType() {
        return EventType.fromWire(type).orElse(null);
    }
}
