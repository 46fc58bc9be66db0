package com.bingohub.realtime.protocol;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 事件编解码（fastjson2）。解析失败、版本不符、类型未知的消息返回 empty 并记录告警。
 */
public final class EventCodec {

    private static final Logger log = LoggerFactory.getLogger(EventCodec.class);

    private EventCodec() {}

    public static String encode(EventEnvelope envelope) {
        return JSON.toJSONString(envelope);
    }

    public static Optional<EventEnvelope> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        EventEnvelope env;
        try {
            env = JSON.parseObject(raw, EventEnvelope.class);
        } catch (JSONException e) {
            log.warn("事件解析失败，已丢弃: {}", e.getMessage());
            return Optional.empty();
        }
        if (env == null) {
            return Optional.empty();
        }
        if (env.getV() != EventEnvelope.SCHEMA_VERSION) {
            log.warn("协议版本不符，已丢弃: v={}, type={}", env.getV(), env.getType());
            return Optional.empty();
        }
        if (env.eventType() == null) {
            log.warn("未知事件类型，已丢弃: type={}", env.getType());
            return Optional.empty();
        }
        return Optional.of(env);
    }
}
