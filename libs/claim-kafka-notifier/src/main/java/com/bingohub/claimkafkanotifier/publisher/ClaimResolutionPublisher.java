package com.bingohub.claimkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.bingohub.claimkafkanotifier.event.ClaimResolvedEvent;
import com.bingohub.realtime.claim.ClaimResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 判定结果发布器。
 *
 * 使用方式：
 * <pre>
 * {@code
 * claimProtocol.onClaimResolved(publisher::publish);
 * }
 * </pre>
 * 发送失败只记录日志：判定本身已经在会话内生效，不因下游不可用回滚。
 */
@Slf4j
@Component
public class ClaimResolutionPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${claim.kafka.topic:bingo-claim-resolved}")
    private String topic;

    public ClaimResolutionPublisher(@Qualifier("claimKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    public void publish(ClaimResolution resolution) {
        publish(ClaimResolvedEvent.of(resolution));
    }

    public void publish(ClaimResolvedEvent event) {
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getSessionId(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("判定结果发布成功: session={}, resolution={}, offset={}",
                            event.getSessionId(), event.getResolutionId(), result.getRecordMetadata().offset());
                } else {
                    log.error("判定结果发布失败: session={}, resolution={}", event.getSessionId(), event.getResolutionId(), ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("发布判定结果异常: session={}, resolution={}", event.getSessionId(), event.getResolutionId(), e);
        }
    }

    void setTopic(String topic) {
        this.topic = topic;
    }
}
