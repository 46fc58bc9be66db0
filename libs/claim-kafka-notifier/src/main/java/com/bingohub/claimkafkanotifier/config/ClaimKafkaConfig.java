package com.bingohub.claimkafkanotifier.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 判定结果 Kafka 配置（仅生产者，下游的奖品/支付处理不在本服务内）。
 *
 * 配置要求（application.yml）：
 * <pre>
 * claim:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: bingo-claim-resolved
 * </pre>
 *
 * 注意：
 * - 条件控制由 {@link ClaimKafkaNotifierAutoConfiguration} 统一管理，此处不需要 @ConditionalOnProperty。
 */
@Configuration
public class ClaimKafkaConfig {

    /**
     * Kafka 集群地址，多个 broker 用逗号分隔。
     * 从配置文件 claim.kafka.bootstrap-servers 读取
     */
    @Value("${claim.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Bean
    public ProducerFactory<String, String> claimKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 消息内容为 JSON 字符串
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 判定结果关系到发奖，必须等待所有副本确认
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        // 幂等生产者：重试不会产生重复消息（要求 acks=all）
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    /**
     * KafkaTemplate（生产者）。
     */
    @Bean
    public KafkaTemplate<String, String> claimKafkaTemplate() {
        return new KafkaTemplate<>(claimKafkaProducerFactory());
    }
}
