package com.bingohub.claimkafkanotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.ComponentScan;

/**
 * 判定结果 Kafka 通知器自动配置类。
 *
 * 当配置了 claim.kafka.bootstrap-servers 时自动启用。
 *
 * 自动扫描并注册：
 * - {@link ClaimKafkaConfig}：Kafka 配置
 * - {@link com.bingohub.claimkafkanotifier.publisher.ClaimResolutionPublisher}：判定结果发布器
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "claim.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.bingohub.claimkafkanotifier")
public class ClaimKafkaNotifierAutoConfiguration {
}
