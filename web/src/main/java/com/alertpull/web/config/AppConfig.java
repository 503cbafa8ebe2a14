/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.web.config;

import com.alertpull.common.config.AlertPullProperties;
import com.alertpull.common.model.BrokerConfig;
import com.alertpull.messaging.config.TransportFactory;
import com.alertpull.messaging.decode.MessageDecoder;
import com.alertpull.messaging.decode.PayloadFormat;
import com.alertpull.messaging.subscription.SubscriptionManager;
import com.alertpull.server.metrics.PullMetrics;
import com.alertpull.server.policy.StoppingConditionPolicy;
import com.alertpull.server.service.StreamDefaults;
import com.alertpull.server.service.StreamService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${alertpull.stream.default-max-backlog:1000}")
    private int defaultMaxBacklog;

    @Bean
    public AlertPullProperties alertPullProperties(Environment environment) {
        return EnvironmentPropertiesBridge.collect(environment);
    }

    @Bean
    public BrokerConfig brokerConfig(AlertPullProperties properties) {
        BrokerConfig config = BrokerConfig.fromProperties(properties.withPrefix("alertpull.broker."));
        log.info("Broker: type={}, project={}, topicProject={}", config.getBrokerType(),
                config.getProjectId(), config.resolveTopicProjectId());
        return config;
    }

    /** Connects on first use so the application starts without a reachable broker. */
    @Bean(destroyMethod = "close")
    @Lazy
    public TransportFactory.Broker broker(BrokerConfig brokerConfig) {
        return TransportFactory.create(brokerConfig);
    }

    @Bean
    public MessageDecoder messageDecoder(BrokerConfig brokerConfig) {
        PayloadFormat format = PayloadFormat.parse(brokerConfig.getPayloadFormat());
        log.info("Decoding {} payloads", format);
        return new MessageDecoder(format.newDecoder());
    }

    @Bean
    public StoppingConditionPolicy stoppingConditionPolicy() {
        return new StoppingConditionPolicy(defaultMaxBacklog);
    }

    @Bean
    public PullMetrics pullMetrics(MeterRegistry meterRegistry) {
        return new PullMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public StreamService streamService(TransportFactory.Broker broker, MessageDecoder decoder,
                                       StoppingConditionPolicy policy, PullMetrics metrics,
                                       AlertPullProperties properties) {
        return new StreamService(broker.transport(), new SubscriptionManager(broker.admin()),
                decoder, policy, metrics, StreamDefaults.fromProperties(properties));
    }
}
