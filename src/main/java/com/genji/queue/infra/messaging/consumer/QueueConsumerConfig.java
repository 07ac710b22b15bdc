package com.genji.queue.infra.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genji.queue.infra.messaging.rabbit.RabbitQueueProperties;
import com.genji.queue.usecase.consumer.QueueConsumerContributor;
import com.genji.queue.usecase.consumer.QueueHandlerRegistry;
import com.genji.queue.usecase.consumer.port.IdempotencyClaimClient;
import com.genji.queue.usecase.job.JobStatusReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 서비스들이 제공하는 {@link QueueConsumerContributor} 를 모아 레지스트리 하나에 등록한다.
 */
@Slf4j
@Configuration
public class QueueConsumerConfig {

    @Bean
    public QueueHandlerRegistry queueHandlerRegistry(ObjectMapper objectMapper,
                                                     IdempotencyClaimClient claimClient,
                                                     JobStatusReporter jobStatusReporter,
                                                     RabbitQueueProperties properties,
                                                     ObjectProvider<QueueConsumerContributor> contributors) {
        QueueHandlerRegistry registry =
                new QueueHandlerRegistry(objectMapper, claimClient, jobStatusReporter, properties.getTestHeader());
        contributors.orderedStream().forEach(contributor -> contributor.registerQueueHandlers(registry));
        log.info("[QueueRegistry] {} queue handler(s) registered", registry.queueNames().size());
        return registry;
    }
}
