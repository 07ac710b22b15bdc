package com.genji.queue.testsupport.base;

import com.genji.queue.testsupport.config.IntegrationStubConfig;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * 실제 RabbitMQ 컨테이너 위에서 consumer engine 을 띄운다. Docker 가 없으면 건너뛴다.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@Import(IntegrationStubConfig.class)
public abstract class AbstractRabbitIntegrationTest {

    @Container
    protected static final RabbitMQContainer rabbit = new RabbitMQContainer("rabbitmq:3.13-management-alpine");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        registry.add("spring.rabbitmq.host", rabbit::getHost);
        registry.add("spring.rabbitmq.port", rabbit::getAmqpPort);
        registry.add("spring.rabbitmq.username", rabbit::getAdminUsername);
        registry.add("spring.rabbitmq.password", rabbit::getAdminPassword);

        // 외부 호출/스케줄은 끄고 테스트가 직접 구동한다
        registry.add("genji.api.health.enabled", () -> false);
        registry.add("genji.dlq.enabled", () -> false);
        registry.add("genji.dlq.alert-channel-id", () -> "1432862783644368968");
    }
}
