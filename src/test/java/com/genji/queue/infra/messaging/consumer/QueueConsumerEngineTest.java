package com.genji.queue.infra.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genji.queue.common.exception.QueueDeclarationException;
import com.genji.queue.infra.messaging.rabbit.PooledChannel;
import com.genji.queue.infra.messaging.rabbit.QueueDeclarer;
import com.genji.queue.infra.messaging.rabbit.RabbitChannelPool;
import com.genji.queue.infra.messaging.rabbit.RabbitQueueProperties;
import com.genji.queue.testsupport.stub.StubIdempotencyClaimClient;
import com.genji.queue.testsupport.stub.StubJobStatusClient;
import com.genji.queue.usecase.consumer.QueueHandlerRegistry;
import com.genji.queue.usecase.job.JobStatusReporter;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.impl.AMQImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 브로커 없이 기동 2단계(선언/카운트 → 소비 시작)와 drain 대기를 검증한다.
 */
class QueueConsumerEngineTest {

    private Channel channel;
    private RabbitChannelPool pool;
    private QueueHandlerRegistry registry;
    private RecordingContainerFactory containerFactory;
    private QueueConsumerEngine engine;
    private final AtomicInteger handled = new AtomicInteger();

    /**
     * 컨테이너 대신 리스너를 붙잡아 두고 테스트가 직접 메시지를 넣는다.
     */
    static class RecordingContainerFactory implements QueueListenerContainerFactory {
        final Map<String, ChannelAwareMessageListener> listeners = new LinkedHashMap<>();
        final Map<String, MessageListenerContainer> containers = new LinkedHashMap<>();

        @Override
        public MessageListenerContainer create(String queueName, ChannelAwareMessageListener listener) {
            MessageListenerContainer container = mock(MessageListenerContainer.class);
            listeners.put(queueName, listener);
            containers.put(queueName, container);
            return container;
        }
    }

    @BeforeEach
    void setUp() {
        channel = mock(Channel.class);
        pool = mock(RabbitChannelPool.class);
        when(pool.acquireChannel()).thenAnswer(inv -> new PooledChannel(mock(Connection.class), channel));

        registry = new QueueHandlerRegistry(
                new ObjectMapper(),
                new StubIdempotencyClaimClient(),
                new JobStatusReporter(new StubJobStatusClient()),
                "x-test-enabled"
        );
        containerFactory = new RecordingContainerFactory();
        engine = new QueueConsumerEngine(registry, pool, new QueueDeclarer(), containerFactory,
                new RabbitQueueProperties(), new SimpleMeterRegistry());
    }

    private void register(String queueName) {
        registry.register(queueName, String.class, false, (payload, message) -> handled.incrementAndGet());
    }

    private void backlog(String queueName, int ready) throws IOException {
        when(channel.queueDeclarePassive(queueName)).thenReturn(new AMQImpl.Queue.DeclareOk(queueName, ready, 0));
    }

    private static Message message(long tag) {
        MessageProperties props = new MessageProperties();
        props.setDeliveryTag(tag);
        return new Message("\"hi\"".getBytes(), props);
    }

    @Test
    @DisplayName("큐마다 DLQ 와 dead-letter 인자를 붙여 선언한 뒤 consumer 를 띄운다")
    void 큐와_DLQ_를_선언하고_consumer_를_시작한다() throws Exception {
        register("jobs.create");
        backlog("jobs.create", 0);

        engine.start();

        InOrder order = inOrder(channel, containerFactory.containers.get("jobs.create"));
        order.verify(channel).queueDeclare(eq("jobs.create.dlq"), eq(true), eq(false), eq(false), isNull());
        order.verify(channel).queueDeclare("jobs.create", true, false, false, Map.of(
                QueueDeclarer.ARG_DLX, "",
                QueueDeclarer.ARG_DLX_ROUTING_KEY, "jobs.create.dlq"));
        order.verify(containerFactory.containers.get("jobs.create")).start();

        assertThat(engine.isRunning()).isTrue();
        assertThat(engine.listTargetDlqs()).containsExactly("jobs.create.dlq");
    }

    @Test
    @DisplayName("기동 시 쌓인 메시지가 없으면 바로 drain 완료 상태다")
    void backlog_없으면_즉시_drain_완료() throws Exception {
        register("jobs.create");
        backlog("jobs.create", 0);

        engine.start();

        assertThat(engine.isDraining()).isFalse();
        assertThat(engine.waitUntilDrained(Duration.ofMillis(10))).isTrue();
    }

    @Test
    @DisplayName("모든 큐의 backlog 합만큼 ack 되어야 drain 이 끝난다")
    void 모든_큐_backlog_합만큼_ack_되어야_끝난다() throws Exception {
        register("jobs.create");
        register("jobs.delete");
        backlog("jobs.create", 2);
        backlog("jobs.delete", 1);

        engine.start();
        assertThat(engine.pendingStartupMessages()).isEqualTo(3);

        containerFactory.listeners.get("jobs.create").onMessage(message(1), channel);
        containerFactory.listeners.get("jobs.delete").onMessage(message(1), channel);
        assertThat(engine.waitUntilDrained(Duration.ofMillis(10))).isFalse();

        containerFactory.listeners.get("jobs.create").onMessage(message(2), channel);

        assertThat(engine.waitUntilDrained(Duration.ofSeconds(1))).isTrue();
        assertThat(handled.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("선언 실패는 기동 실패이고 consumer 는 하나도 뜨지 않는다")
    void 선언_실패는_기동_실패() throws Exception {
        register("jobs.create");
        when(channel.queueDeclare(eq("jobs.create.dlq"), eq(true), eq(false), eq(false), any()))
                .thenThrow(new IOException("PRECONDITION_FAILED"));

        assertThatThrownBy(() -> engine.start())
                .isInstanceOf(QueueDeclarationException.class)
                .hasMessageContaining("jobs.create");

        assertThat(containerFactory.containers).isEmpty();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("stop 은 모든 consumer 를 멈춘다")
    void stop_은_consumer_를_멈춘다() throws Exception {
        register("jobs.create");
        backlog("jobs.create", 0);
        engine.start();
        MessageListenerContainer container = containerFactory.containers.get("jobs.create");

        engine.stop();

        verify(container).stop();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("stop 뒤 다시 start 하면 backlog 를 새로 세고 consumer 를 다시 띄운다")
    void stop_뒤_재기동() throws Exception {
        register("jobs.create");
        backlog("jobs.create", 0);
        engine.start();
        MessageListenerContainer first = containerFactory.containers.get("jobs.create");
        engine.stop();

        backlog("jobs.create", 1);
        engine.start();

        MessageListenerContainer second = containerFactory.containers.get("jobs.create");
        assertThat(second).isNotSameAs(first);
        verify(second).start();
        assertThat(engine.isRunning()).isTrue();
        assertThat(engine.isDraining()).isTrue();
        assertThat(engine.pendingStartupMessages()).isEqualTo(1);

        containerFactory.listeners.get("jobs.create").onMessage(message(1), channel);

        assertThat(engine.waitUntilDrained(Duration.ofSeconds(1))).isTrue();
        assertThat(handled.get()).isEqualTo(1);
    }
}
