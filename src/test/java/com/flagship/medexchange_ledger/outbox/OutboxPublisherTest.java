package com.flagship.medexchange_ledger.outbox;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.workflow.DeliveryEntity;
import com.flagship.medexchange_ledger.workflow.DeliveryRepository;
import com.flagship.medexchange_ledger.workflow.ExchangeEntity;
import com.flagship.medexchange_ledger.workflow.ExchangeService;
import com.flagship.medexchange_ledger.workflow.dto.CreateExchangeRequest;
import com.flagship.medexchange_ledger.workflow.dto.ExchangeItemRequest;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka and back: the publisher ships workflow events keyed by
 * aggregate, and the workflow consumer turns ExchangeAccepted into a delivery.
 */
class OutboxPublisherTest extends IntegrationTestSupport {

    static final KafkaContainer KAFKA = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void kafkaProperties(DynamicPropertyRegistry registry) {
        KAFKA.start();
        registry.add("spring.kafka.bootstrap-servers", KAFKA::getBootstrapServers);
        registry.add("spring.kafka.admin.auto-create", () -> "true");
        registry.add("spring.kafka.listener.auto-startup", () -> "true");
        registry.add("consumer.enabled", () -> "true");
        registry.add("outbox.publisher.enabled", () -> "true");
        // Driven by hand below
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ExchangeService exchangeService;

    @Autowired
    private DeliveryRepository deliveryRepository;

    @Value("${kafka.topic.workflow-events:workflow-events}")
    private String workflowTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(workflowTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    @Test
    @DisplayName("Published events are keyed by aggregate and marked published")
    void publishesKeyedByAggregate() {
        ExchangeEntity exchange = acceptedExchange();

        outboxPublisher.publishPendingEvents();

        assertTrue(outboxService.getEventsForAggregate("exchange", exchange.getId()).stream()
                .allMatch(OutboxEvent::isPublished));

        List<ConsumerRecord<String, String>> records = consumeFor(exchange.getId().toString(), 10_000);
        assertEquals(1, records.size());
        assertTrue(records.get(0).value().contains(ExchangeAcceptedEvent.EVENT_TYPE));
    }

    @Test
    @DisplayName("ExchangeAccepted flows through Kafka into a new delivery")
    void acceptedExchangeGetsDeliveryThroughKafka() throws InterruptedException {
        ExchangeEntity exchange = acceptedExchange();

        outboxPublisher.publishPendingEvents();

        Optional<DeliveryEntity> delivery = Optional.empty();
        long deadline = System.currentTimeMillis() + 15_000;
        while (delivery.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(200);
            delivery = deliveryRepository.findByExchangeId(exchange.getId());
        }

        assertTrue(delivery.isPresent(), "consumer should have created the delivery");
        assertEquals(500, delivery.get().getFee());
    }

    private ExchangeEntity acceptedExchange() {
        ExchangeEntity exchange = as(party(uniqueId("pharmacy-a"), "sn_dakar"), () -> exchangeService.create(
                new CreateExchangeRequest("sn_dakar", "SN", null,
                        List.of(new ExchangeItemRequest("metformin-850", "Metformin 850mg", 30)), null, true)));
        as(party(uniqueId("pharmacy-b"), "sn_dakar"), () -> exchangeService.accept(exchange.getId()));
        return exchange;
    }

    private List<ConsumerRecord<String, String>> consumeFor(String key, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (matching.isEmpty() && System.currentTimeMillis() < endTime) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }
}
