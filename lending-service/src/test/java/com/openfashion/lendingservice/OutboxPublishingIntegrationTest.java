package com.openfashion.lendingservice;

import com.openfashion.lendingservice.dto.TransferResult;
import com.openfashion.lendingservice.model.OutboxStatus;
import com.openfashion.lendingservice.repository.BalanceRepository;
import com.openfashion.lendingservice.repository.LoanRepository;
import com.openfashion.lendingservice.repository.OutboxRepository;
import com.openfashion.lendingservice.repository.ProtocolStatRepository;
import com.openfashion.lendingservice.service.AssetTransferService;
import com.openfashion.lendingservice.service.BlockClock;
import com.openfashion.lendingservice.service.LendingService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.kafka.KafkaContainer;
import org.testcontainers.postgresql.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "app.outbox.enabled=true")
@Testcontainers
@ActiveProfiles("test")
class OutboxPublishingIntegrationTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer postgres = new PostgreSQLContainer("postgres:16-alpine");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("apache/kafka:3.7.2"));

    // the producer factory reads this property directly
    @DynamicPropertySource
    static void kafkaProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
    }

    @MockitoBean
    private BlockClock blockClock;
    @MockitoBean
    private AssetTransferService assetTransferService;

    @Autowired
    private LendingService lendingService;
    @Autowired
    private BalanceRepository balanceRepository;
    @Autowired
    private LoanRepository loanRepository;
    @Autowired
    private ProtocolStatRepository statRepository;
    @Autowired
    private OutboxRepository outboxRepository;

    @BeforeEach
    void setup() {
        outboxRepository.deleteAll();
        loanRepository.deleteAll();
        balanceRepository.deleteAll();
        statRepository.deleteAll();

        when(assetTransferService.transfer(anyString(), anyLong(), anyString(), anyString()))
                .thenAnswer(inv -> TransferResult.success(UUID.randomUUID()));
        when(blockClock.currentBlock()).thenReturn(100L);
    }

    @Test
    @DisplayName("Outbox: a deposit event is claimed from PostgreSQL, published to Kafka and marked processed")
    void testDepositEventPublished() {
        lendingService.deposit("alice", 500L);

        Awaitility.await()
                .atMost(Duration.ofSeconds(30))
                .untilAsserted(() -> assertThat(outboxRepository.findAll())
                        .isNotEmpty()
                        .allMatch(e -> e.getStatus() == OutboxStatus.PROCESSED));

        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(Map.of(
                ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers(),
                ConsumerConfig.GROUP_ID_CONFIG, "lending-outbox-check",
                ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
                ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
                ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class))) {
            consumer.subscribe(List.of("lending.balances"));

            Awaitility.await()
                    .atMost(Duration.ofSeconds(15))
                    .untilAsserted(() -> {
                        consumer.poll(Duration.ofMillis(500)).forEach(received::add);
                        assertThat(received).anySatisfy(message -> {
                            assertThat(message.key()).isEqualTo("alice");
                            assertThat(message.value()).contains("\"amount\":500");
                        });
                    });
        }
    }
}
