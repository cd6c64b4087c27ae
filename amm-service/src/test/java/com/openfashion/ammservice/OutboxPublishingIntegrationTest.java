package com.openfashion.ammservice;

import com.openfashion.ammservice.dto.TransferResult;
import com.openfashion.ammservice.model.OutboxStatus;
import com.openfashion.ammservice.repository.*;
import com.openfashion.ammservice.service.AssetTransferService;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.PoolService;
import com.openfashion.ammservice.service.SwapService;
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
    private PoolService poolService;
    @Autowired
    private SwapService swapService;
    @Autowired
    private LiquidityPoolRepository poolRepository;
    @Autowired
    private LiquidityShareRepository shareRepository;
    @Autowired
    private SwapRecordRepository swapRepository;
    @Autowired
    private AccountPoolsRepository accountPoolsRepository;
    @Autowired
    private ProtocolStatRepository statRepository;
    @Autowired
    private OutboxRepository outboxRepository;

    @BeforeEach
    void setup() {
        outboxRepository.deleteAll();
        swapRepository.deleteAll();
        shareRepository.deleteAll();
        accountPoolsRepository.deleteAll();
        poolRepository.deleteAll();
        statRepository.deleteAll();

        when(assetTransferService.transfer(anyString(), anyLong(), anyString(), anyString()))
                .thenAnswer(inv -> TransferResult.success(UUID.randomUUID()));
        when(blockClock.currentBlock()).thenReturn(100L);
    }

    @Test
    @DisplayName("Outbox: pool and swap events are published to their topics and marked processed")
    void testPoolAndSwapEventsPublished() {
        poolService.createPool("alice", "STX", "USDA", 1_000_000L, 1_000_000L);
        swapService.swap("bob", 1L, 1000L, 0L, "STX");

        Awaitility.await()
                .atMost(Duration.ofSeconds(30))
                .untilAsserted(() -> assertThat(outboxRepository.findAll())
                        .hasSize(2)
                        .allMatch(e -> e.getStatus() == OutboxStatus.PROCESSED));

        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(Map.of(
                ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers(),
                ConsumerConfig.GROUP_ID_CONFIG, "amm-outbox-check",
                ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest",
                ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class,
                ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class))) {
            consumer.subscribe(List.of("amm.pools", "amm.swaps"));

            Awaitility.await()
                    .atMost(Duration.ofSeconds(15))
                    .untilAsserted(() -> {
                        consumer.poll(Duration.ofMillis(500)).forEach(received::add);
                        assertThat(received).extracting(ConsumerRecord::topic)
                                .contains("amm.pools", "amm.swaps");
                    });
        }

        assertThat(received).filteredOn(message -> message.topic().equals("amm.swaps"))
                .singleElement()
                .satisfies(message -> {
                    assertThat(message.key()).isEqualTo("0");
                    assertThat(message.value()).contains("\"amountOut\":996");
                });
    }
}
