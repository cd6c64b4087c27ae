package com.openfashion.ammservice;

import com.openfashion.ammservice.dto.*;
import com.openfashion.ammservice.repository.*;
import com.openfashion.ammservice.service.AssetTransferService;
import com.openfashion.ammservice.service.BlockClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;
import tools.jackson.databind.ObjectMapper;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@Testcontainers
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AmmControllerE2ETest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer postgres = new PostgreSQLContainer("postgres:16-alpine");

    @MockitoBean
    private BlockClock blockClock;
    @MockitoBean
    private AssetTransferService assetTransferService;

    @Autowired
    private MockMvc mockMvc;

    private final ObjectMapper objectMapper = new ObjectMapper();

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
    void setup() throws Exception {
        outboxRepository.deleteAll();
        swapRepository.deleteAll();
        shareRepository.deleteAll();
        accountPoolsRepository.deleteAll();
        poolRepository.deleteAll();
        statRepository.deleteAll();

        when(assetTransferService.transfer(anyString(), anyLong(), anyString(), anyString()))
                .thenAnswer(inv -> TransferResult.success(UUID.randomUUID()));
        when(blockClock.currentBlock()).thenReturn(5L);

        mockMvc.perform(post("/pools")
                        .header("X-Account-ID", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreatePoolRequest("STX", "USDA", 1_000_000L, 1_000_000L))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.poolId").value(1))
                .andExpect(jsonPath("$.liquidity").value(1_000_000));
    }

    @Test
    @DisplayName("POST /swaps - Reference trade returns 996 out")
    void testSwapEndpoint() throws Exception {
        mockMvc.perform(post("/swaps")
                        .header("X-Account-ID", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SwapRequest(1L, 1000L, 990L, "STX"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.swapId").value(0))
                .andExpect(jsonPath("$.amountOut").value(996));

        mockMvc.perform(get("/swaps/0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trader").value("bob"));

        mockMvc.perform(get("/swaps/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSwaps").value(1))
                .andExpect(jsonPath("$.totalVolume").value(1000));
    }

    @Test
    @DisplayName("POST /swaps - Unmet minimum output returns 409 Conflict")
    void testSwap_Slippage() throws Exception {
        mockMvc.perform(post("/swaps")
                        .header("X-Account-ID", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SwapRequest(1L, 1000L, 997L, "STX"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Slippage Exceeded"));
    }

    @Test
    @DisplayName("GET /swaps/quote - Quote for the reverse direction")
    void testQuoteEndpoint() throws Exception {
        mockMvc.perform(get("/swaps/quote")
                        .param("poolId", "1")
                        .param("amountIn", "1000")
                        .param("assetIn", "USDA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amountOut").value(996))
                .andExpect(jsonPath("$.fee").value(3));
    }

    @Test
    @DisplayName("PUT /pools/{id}/fee-rate - Non-owner gets 403 Forbidden")
    void testFeeRate_Unauthorized() throws Exception {
        mockMvc.perform(put("/pools/1/fee-rate")
                        .header("X-Account-ID", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FeeRateRequest(10L))))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/pools/1/fee-rate")
                        .header("X-Account-ID", "amm-admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FeeRateRequest(10L))))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/pools/1"))
                .andExpect(jsonPath("$.feeRate").value(10));
    }

    @Test
    @DisplayName("POST /pools/{id}/liquidity/removal - Burning unheld shares returns 422")
    void testRemoveLiquidity_InsufficientBalance() throws Exception {
        mockMvc.perform(post("/pools/1/liquidity/removal")
                        .header("X-Account-ID", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RemoveLiquidityRequest(10L, 0L, 0L))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Insufficient Balance"));
    }

    @Test
    @DisplayName("Liquidity added over HTTP shows up in the provider's share balance")
    void testAddLiquidityEndpoint() throws Exception {
        mockMvc.perform(post("/pools/1/liquidity")
                        .header("X-Account-ID", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AddLiquidityRequest(5000L, 5000L, 5000L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shares").value(5000));

        mockMvc.perform(get("/pools/1/shares/bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").value(5000));

        mockMvc.perform(get("/pools/accounts/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value(1));
    }

    @Test
    @DisplayName("GET /pools/{id} - Unknown pool returns 404 problem detail")
    void testGetPool_NotFound() throws Exception {
        mockMvc.perform(get("/pools/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"))
                .andExpect(jsonPath("$.detail").value("Cannot find pool with id: 42"));
    }
}
