package com.openfashion.lendingservice;

import com.openfashion.lendingservice.client.settlement.dto.SettlementRequest;
import com.openfashion.lendingservice.client.settlement.dto.SettlementResponse;
import com.openfashion.lendingservice.client.settlement.dto.SettlementStatus;
import com.openfashion.lendingservice.client.settlement.service.SettlementClient;
import com.openfashion.lendingservice.dto.TransferResult;
import com.openfashion.lendingservice.service.imp.SettlementTransferServiceImp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementTransferServiceTest {

    @Mock
    private SettlementClient settlementClient;

    @InjectMocks
    private SettlementTransferServiceImp transferService;

    @Test
    @DisplayName("An approved settlement yields a successful transfer carrying the settlement id")
    void testTransfer_Approved() {
        UUID transferId = UUID.randomUUID();
        when(settlementClient.transfer(any())).thenReturn(new SettlementResponse(transferId, SettlementStatus.APPROVED, null));

        TransferResult result = transferService.transfer("STX", 500L, "alice", "lending-pool");

        assertThat(result.success()).isTrue();
        assertThat(result.transferId()).isEqualTo(transferId);

        ArgumentCaptor<SettlementRequest> captor = ArgumentCaptor.forClass(SettlementRequest.class);
        verify(settlementClient).transfer(captor.capture());
        assertThat(captor.getValue().asset()).isEqualTo("STX");
        assertThat(captor.getValue().amount()).isEqualTo(500L);
        assertThat(captor.getValue().from()).isEqualTo("alice");
        assertThat(captor.getValue().to()).isEqualTo("lending-pool");
        assertThat(captor.getValue().referenceId()).isNotNull();
    }

    @Test
    @DisplayName("A declined settlement yields a failure with the reason code")
    void testTransfer_Declined() {
        when(settlementClient.transfer(any())).thenReturn(new SettlementResponse(null, SettlementStatus.DECLINED, "NSF"));

        TransferResult result = transferService.transfer("STX", 500L, "alice", "lending-pool");

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo("NSF");
    }

    @Test
    @DisplayName("An unreachable settlement endpoint is reported as a failure, not thrown")
    void testTransfer_Unreachable() {
        when(settlementClient.transfer(any())).thenThrow(new ResourceAccessException("Connection refused"));

        TransferResult result = transferService.transfer("STX", 500L, "alice", "lending-pool");

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo("Settlement unavailable");
    }
}
