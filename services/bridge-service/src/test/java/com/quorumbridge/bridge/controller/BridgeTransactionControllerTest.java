package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ResourceNotFoundException;
import com.quorumbridge.bridge.metrics.BridgeMetricsService;
import com.quorumbridge.bridge.service.BridgeMonitoringService;
import com.quorumbridge.bridge.service.BridgeTransactionService;
import com.quorumbridge.bridge.service.ChainRegistryService;
import com.quorumbridge.bridge.service.attestation.AttestationSubmission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BridgeTransactionController.class)
@DisplayName("BridgeTransactionController Tests")
class BridgeTransactionControllerTest {

    private static final String USER = "0x00000000000000000000000000000000000000b1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BridgeTransactionService transactionService;

    @MockBean
    private ChainRegistryService chainRegistryService;

    @MockBean
    private BridgeMonitoringService monitoringService;

    @MockBean
    private BridgeMetricsService metricsService;

    @Test
    @DisplayName("Should return 201 with the pending transaction on initiation")
    void shouldInitiate() throws Exception {
        when(transactionService.initiate(eq(USER), any())).thenReturn(transaction());

        mockMvc.perform(post("/api/v1/bridge/transactions")
                        .header(ApiHeaders.CALLER, USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1000, \"destinationChainId\": 137}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.nonce").value(7))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.user").value(USER));
    }

    @Test
    @DisplayName("Should reject malformed signatures before reaching the service")
    void shouldValidateSignatureFormat() throws Exception {
        mockMvc.perform(post("/api/v1/bridge/transactions/7/attestations")
                        .header(ApiHeaders.CALLER, USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"signature\": \"0x1234\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.signature").exists());
        verifyNoInteractions(transactionService);
    }

    @Test
    @DisplayName("Should map state errors to 409 with code and retry flag")
    void shouldMapStateErrors() throws Exception {
        when(transactionService.cancel(USER, 7L)).thenThrow(
                new BridgeStateException(ErrorCode.TIMEOUT_NOT_REACHED, "too early", true));

        mockMvc.perform(post("/api/v1/bridge/transactions/7/cancel").header(ApiHeaders.CALLER, USER))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TIMEOUT_NOT_REACHED"))
                .andExpect(jsonPath("$.category").value("STATE"))
                .andExpect(jsonPath("$.retryable").value(true));
        verify(metricsService).recordRejection("STATE", "TIMEOUT_NOT_REACHED");
    }

    @Test
    @DisplayName("Should map unknown nonces to 404")
    void shouldMapNotFound() throws Exception {
        when(transactionService.getTransaction(99L)).thenThrow(
                new ResourceNotFoundException(ErrorCode.TRANSACTION_NOT_FOUND, "missing"));

        mockMvc.perform(get("/api/v1/bridge/transactions/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TRANSACTION_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should list stuck transfers")
    void shouldListStuckTransfers() throws Exception {
        when(monitoringService.listStuckTransactions()).thenReturn(List.of(transaction()));

        mockMvc.perform(get("/api/v1/bridge/transactions/stuck"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nonce").value(7))
                .andExpect(jsonPath("$[0].status").value("PENDING"));
    }

    @Test
    @DisplayName("Should require the caller header for state-changing calls")
    void shouldRequireCallerHeader() throws Exception {
        mockMvc.perform(post("/api/v1/bridge/transactions/7/cancel"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Should pass signature and salt through to the service")
    void shouldForwardAttestation() throws Exception {
        String signature = "0x" + "11".repeat(64) + "1b";
        when(transactionService.attest(eq(USER), eq(7L), any())).thenReturn(transaction());

        mockMvc.perform(post("/api/v1/bridge/transactions/7/attestations")
                        .header(ApiHeaders.CALLER, USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"signature\": \"" + signature + "\"}"))
                .andExpect(status().isOk());
        verify(transactionService).attest(USER, 7L, new AttestationSubmission(signature, null));
    }

    @Test
    @DisplayName("Should map lock failures to a retryable 409")
    void shouldMapLockFailures() throws Exception {
        String signature = "0x" + "11".repeat(64) + "1b";
        when(transactionService.attest(eq(USER), eq(7L), any())).thenThrow(
                new CannotAcquireLockException("deadlock detected"));

        mockMvc.perform(post("/api/v1/bridge/transactions/7/attestations")
                        .header(ApiHeaders.CALLER, USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"signature\": \"" + signature + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENT_MODIFICATION"))
                .andExpect(jsonPath("$.category").value("STATE"))
                .andExpect(jsonPath("$.retryable").value(true));
        verify(metricsService).recordRejection("STATE", "CONCURRENT_MODIFICATION");
    }

    private BridgeTransaction transaction() {
        return BridgeTransaction.builder()
                .nonce(7L)
                .userAddress(USER)
                .amount(BigInteger.valueOf(1_000))
                .fee(BigInteger.valueOf(11))
                .sourceChainId(1L)
                .destinationChainId(137L)
                .status(BridgeTransactionStatus.PENDING)
                .createdAt(Instant.parse("2026-03-01T00:00:00Z"))
                .build();
    }
}
