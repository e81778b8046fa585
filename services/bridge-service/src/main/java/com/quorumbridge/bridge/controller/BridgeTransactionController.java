package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.dto.AttestationRequest;
import com.quorumbridge.bridge.dto.AttestationResponse;
import com.quorumbridge.bridge.dto.BridgeStatisticsResponse;
import com.quorumbridge.bridge.dto.BridgeTransactionResponse;
import com.quorumbridge.bridge.dto.CommitAttestationRequest;
import com.quorumbridge.bridge.dto.CommitmentResponse;
import com.quorumbridge.bridge.dto.FailureVoteRequest;
import com.quorumbridge.bridge.dto.FeeQuoteResponse;
import com.quorumbridge.bridge.dto.InitiateBridgeRequest;
import com.quorumbridge.bridge.service.BridgeMonitoringService;
import com.quorumbridge.bridge.service.BridgeTransactionService;
import com.quorumbridge.bridge.service.ChainRegistryService;
import com.quorumbridge.bridge.service.attestation.AttestationSubmission;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * REST controller for bridge transfers and their attestations
 */
@RestController
@RequestMapping("/api/v1/bridge/transactions")
@Tag(name = "Bridge Transactions", description = "Cross-chain transfer lifecycle endpoints")
@Slf4j
@RequiredArgsConstructor
public class BridgeTransactionController {

    private final BridgeTransactionService transactionService;
    private final ChainRegistryService chainRegistryService;
    private final BridgeMonitoringService monitoringService;

    @PostMapping
    @Operation(summary = "Lock tokens for a cross-chain transfer")
    public ResponseEntity<BridgeTransactionResponse> initiate(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody InitiateBridgeRequest request) {
        log.info("Initiating bridge transfer for {} to chain {}", caller, request.getDestinationChainId());
        BridgeTransactionResponse tx = BridgeTransactionResponse.from(transactionService.initiate(caller, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(tx);
    }

    @GetMapping("/{nonce}")
    @Operation(summary = "Get bridge transaction by nonce")
    public ResponseEntity<BridgeTransactionResponse> getTransaction(@PathVariable Long nonce) {
        return ResponseEntity.ok(BridgeTransactionResponse.from(transactionService.getTransaction(nonce)));
    }

    @GetMapping
    @Operation(summary = "List bridge transactions, optionally by status and user")
    public ResponseEntity<Page<BridgeTransactionResponse>> listTransactions(
            @RequestParam(required = false) BridgeTransactionStatus status,
            @RequestParam(required = false) String user,
            Pageable pageable) {
        return ResponseEntity.ok(transactionService.listTransactions(status, user, pageable)
                .map(BridgeTransactionResponse::from));
    }

    @PostMapping("/{nonce}/attestations")
    @Operation(summary = "Attest a pending transaction")
    public ResponseEntity<BridgeTransactionResponse> attest(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long nonce,
            @Valid @RequestBody AttestationRequest request) {
        log.info("Attestation for transaction {} from {}", nonce, caller);
        AttestationSubmission submission = new AttestationSubmission(request.getSignature(), request.getSalt());
        return ResponseEntity.ok(BridgeTransactionResponse.from(transactionService.attest(caller, nonce, submission)));
    }

    @GetMapping("/{nonce}/attestations")
    @Operation(summary = "List attestations of a transaction")
    public ResponseEntity<List<AttestationResponse>> listAttestations(@PathVariable Long nonce) {
        return ResponseEntity.ok(transactionService.listAttestations(nonce).stream()
                .map(AttestationResponse::from)
                .toList());
    }

    @PostMapping("/{nonce}/commitments")
    @Operation(summary = "Commit to an attestation (commit-reveal mode)")
    public ResponseEntity<CommitmentResponse> commit(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long nonce,
            @Valid @RequestBody CommitAttestationRequest request) {
        log.info("Attestation commitment for transaction {} from {}", nonce, caller);
        CommitmentResponse commitment = CommitmentResponse.from(
                transactionService.commitAttestation(caller, nonce, request.getCommitment()));
        return ResponseEntity.status(HttpStatus.CREATED).body(commitment);
    }

    @PostMapping("/{nonce}/failure-votes")
    @Operation(summary = "Vote to fail a pending transaction")
    public ResponseEntity<BridgeTransactionResponse> voteFailure(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long nonce,
            @Valid @RequestBody FailureVoteRequest request) {
        log.info("Failure vote for transaction {} from {}", nonce, caller);
        return ResponseEntity.ok(BridgeTransactionResponse.from(
                transactionService.markFailed(caller, nonce, request.getReason())));
    }

    @PostMapping("/{nonce}/cancel")
    @Operation(summary = "Cancel a timed-out transaction and refund the locked amount")
    public ResponseEntity<BridgeTransactionResponse> cancel(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long nonce) {
        log.info("Cancelling transaction {} for {}", nonce, caller);
        return ResponseEntity.ok(BridgeTransactionResponse.from(transactionService.cancel(caller, nonce)));
    }

    @GetMapping("/fee-quote")
    @Operation(summary = "Quote the fee for a transfer")
    public ResponseEntity<FeeQuoteResponse> quoteFee(
            @RequestParam Long destinationChainId,
            @RequestParam BigInteger amount) {
        return ResponseEntity.ok(chainRegistryService.quoteFee(destinationChainId, amount));
    }

    @GetMapping("/stuck")
    @Operation(summary = "List transfers pending longer than the configured stuck threshold")
    public ResponseEntity<List<BridgeTransactionResponse>> listStuckTransactions() {
        return ResponseEntity.ok(monitoringService.listStuckTransactions().stream()
                .map(BridgeTransactionResponse::from)
                .toList());
    }

    @GetMapping("/statistics")
    @Operation(summary = "Aggregate bridge volume and validator statistics")
    public ResponseEntity<BridgeStatisticsResponse> getStatistics() {
        return ResponseEntity.ok(transactionService.getStatistics());
    }
}
