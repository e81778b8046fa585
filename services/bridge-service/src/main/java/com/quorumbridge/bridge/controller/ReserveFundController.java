package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.domain.ReserveFundType;
import com.quorumbridge.bridge.dto.ReserveBalanceResponse;
import com.quorumbridge.bridge.dto.WithdrawFeesRequest;
import com.quorumbridge.bridge.service.ReserveFundService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/bridge/reserves")
@Tag(name = "Reserves", description = "Insurance fund and fee pool")
@Slf4j
@RequiredArgsConstructor
public class ReserveFundController {

    private final ReserveFundService reserveFundService;

    @GetMapping("/{fund}")
    @Operation(summary = "Get the balance of a reserve fund")
    public ResponseEntity<ReserveBalanceResponse> getBalance(@PathVariable ReserveFundType fund) {
        return ResponseEntity.ok(new ReserveBalanceResponse(fund, reserveFundService.balance(fund)));
    }

    @PostMapping("/fees/withdrawals")
    @Operation(summary = "Withdraw collected fees")
    public ResponseEntity<ReserveBalanceResponse> withdrawFees(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody WithdrawFeesRequest request) {
        log.info("Fee withdrawal of {} to {} requested by {}", request.getAmount(), request.getRecipient(), caller);
        BigInteger remaining = reserveFundService.withdrawFees(caller, request.getRecipient(), request.getAmount());
        return ResponseEntity.ok(new ReserveBalanceResponse(ReserveFundType.FEES, remaining));
    }
}
