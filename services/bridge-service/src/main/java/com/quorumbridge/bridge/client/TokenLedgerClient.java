package com.quorumbridge.bridge.client;

import com.quorumbridge.bridge.client.dto.BalanceResponse;
import com.quorumbridge.bridge.client.dto.TransferRequest;
import com.quorumbridge.bridge.client.dto.TransferResult;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the fungible token ledger.
 *
 * <p>Only balance lookups and the two transfer primitives are consumed. Transfers
 * report {@code success=false} when the ledger refuses them (insufficient balance
 * or allowance).</p>
 */
@FeignClient(
    name = "token-ledger",
    url = "${token-ledger.url:http://localhost:8545}",
    path = "/api/v1/ledger",
    fallbackFactory = TokenLedgerClientFallbackFactory.class,
    configuration = TokenLedgerClientConfiguration.class
)
public interface TokenLedgerClient {

    @GetMapping("/balances/{address}")
    BalanceResponse balanceOf(@PathVariable("address") String address);

    @PostMapping("/transfers")
    TransferResult transfer(@RequestBody TransferRequest request);

    @PostMapping("/transfers/from")
    TransferResult transferFrom(@RequestBody TransferRequest request);
}
