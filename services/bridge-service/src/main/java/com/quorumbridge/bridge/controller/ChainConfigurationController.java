package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.dto.ChainConfigurationRequest;
import com.quorumbridge.bridge.dto.ChainConfigurationResponse;
import com.quorumbridge.bridge.service.ChainRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bridge/chains")
@Tag(name = "Chains", description = "Destination chain configuration")
@Slf4j
@RequiredArgsConstructor
public class ChainConfigurationController {

    private final ChainRegistryService chainRegistryService;

    @PutMapping
    @Operation(summary = "Add or update a destination chain")
    public ResponseEntity<ChainConfigurationResponse> configureChain(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody ChainConfigurationRequest request) {
        log.info("Configuring chain {} by {}", request.getChainId(), caller);
        return ResponseEntity.ok(ChainConfigurationResponse.from(chainRegistryService.configureChain(caller, request)));
    }

    @GetMapping
    @Operation(summary = "List destination chains")
    public ResponseEntity<List<ChainConfigurationResponse>> listChains() {
        return ResponseEntity.ok(chainRegistryService.listChains().stream()
                .map(ChainConfigurationResponse::from)
                .toList());
    }
}
