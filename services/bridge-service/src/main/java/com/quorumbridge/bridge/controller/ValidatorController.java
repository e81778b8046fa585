package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.dto.AddValidatorRequest;
import com.quorumbridge.bridge.dto.RemoveValidatorRequest;
import com.quorumbridge.bridge.dto.ValidatorResponse;
import com.quorumbridge.bridge.service.ValidatorRegistryService;
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

import java.util.List;

/**
 * REST controller for the validator set
 */
@RestController
@RequestMapping("/api/v1/bridge/validators")
@Tag(name = "Validators", description = "Validator registration and lookup")
@Slf4j
@RequiredArgsConstructor
public class ValidatorController {

    private final ValidatorRegistryService validatorRegistry;

    @PostMapping
    @Operation(summary = "Register a validator and take its stake")
    public ResponseEntity<ValidatorResponse> addValidator(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody AddValidatorRequest request) {
        log.info("Adding validator {} with stake {}", request.getAddress(), request.getStake());
        Validator validator = validatorRegistry.addValidator(caller, request.getAddress(), request.getStake());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(validator));
    }

    @DeleteMapping("/{address}")
    @Operation(summary = "Deactivate a validator")
    public ResponseEntity<ValidatorResponse> removeValidator(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable String address,
            @Valid @RequestBody RemoveValidatorRequest request) {
        log.info("Removing validator {}: {}", address, request.getReason());
        return ResponseEntity.ok(toResponse(validatorRegistry.removeValidator(caller, address, request.getReason())));
    }

    @GetMapping("/{address}")
    @Operation(summary = "Get validator by address")
    public ResponseEntity<ValidatorResponse> getValidator(@PathVariable String address) {
        return ResponseEntity.ok(toResponse(validatorRegistry.getValidator(address)));
    }

    @GetMapping("/active")
    @Operation(summary = "List active validators")
    public ResponseEntity<List<ValidatorResponse>> listActiveValidators() {
        return ResponseEntity.ok(validatorRegistry.listActiveValidators().stream()
                .map(this::toResponse)
                .toList());
    }

    @GetMapping
    @Operation(summary = "List all validators, including inactive ones")
    public ResponseEntity<Page<ValidatorResponse>> listValidators(Pageable pageable) {
        return ResponseEntity.ok(validatorRegistry.listValidators(pageable).map(this::toResponse));
    }

    private ValidatorResponse toResponse(Validator validator) {
        return ValidatorResponse.from(validator,
                validatorRegistry.effectiveReputation(validator),
                validatorRegistry.isEligible(validator));
    }
}
