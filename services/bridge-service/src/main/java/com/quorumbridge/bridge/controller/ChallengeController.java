package com.quorumbridge.bridge.controller;

import com.quorumbridge.bridge.domain.ChallengeStatus;
import com.quorumbridge.bridge.domain.ChallengeVote;
import com.quorumbridge.bridge.dto.ChallengeResponse;
import com.quorumbridge.bridge.dto.ChallengeVoteRequest;
import com.quorumbridge.bridge.dto.ChallengeVoteResponse;
import com.quorumbridge.bridge.dto.OpenChallengeRequest;
import com.quorumbridge.bridge.dto.ResolveChallengeRequest;
import com.quorumbridge.bridge.service.ChallengeService;
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
 * REST controller for attestation challenges
 */
@RestController
@RequestMapping("/api/v1/bridge/challenges")
@Tag(name = "Challenges", description = "Dispute and slashing endpoints")
@Slf4j
@RequiredArgsConstructor
public class ChallengeController {

    private final ChallengeService challengeService;

    @PostMapping
    @Operation(summary = "Challenge a validator's attestation")
    public ResponseEntity<ChallengeResponse> openChallenge(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @Valid @RequestBody OpenChallengeRequest request) {
        log.info("Challenge by {} against {} on transaction {}",
                caller, request.getValidator(), request.getTransactionNonce());
        ChallengeResponse challenge = ChallengeResponse.from(challengeService.openChallenge(caller, request));
        return ResponseEntity.status(HttpStatus.CREATED).body(challenge);
    }

    @GetMapping("/{challengeId}")
    @Operation(summary = "Get challenge by id")
    public ResponseEntity<ChallengeResponse> getChallenge(@PathVariable Long challengeId) {
        return ResponseEntity.ok(ChallengeResponse.from(challengeService.getChallenge(challengeId)));
    }

    @GetMapping
    @Operation(summary = "List challenges, optionally by status")
    public ResponseEntity<Page<ChallengeResponse>> listChallenges(
            @RequestParam(required = false) ChallengeStatus status,
            Pageable pageable) {
        return ResponseEntity.ok(challengeService.listChallenges(status, pageable).map(ChallengeResponse::from));
    }

    @PostMapping("/{challengeId}/resolve")
    @Operation(summary = "Resolve a challenge as arbitrator")
    public ResponseEntity<ChallengeResponse> resolve(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long challengeId,
            @Valid @RequestBody ResolveChallengeRequest request) {
        log.info("Resolving challenge {} by {}: successful={}", challengeId, caller, request.getSuccessful());
        return ResponseEntity.ok(ChallengeResponse.from(
                challengeService.resolveChallenge(caller, challengeId, request.getSuccessful())));
    }

    @PostMapping("/{challengeId}/votes")
    @Operation(summary = "Cast a token-weighted vote on a challenge")
    public ResponseEntity<ChallengeResponse> vote(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long challengeId,
            @Valid @RequestBody ChallengeVoteRequest request) {
        ChallengeVote vote = challengeService.castVote(caller, challengeId, request.getSupportsValidator());
        log.info("Vote recorded on challenge {} with weight {}", challengeId, vote.getWeight());
        return ResponseEntity.ok(ChallengeResponse.from(challengeService.getChallenge(challengeId)));
    }

    @PostMapping("/{challengeId}/finalize")
    @Operation(summary = "Settle a challenge by its community vote")
    public ResponseEntity<ChallengeResponse> finalizeByVote(
            @RequestHeader(ApiHeaders.CALLER) String caller,
            @PathVariable Long challengeId) {
        log.info("Finalizing challenge {} by vote, requested by {}", challengeId, caller);
        return ResponseEntity.ok(ChallengeResponse.from(challengeService.finalizeByVote(caller, challengeId)));
    }

    @GetMapping("/{challengeId}/votes")
    @Operation(summary = "List votes cast on a challenge")
    public ResponseEntity<List<ChallengeVoteResponse>> listVotes(@PathVariable Long challengeId) {
        return ResponseEntity.ok(challengeService.listVotes(challengeId).stream()
                .map(ChallengeVoteResponse::from)
                .toList());
    }
}
