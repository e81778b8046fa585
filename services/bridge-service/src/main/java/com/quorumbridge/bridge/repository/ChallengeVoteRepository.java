package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.ChallengeVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChallengeVoteRepository extends JpaRepository<ChallengeVote, Long> {

    boolean existsByChallengeIdAndVoter(Long challengeId, String voter);

    List<ChallengeVote> findByChallengeId(Long challengeId);
}
