package com.collectiveip.core.domain;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted tally shared by governance and license proposals.
 * <p>
 * The total-weight denominator and the quorum derived from it are fixed when the ballot opens.
 * Each vote carries the voter's weight at the moment it is cast.
 */
public class Ballot {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private long totalWeightSnapshot;
    private long quorum;
    private long votesFor;
    private long votesAgainst;
    private Map<String, Vote> votes;

    public record Vote(String voter, boolean inFavor, long weight, long castAt) {}

    private Ballot() {}

    public static Ballot open(long totalWeightSnapshot, int quorumBps) {
        if (totalWeightSnapshot < 0) {
            throw new IllegalArgumentException("Total weight cannot be negative");
        }
        var ballot = new Ballot();
        ballot.totalWeightSnapshot = totalWeightSnapshot;
        ballot.quorum = BigInteger.valueOf(totalWeightSnapshot)
                .multiply(BigInteger.valueOf(quorumBps))
                .divide(BPS_DENOMINATOR)
                .longValueExact();
        ballot.votes = new LinkedHashMap<>();
        return ballot;
    }

    public boolean hasVoted(String voter) {
        return votes.containsKey(voter);
    }

    public void cast(String voter, boolean inFavor, long weight, long at) {
        Objects.requireNonNull(voter, "Voter cannot be null");
        if (hasVoted(voter)) {
            throw new IllegalStateException("Voter already voted: " + voter);
        }
        if (inFavor) {
            votesFor = Math.addExact(votesFor, weight);
        } else {
            votesAgainst = Math.addExact(votesAgainst, weight);
        }
        votes.put(voter, new Vote(voter, inFavor, weight, at));
    }

    public long participation() {
        return votesFor + votesAgainst;
    }

    public boolean quorumReached() {
        return participation() >= quorum;
    }

    /**
     * More weight for than against.
     */
    public boolean relativeMajority() {
        return votesFor > votesAgainst;
    }

    /**
     * More than half of the snapshotted total weight voted for.
     */
    public boolean absoluteMajority() {
        return votesFor > totalWeightSnapshot - votesFor;
    }

    public Ballot copy() {
        var copy = new Ballot();
        copy.totalWeightSnapshot = totalWeightSnapshot;
        copy.quorum = quorum;
        copy.votesFor = votesFor;
        copy.votesAgainst = votesAgainst;
        copy.votes = new LinkedHashMap<>(votes);
        return copy;
    }

    public long getTotalWeightSnapshot() { return totalWeightSnapshot; }
    public long getQuorum() { return quorum; }
    public long getVotesFor() { return votesFor; }
    public long getVotesAgainst() { return votesAgainst; }
    public Map<String, Vote> getVotes() { return Collections.unmodifiableMap(votes); }
}
