package dev.inkmatch.consensus;

import dev.inkmatch.error.MatchingException;

/**
 * No evaluator result survived the confidence floor. The candidate has no decision and must be
 * excluded from ranking rather than scored zero.
 */
public class NoQuorumException extends MatchingException {

  private final int received;

  public NoQuorumException(int received, double confidenceFloor) {
    super(
        "No quorum: "
            + received
            + " result(s) received, none above confidence floor "
            + confidenceFloor);
    this.received = received;
  }

  /** Number of results handed to the aggregator, before the floor was applied. */
  public int getReceived() {
    return received;
  }
}
