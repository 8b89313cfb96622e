package dev.inkmatch.candidate;

import java.util.List;

/**
 * Artist directory collaborator. The returned list is treated as a snapshot: the engine never
 * writes back to the directory.
 */
public interface CandidatePoolProvider {

  /**
   * @param criteria pool filter and bound
   * @return at most {@code criteria.limit()} candidates
   */
  List<Candidate> getCandidatePool(CandidateCriteria criteria);
}
