package dev.inkmatch.profile;

/** Coarse visual complexity of a design. */
public enum Complexity {
  SIMPLE,
  MEDIUM,
  COMPLEX
}
