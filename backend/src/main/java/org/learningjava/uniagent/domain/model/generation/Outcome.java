package org.learningjava.uniagent.domain.model.generation;

public enum Outcome {
    /** FINAL accepted with all checks clear. */
    FINALIZED,
    /** Round budget used up; best available document returned. */
    EXHAUSTED,
    /** Round budget used up and no document was ever produced. */
    FAILED
}
