package org.learningjava.uniagent.application.usecase;

/** Progress callback, invoked on the run's thread at the start of every round. */
@FunctionalInterface
public interface RoundListener {

    RoundListener NONE = (round, maxRounds) -> { };

    void roundStarted(int round, int maxRounds);
}
