package com.bbthechange.mobilelogin.repository;

public interface SequenceCounterRepository {

    /**
     * Strongly consistent read of the named counter.
     *
     * @return the last value handed out, or 0 if the counter was never advanced
     */
    long current(String counterName);
}
