package com.meetpoll.scoring;

/**
 * Turns per-slot answer counts into a comparable score. Higher is better.
 */
public interface SlotScoringPolicy {

    double score(int available, int maybe, int unavailable);
}
