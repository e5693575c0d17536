package com.flamingo.ai.interviewinsights.domain.model;

/**
 * A topic mentioned noticeably more often in interviews with one outcome than with the other.
 *
 * @param topicId id of the topic
 * @param representativeTerm representative term of the topic
 * @param ratePercent share of interviews with this outcome that mention the topic
 * @param differencePercent rate minus the rate for the opposite outcome, in percentage points
 */
public record OutcomePattern(
    String topicId, String representativeTerm, double ratePercent, double differencePercent) {}
