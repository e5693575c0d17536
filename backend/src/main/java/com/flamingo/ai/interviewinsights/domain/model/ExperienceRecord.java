package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import java.time.LocalDate;
import lombok.Builder;

/**
 * An interview-experience report as delivered by the collection layer.
 *
 * @param id unique record id
 * @param company company the interview was for
 * @param role role applied for, may be null
 * @param date date of the experience
 * @param rawText free-text report, may contain markup
 * @param outcome reported outcome
 * @param sourcePlatform platform the record was collected from, may be null
 * @param sourceUrl original URL, may be null
 */
@Builder
public record ExperienceRecord(
    String id,
    String company,
    String role,
    LocalDate date,
    String rawText,
    Outcome outcome,
    String sourcePlatform,
    String sourceUrl) {}
