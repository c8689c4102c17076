package com.example.auditcore.service;

/**
 * First point at which the stored chain disagrees with a recomputation.
 *
 * @param eventId  event at which verification stopped, {@code null} when the break is not tied
 *                 to a stored event (e.g. a tail pointing at a missing position)
 * @param sequence chain position of the break
 * @param expected value the verifier derived
 * @param actual   value found in storage
 */
public record IntegrityViolation(
        String eventId,
        long sequence,
        String reason,
        String expected,
        String actual
) { }
