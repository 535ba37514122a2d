package com.playpilot.orchestrator.safety;

/**
 * One policy breach found in a playbook.
 *
 * @param pattern        the denylisted substring or capability that matched
 * @param matchedSegment the line of the playbook where it matched
 * @param message        human-readable description reported to the caller
 */
public record Violation(String pattern, String matchedSegment, String message) {}
