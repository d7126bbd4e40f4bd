package com.irledger.domain.model;

/**
 * One side of a two-party conversation
 */
public record Participant(String id, String name) {
}
