package com.oitracker.domain.model;

/**
 * Zone-wide call and put OI-change totals from one earlier snapshot.
 */
public record OiChangePair(long callChange, long putChange) {}
