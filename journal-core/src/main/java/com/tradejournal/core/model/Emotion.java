package com.tradejournal.core.model;

/**
 * Self-reported emotional state at entry or exit.
 */
public enum Emotion {
    CALM,
    ANXIOUS,
    CONFIDENT,
    FOMO,
    BORED,
    REVENGE
}
