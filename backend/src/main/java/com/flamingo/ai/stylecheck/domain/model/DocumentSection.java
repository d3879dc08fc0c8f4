package com.flamingo.ai.stylecheck.domain.model;

/**
 * A titled section of a style guide.
 *
 * @param title heading text; empty for the implicit leading section
 * @param body text between this heading and the next one
 */
public record DocumentSection(String title, String body) {}
