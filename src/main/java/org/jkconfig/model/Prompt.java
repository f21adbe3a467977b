package org.jkconfig.model;

/**
 * A prompt of a menu node.
 *
 * @param text The prompt text.
 * @param condition The condition under which the prompt is shown.
 */
public record Prompt(String text, Expr condition) {}
