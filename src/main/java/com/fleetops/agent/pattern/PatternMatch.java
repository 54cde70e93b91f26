package com.fleetops.agent.pattern;

public record PatternMatch(LearnedPattern pattern, double similarity) {
}
