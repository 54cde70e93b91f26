package com.fleetops.agent.llm;

public record Embedding(float[] vector, String model, int dimension) {
}
