package com.memquest.retrieval;

public record RankedId(String id, double score) {}
