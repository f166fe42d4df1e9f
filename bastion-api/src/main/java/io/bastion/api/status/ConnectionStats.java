package io.bastion.api.status;

public record ConnectionStats(int active, int available, int maxSize) {}
