package com.cloudmusic.resolver;

/**
 * Result of a chain operation together with the provider that satisfied it.
 */
public record Resolution<T>(T value, String providerName) {}
