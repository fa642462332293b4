package com.flamingo.ai.pitchscoop.store;

/** Key and raw JSON value returned by a prefix scan. */
public record TenantEntry(TenantKey key, String value) {}
