package com.gentoro.aistack.manifest;

import com.gentoro.aistack.provider.ProviderKind;
import org.apache.commons.configuration2.ImmutableHierarchicalConfiguration;

/**
 * One {@code providers.<api>[]} entry of a manifest.
 *
 * @param active whether the entry carried {@code active: true}; the effective active binding of an
 *     api is decided by {@link Manifest#activeBinding}
 * @param config the provider specific {@code config} section, possibly empty
 */
public record ProviderBinding(
    String providerId,
    String providerType,
    ProviderKind kind,
    boolean active,
    ImmutableHierarchicalConfiguration config) {}
