package com.invoice.sorter.service;

import com.invoice.sorter.config.InvoiceParserProperties;
import com.invoice.sorter.exception.UnknownVendorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Resolves a vendor key, typically a vendor folder name, to its parser.
 *
 * Lookup order: the lower-cased key as given, then its normalised form
 * ({@code "Core & Main"} becomes {@code core_main}), then the configured aliases.
 * There is no default vendor; a miss is an {@link UnknownVendorException}.
 */
@Service
@Slf4j
public class VendorDispatcher {

    private final VendorRegistry registry;
    private final Map<String, String> aliases;

    public VendorDispatcher(VendorRegistry registry, InvoiceParserProperties properties) {
        this.registry = registry;

        Map<String, String> normalized = new HashMap<>();
        properties.getVendorAliases().forEach((alias, key) -> {
            String target = normalize(key);
            if (registry.find(target).isEmpty()) {
                throw new IllegalStateException("Alias '" + alias + "' points to unknown vendor '" + key + "'");
            }
            normalized.put(normalize(alias), target);
        });
        this.aliases = Map.copyOf(normalized);
    }

    public VendorParser resolve(String vendorKey) {
        if (vendorKey == null || vendorKey.isBlank()) {
            throw new UnknownVendorException(String.valueOf(vendorKey));
        }

        Optional<VendorParser> exact = registry.find(vendorKey.trim().toLowerCase(Locale.ROOT));
        if (exact.isPresent()) return exact.get();

        String normalized = normalize(vendorKey);
        Optional<VendorParser> byNormalized = registry.find(normalized);
        if (byNormalized.isPresent()) return byNormalized.get();

        String aliasTarget = aliases.get(normalized);
        if (aliasTarget != null) {
            log.debug("Vendor key '{}' resolved through alias to '{}'", vendorKey, aliasTarget);
            return registry.find(aliasTarget).orElseThrow(() -> new UnknownVendorException(vendorKey));
        }

        log.warn("No rule set for vendor key '{}' (normalised '{}')", vendorKey, normalized);
        throw new UnknownVendorException(vendorKey);
    }

    /**
     * Lower-case, drop everything but letters, digits and whitespace, join words with underscores.
     */
    static String normalize(String key) {
        String cleaned = key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\s_]", "").trim();
        return cleaned.replaceAll("[\\s_]+", "_");
    }
}
