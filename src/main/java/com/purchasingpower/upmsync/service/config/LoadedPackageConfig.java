package com.purchasingpower.upmsync.service.config;

import com.purchasingpower.upmsync.model.spec.PackageSpec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of loading a package config: every entry in file order, each either a
 * valid {@link PackageSpec} or the reason it was rejected.
 */
public record LoadedPackageConfig(List<Entry> entries) {

    public LoadedPackageConfig {
        entries = List.copyOf(entries);
    }

    /**
     * @param name  package name, or {@code #<index>} when the entry has none
     * @param spec  null when the entry is invalid
     * @param error null when the entry is valid
     */
    public record Entry(String name, PackageSpec spec, String error) {

        public static Entry valid(PackageSpec spec) {
            return new Entry(spec.getName(), spec, null);
        }

        public static Entry invalid(String name, String error) {
            return new Entry(name, null, error);
        }

        public boolean isValid() {
            return spec != null;
        }
    }

    public List<PackageSpec> specs() {
        return entries.stream().filter(Entry::isValid).map(Entry::spec).collect(Collectors.toList());
    }

    public Map<String, String> invalid() {
        Map<String, String> invalid = new LinkedHashMap<>();
        entries.stream().filter(e -> !e.isValid()).forEach(e -> invalid.put(e.name(), e.error()));
        return invalid;
    }

    public Optional<Entry> find(String name) {
        return entries.stream().filter(e -> e.name().equals(name)).findFirst();
    }
}
