package com.hookline.recordmodel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name → {@link RecordDescriptor} table.
 *
 * <p>Descriptors refer to each other by name, so a catalog is only built once every reference
 * resolves; a dangling reference fails at start-up rather than during validation.
 */
public final class DescriptorCatalog {

    private final Map<String, RecordDescriptor> descriptors;

    private DescriptorCatalog(Map<String, RecordDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
    }

    /** Creates a catalog from the given descriptors. */
    public static DescriptorCatalog of(RecordDescriptor... descriptors) {
        return builder().addAll(List.of(descriptors)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the descriptor with the given name.
     *
     * @throws IllegalArgumentException if no descriptor has that name
     */
    public RecordDescriptor require(String name) {
        RecordDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown descriptor: " + name);
        }
        return descriptor;
    }

    public Optional<RecordDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public Set<String> names() {
        return descriptors.keySet();
    }

    public Collection<RecordDescriptor> descriptors() {
        return descriptors.values();
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Returns a new catalog holding this catalog's descriptors plus {@code other}'s. Descriptors in
     * {@code other} replace same-named ones here.
     */
    public DescriptorCatalog merge(DescriptorCatalog other) {
        return builder().addAll(descriptors()).addAll(other.descriptors()).build();
    }

    /** Accumulates descriptors; later additions replace earlier ones with the same name. */
    public static final class Builder {

        private final Map<String, RecordDescriptor> descriptors = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(RecordDescriptor descriptor) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptor must not be null");
            }
            descriptors.put(descriptor.name(), descriptor);
            return this;
        }

        public Builder addAll(Collection<RecordDescriptor> all) {
            all.forEach(this::add);
            return this;
        }

        /**
         * Builds the catalog.
         *
         * @throws IllegalArgumentException if any field refers to a descriptor that is not present
         */
        public DescriptorCatalog build() {
            List<String> dangling = new ArrayList<>();
            for (RecordDescriptor descriptor : descriptors.values()) {
                for (FieldSpec field : descriptor.fields()) {
                    if (field.recordRef() != null && !descriptors.containsKey(field.recordRef())) {
                        dangling.add(descriptor.name() + "." + field.name() + " -> " + field.recordRef());
                    }
                }
            }
            if (!dangling.isEmpty()) {
                throw new IllegalArgumentException("Unresolved descriptor references: " + dangling);
            }
            return new DescriptorCatalog(descriptors);
        }
    }
}
