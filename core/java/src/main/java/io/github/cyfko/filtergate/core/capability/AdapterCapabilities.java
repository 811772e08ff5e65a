package io.github.cyfko.filtergate.core.capability;

import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.exception.MissingCapabilityException;
import io.github.cyfko.filtergate.core.model.FieldKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What one backend adapter supports for one connection.
 * <p>
 * Capabilities have three parts:
 * </p>
 * <ul>
 *   <li><strong>operators</strong>: the operators offered per {@code (category, fieldKind)} pair</li>
 *   <li><strong>features</strong>: detected backend features with an optional hint per missing one</li>
 *   <li><strong>limits</strong>: numeric limits such as the maximum membership list size</li>
 * </ul>
 * <p>
 * Instances are immutable. They are computed once per connection by a
 * {@link CapabilityDetector} and cached by the {@link CapabilityRegistry}.
 * </p>
 *
 * <pre>{@code
 * AdapterCapabilities caps = AdapterCapabilities.builder("postgres")
 *     .version("14.5")
 *     .feature(Feature.NATIVE_ARRAYS)
 *     .operators(OperatorCategory.SCALAR, OperatorSets.EQUALITY, FieldKind.values())
 *     .maxInItems(10_000)
 *     .build();
 *
 * caps.supportedOperators(OperatorCategory.SCALAR, FieldKind.INTEGER); // [_eq, _neq, _in, _nin, _is_null]
 * caps.require(Feature.QUERY_EXPLAIN); // throws MissingCapabilityException
 * }</pre>
 *
 * @param adapterId  adapter identity
 * @param version    detected backend version, {@code "unknown"} when not detected
 * @param operators  supported operators per category and kind
 * @param features   detected features
 * @param hints      how to enable a missing feature (extension name, minimum version)
 * @param maxInItems maximum number of items in a list-valued operator
 * @since 1.0.0
 */
public record AdapterCapabilities(
        String adapterId,
        String version,
        Map<OperatorCategory, Map<FieldKind, Set<Operator>>> operators,
        Set<Feature> features,
        Map<Feature, String> hints,
        int maxInItems
) {

    /** Value of {@link #maxInItems()} for backends without a list size limit. */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public AdapterCapabilities {
        Objects.requireNonNull(adapterId, "adapterId");
        version = version == null ? "unknown" : version;
        Map<OperatorCategory, Map<FieldKind, Set<Operator>>> copy = new EnumMap<>(OperatorCategory.class);
        operators.forEach((category, byKind) -> {
            Map<FieldKind, Set<Operator>> kinds = new EnumMap<>(FieldKind.class);
            byKind.forEach((kind, ops) -> kinds.put(kind, Collections.unmodifiableSet(new LinkedHashSet<>(ops))));
            copy.put(category, Collections.unmodifiableMap(kinds));
        });
        operators = Collections.unmodifiableMap(copy);
        features = features.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Feature.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(features));
        hints = hints.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(hints));
        if (maxInItems <= 0) {
            throw new IllegalArgumentException("maxInItems must be positive, got: " + maxInItems);
        }
    }

    public static Builder builder(String adapterId) {
        return new Builder(adapterId);
    }

    /**
     * @param category operator category of the field
     * @param kind     kind of the field
     * @return operators offered for this pair, empty if none
     */
    public Set<Operator> supportedOperators(OperatorCategory category, FieldKind kind) {
        Map<FieldKind, Set<Operator>> byKind = operators.get(category);
        if (byKind == null) {
            return Set.of();
        }
        return byKind.getOrDefault(kind, Set.of());
    }

    public boolean supports(OperatorCategory category, FieldKind kind, Operator operator) {
        return supportedOperators(category, kind).contains(operator);
    }

    public boolean supports(Feature feature) {
        return features.contains(feature);
    }

    /**
     * Asserts that a feature is available.
     *
     * @param feature required feature
     * @throws MissingCapabilityException if the feature was not detected
     */
    public void require(Feature feature) {
        if (!supports(feature)) {
            throw new MissingCapabilityException(adapterId, feature, hints.getOrDefault(feature, ""));
        }
    }

    /**
     * Renders a human-readable report of the capabilities, one section per part.
     *
     * @return multi-line report
     */
    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append("Adapter: ").append(adapterId).append(" (version ").append(version).append(")\n");
        sb.append("Features:\n");
        for (Feature feature : Feature.values()) {
            boolean on = features.contains(feature);
            sb.append("  ").append(on ? "[x] " : "[ ] ").append(feature.description());
            if (!on && hints.containsKey(feature)) {
                sb.append(" (").append(hints.get(feature)).append(')');
            }
            sb.append('\n');
        }
        sb.append("Operators:\n");
        operators.forEach((category, byKind) -> {
            Set<Operator> all = new LinkedHashSet<>();
            byKind.values().forEach(all::addAll);
            sb.append("  ").append(category).append(": ")
                    .append(all.stream().map(Operator::symbol).collect(Collectors.joining(" ")))
                    .append('\n');
        });
        sb.append("Limits:\n");
        sb.append("  maxInItems: ").append(maxInItems == UNLIMITED ? "unlimited" : String.valueOf(maxInItems));
        return sb.toString();
    }

    public static final class Builder {
        private final String adapterId;
        private String version;
        private final Map<OperatorCategory, Map<FieldKind, Set<Operator>>> operators = new EnumMap<>(OperatorCategory.class);
        private final Set<Feature> features = EnumSet.noneOf(Feature.class);
        private final Map<Feature, String> hints = new EnumMap<>(Feature.class);
        private int maxInItems = UNLIMITED;

        private Builder(String adapterId) {
            this.adapterId = adapterId;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Adds operators for a category on the given kinds. Repeated calls accumulate.
         */
        public Builder operators(OperatorCategory category, Set<? extends Operator> ops, FieldKind... kinds) {
            Map<FieldKind, Set<Operator>> byKind = operators.computeIfAbsent(category, c -> new EnumMap<>(FieldKind.class));
            for (FieldKind kind : kinds) {
                Set<Operator> target = byKind.computeIfAbsent(kind, k -> new LinkedHashSet<>());
                for (Operator op : ops) {
                    if (op.category() != category) {
                        throw new IllegalArgumentException(op.symbol() + " does not belong to " + category);
                    }
                    target.add(op);
                }
            }
            return this;
        }

        public Builder feature(Feature feature) {
            features.add(feature);
            return this;
        }

        /**
         * Adds the feature when {@code detected}, otherwise records a hint explaining how to get it.
         */
        public Builder feature(Feature feature, boolean detected, String hintWhenMissing) {
            if (detected) {
                features.add(feature);
            } else if (hintWhenMissing != null) {
                hints.put(feature, hintWhenMissing);
            }
            return this;
        }

        public boolean has(Feature feature) {
            return features.contains(feature);
        }

        public Builder maxInItems(int maxInItems) {
            this.maxInItems = maxInItems;
            return this;
        }

        public AdapterCapabilities build() {
            return new AdapterCapabilities(adapterId, version, operators, features, hints, maxInItems);
        }
    }
}
