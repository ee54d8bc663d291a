package com.questrail.harness.capability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CapabilityLayer
 * =============================================================================
 * One layer of a test type's static declaration: the checkitems, arguments and
 * extra-info keys it adds, the lifecycle flags and deadlines it sets, and the
 * layers it builds on.
 *
 * <h2>Composition</h2>
 * A test type never inherits declarations implicitly. It names the layers it
 * builds on with {@link Builder#includes(CapabilityLayer...)} and the merge is
 * computed once, by {@link CapabilityDescriptor#resolve(CapabilityLayer)}, when
 * the type is registered.
 *
 * <p>Flags and deadlines are nullable here: {@code null} means "not declared by
 * this layer" and the value is taken from an included layer.</p>
 */
public record CapabilityLayer(
        String name,
        String description,
        List<CapabilityLayer> includes,
        Map<String, CheckItemSpec> checkItems,
        Map<String, ArgumentSpec> arguments,
        Map<String, String> extraInfos,
        Boolean asyncSetup,
        Boolean asyncTest,
        Duration testTimeout,
        Duration asyncSetupTimeout
) {
    public CapabilityLayer {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        includes = List.copyOf(includes);
        checkItems = Collections.unmodifiableMap(new LinkedHashMap<>(checkItems));
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        extraInfos = Collections.unmodifiableMap(new LinkedHashMap<>(extraInfos));

        checkItems.keySet().forEach(k -> Labels.require(k, "checkitem"));
        arguments.keySet().forEach(k -> Labels.require(k, "argument"));
        extraInfos.keySet().forEach(k -> Labels.require(k, "extra-info"));

        if (testTimeout != null && (testTimeout.isNegative() || testTimeout.isZero())) {
            throw new IllegalArgumentException("testTimeout must be positive");
        }
        if (asyncSetupTimeout != null && (asyncSetupTimeout.isNegative() || asyncSetupTimeout.isZero())) {
            throw new IllegalArgumentException("asyncSetupTimeout must be positive");
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private final List<CapabilityLayer> includes = new ArrayList<>();
        private final Map<String, CheckItemSpec> checkItems = new LinkedHashMap<>();
        private final Map<String, ArgumentSpec> arguments = new LinkedHashMap<>();
        private final Map<String, String> extraInfos = new LinkedHashMap<>();
        private Boolean asyncSetup;
        private Boolean asyncTest;
        private Duration testTimeout;
        private Duration asyncSetupTimeout;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        public Builder includes(CapabilityLayer... layers) {
            for (CapabilityLayer layer : layers) {
                includes.add(Objects.requireNonNull(layer, "layer"));
            }
            return this;
        }

        public Builder checkItem(String name, String description) {
            return checkItem(name, description, null);
        }

        public Builder checkItem(String name, String description, String likelyError) {
            checkItems.put(name, new CheckItemSpec(description, likelyError));
            return this;
        }

        public Builder argument(String name, String description) {
            return argument(name, description, null);
        }

        public Builder argument(String name, String description, Object defaultValue) {
            arguments.put(name, new ArgumentSpec(description, defaultValue));
            return this;
        }

        public Builder extraInfo(String name, String description) {
            extraInfos.put(name, Objects.requireNonNull(description, "description"));
            return this;
        }

        public Builder asyncSetup(boolean asyncSetup) {
            this.asyncSetup = asyncSetup;
            return this;
        }

        public Builder asyncTest(boolean asyncTest) {
            this.asyncTest = asyncTest;
            return this;
        }

        public Builder testTimeout(Duration timeout) {
            this.testTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder asyncSetupTimeout(Duration timeout) {
            this.asyncSetupTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public CapabilityLayer build() {
            return new CapabilityLayer(name, description, includes, checkItems, arguments, extraInfos,
                    asyncSetup, asyncTest, testTimeout, asyncSetupTimeout);
        }
    }
}
