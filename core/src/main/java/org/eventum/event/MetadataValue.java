/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventum.event;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A loosely typed value in the metadata of an {@link Event}. A value is either a string, a number, a boolean
 * or a nested map of values.
 */
public sealed interface MetadataValue {

    static MetadataValue of(String value) {
        return new StringValue(value);
    }

    static MetadataValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue of(double value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue of(BigDecimal value) {
        return new NumberValue(value);
    }

    static MetadataValue of(boolean value) {
        return new BooleanValue(value);
    }

    static MetadataValue of(Map<String, MetadataValue> value) {
        return new MapValue(value);
    }

    record StringValue(String value) implements MetadataValue {
        public StringValue {
            requireNonNull(value, "String value cannot be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * A number. The value is stored without trailing zeros so that {@code 1.50} and {@code 1.5} are equal.
     */
    record NumberValue(BigDecimal value) implements MetadataValue {
        public NumberValue {
            requireNonNull(value, "Number value cannot be null");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record BooleanValue(boolean value) implements MetadataValue {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record MapValue(Map<String, MetadataValue> value) implements MetadataValue {
        public MapValue {
            requireNonNull(value, "Map value cannot be null");
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
