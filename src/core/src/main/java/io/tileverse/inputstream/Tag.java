/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.inputstream;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An immutable metadata snapshot handed from the I/O thread to the consumer
 * through {@link MediaInput#readTag()}.
 *
 * @param items the tag items, in the order the backend reported them
 */
public record Tag(List<Item> items) {

    /**
     * A single tag value.
     *
     * @param type the kind of value
     * @param value the value
     */
    public record Item(TagType type, String value) {
        /**
         * Compact constructor validating the item.
         *
         * @param type the kind of value
         * @param value the value
         */
        public Item {
            requireNonNull(type, "type cannot be null");
            requireNonNull(value, "value cannot be null");
        }
    }

    /**
     * Compact constructor taking a defensive copy of the items.
     *
     * @param items the tag items
     */
    public Tag {
        items = List.copyOf(requireNonNull(items, "items cannot be null"));
    }

    /**
     * Returns the first value of the given type.
     *
     * @param type the kind of value to look up
     * @return the first matching value, or empty
     */
    public Optional<String> get(TagType type) {
        return items.stream()
                .filter(i -> i.type() == type)
                .map(Item::value)
                .findFirst();
    }

    /**
     * @return {@code true} if this tag has no items
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Tag}.
     */
    public static class Builder {
        private final List<Item> items = new ArrayList<>();

        private Builder() {}

        /**
         * Adds an item.
         *
         * @param type the kind of value
         * @param value the value
         * @return this builder
         */
        public Builder add(TagType type, String value) {
            items.add(new Item(type, value));
            return this;
        }

        /**
         * @return the tag
         */
        public Tag build() {
            return new Tag(items);
        }
    }
}
