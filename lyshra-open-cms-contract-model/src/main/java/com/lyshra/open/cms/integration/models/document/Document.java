package com.lyshra.open.cms.integration.models.document;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Closed JSON-like value used for schemas and content payloads.
 *
 * <p>Every variant is immutable and compares structurally. Schema diffing, payload
 * validation and migration transforms operate on this type instead of untyped maps.</p>
 */
public sealed interface Document extends Serializable
        permits Document.NullValue, Document.BoolValue, Document.NumberValue,
                Document.StringValue, Document.ArrayValue, Document.ObjectValue {

    NullValue NULL = new NullValue();

    enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT
    }

    Kind kind();

    /**
     * Converts this document back into plain Java values
     * ({@code null}, Boolean, BigDecimal, String, List, Map).
     */
    Object toJava();

    default boolean isNull() {
        return kind() == Kind.NULL;
    }

    default boolean isObject() {
        return kind() == Kind.OBJECT;
    }

    default boolean isArray() {
        return kind() == Kind.ARRAY;
    }

    default boolean isString() {
        return kind() == Kind.STRING;
    }

    default ObjectValue asObject() {
        if (this instanceof ObjectValue objectValue) {
            return objectValue;
        }
        throw new IllegalStateException("Document is not an object but " + kind());
    }

    default ArrayValue asArray() {
        if (this instanceof ArrayValue arrayValue) {
            return arrayValue;
        }
        throw new IllegalStateException("Document is not an array but " + kind());
    }

    /**
     * @return the string value, or empty when this is not a string
     */
    default Optional<String> asText() {
        if (this instanceof StringValue stringValue) {
            return Optional.of(stringValue.value());
        }
        return Optional.empty();
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static BoolValue of(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static NumberValue of(BigDecimal value) {
        return new NumberValue(value);
    }

    static ArrayValue array(Document... items) {
        return new ArrayValue(List.of(items));
    }

    static ArrayValue arrayOfStrings(List<String> values) {
        List<Document> items = new ArrayList<>(values.size());
        for (String value : values) {
            items.add(new StringValue(value));
        }
        return new ArrayValue(items);
    }

    /**
     * Builds a document from plain Java values. Maps become objects, collections become arrays,
     * numbers become {@link NumberValue}s.
     *
     * @param value java value, may be null
     * @return equivalent document
     * @throws IllegalArgumentException for unsupported value types
     */
    static Document from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Document document) {
            return document;
        }
        if (value instanceof String string) {
            return new StringValue(string);
        }
        if (value instanceof Boolean bool) {
            return of(bool.booleanValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new NumberValue(decimal);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new NumberValue(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            return new NumberValue(new BigDecimal(number.toString()));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Document> fields = new LinkedHashMap<>();
            map.forEach((k, v) -> fields.put(String.valueOf(k), from(v)));
            return new ObjectValue(fields);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Document> items = new ArrayList<>();
            iterable.forEach(item -> items.add(from(item)));
            return new ArrayValue(items);
        }
        throw new IllegalArgumentException("Unsupported document value type: " + value.getClass().getName());
    }

    /**
     * Convenience for building object documents from a map literal.
     */
    static ObjectValue object(Map<String, ?> fields) {
        return from(fields).asObject();
    }

    record NullValue() implements Document {
        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements Document {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Numeric value. Trailing zeros are stripped so that {@code 1} and {@code 1.0} compare equal.
     */
    record NumberValue(BigDecimal value) implements Document {
        public NumberValue {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        public boolean isIntegral() {
            return value.scale() <= 0;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record StringValue(String value) implements Document {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record ArrayValue(List<Document> items) implements Document {
        public ArrayValue {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public Document get(int index) {
            return items.get(index);
        }

        public Stream<Document> stream() {
            return items.stream();
        }

        /**
         * @return the string items of this array, skipping non-string entries
         */
        public List<String> strings() {
            List<String> values = new ArrayList<>();
            for (Document item : items) {
                item.asText().ifPresent(values::add);
            }
            return values;
        }

        @Override
        public Object toJava() {
            List<Object> values = new ArrayList<>(items.size());
            for (Document item : items) {
                values.add(item.toJava());
            }
            return values;
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    /**
     * Object with insertion-ordered keys. Mutators return new instances.
     */
    record ObjectValue(Map<String, Document> fields) implements Document {

        private static final ObjectValue EMPTY = new ObjectValue(Map.of());

        public ObjectValue {
            Map<String, Document> copy = new LinkedHashMap<>();
            fields.forEach((key, value) -> copy.put(
                    Objects.requireNonNull(key, "key"),
                    value == null ? NULL : value));
            fields = Collections.unmodifiableMap(copy);
        }

        public static ObjectValue empty() {
            return EMPTY;
        }

        public static Builder builder() {
            return new Builder();
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        public Optional<Document> get(String key) {
            return Optional.ofNullable(fields.get(key));
        }

        public boolean has(String key) {
            return fields.containsKey(key);
        }

        public Set<String> keys() {
            return fields.keySet();
        }

        public int size() {
            return fields.size();
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public Optional<String> getString(String key) {
            return get(key).flatMap(Document::asText);
        }

        public Optional<ObjectValue> getObject(String key) {
            return get(key).filter(Document::isObject).map(Document::asObject);
        }

        public Optional<ArrayValue> getArray(String key) {
            return get(key).filter(Document::isArray).map(Document::asArray);
        }

        public ObjectValue with(String key, Document value) {
            Map<String, Document> copy = new LinkedHashMap<>(fields);
            copy.put(key, value);
            return new ObjectValue(copy);
        }

        public ObjectValue with(String key, String value) {
            return with(key, new StringValue(value));
        }

        public ObjectValue without(String key) {
            if (!fields.containsKey(key)) {
                return this;
            }
            Map<String, Document> copy = new LinkedHashMap<>(fields);
            copy.remove(key);
            return new ObjectValue(copy);
        }

        @Override
        public Object toJava() {
            Map<String, Object> values = new LinkedHashMap<>();
            fields.forEach((key, value) -> values.put(key, value.toJava()));
            return values;
        }

        @Override
        public String toString() {
            return fields.toString();
        }

        public static final class Builder {
            private final Map<String, Document> fields = new LinkedHashMap<>();

            private Builder() {
            }

            public Builder put(String key, Document value) {
                fields.put(key, value);
                return this;
            }

            public Builder put(String key, String value) {
                return put(key, new StringValue(value));
            }

            public Builder put(String key, boolean value) {
                return put(key, Document.of(value));
            }

            public Builder put(String key, long value) {
                return put(key, Document.of(value));
            }

            public ObjectValue build() {
                return new ObjectValue(fields);
            }
        }
    }
}
