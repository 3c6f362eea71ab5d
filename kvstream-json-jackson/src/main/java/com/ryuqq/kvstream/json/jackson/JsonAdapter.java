package com.ryuqq.kvstream.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.kvstream.core.adapter.ValueAdapter;
import com.ryuqq.kvstream.core.spi.KeyValueStore;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Value adapter storing objects as JSON strings through Jackson.
 *
 * <p>By default values are bound with the {@link ObjectMapper} directly. For types Jackson cannot
 * bind on its own, a {@link #withSerializer(Function) serializer} maps the value to a
 * JSON-friendly object before encoding, and a {@link #withDeserializer(Function) deserializer}
 * rebuilds the value from the decoded tree.</p>
 *
 * <p><strong>Behaviour:</strong></p>
 * <ul>
 *   <li>Absent key: read returns {@code null}, so the observable substitutes its default</li>
 *   <li>Malformed stored JSON: read throws {@link JsonAdapterException}</li>
 *   <li>Unserializable value: write throws {@link JsonAdapterException} before any store I/O</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ValueAdapter&lt;Settings&gt; adapter = JsonAdapter.of(Settings.class);
 *
 * ValueAdapter&lt;List&lt;Bookmark&gt;&gt; bookmarks = JsonAdapter.of(new TypeReference&lt;List&lt;Bookmark&gt;&gt;() { });
 *
 * ValueAdapter&lt;Money&gt; money = JsonAdapter.of(Money.class)
 *     .withSerializer(m -&gt; m.toPlainString())
 *     .withDeserializer(node -&gt; Money.parse(node.asText()));
 * </pre>
 *
 * <p>Two adapters are equal when they bind the same type with the same hooks, which keeps
 * {@code ObservableValue} equality meaningful for JSON-backed values.</p>
 *
 * @param <T> value type
 * @author KvStream Team
 * @since 1.0.0
 */
public final class JsonAdapter<T> implements ValueAdapter<T> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private final ObjectMapper mapper;
    private final JavaType type;
    private final Function<? super T, ?> serializer;
    private final Function<? super JsonNode, ? extends T> deserializer;

    private JsonAdapter(ObjectMapper mapper, JavaType type,
                        Function<? super T, ?> serializer,
                        Function<? super JsonNode, ? extends T> deserializer) {
        this.mapper = mapper;
        this.type = type;
        this.serializer = serializer;
        this.deserializer = deserializer;
    }

    /**
     * Creates an adapter binding the given class with a shared default mapper.
     *
     * @param type value class
     * @return adapter
     * @throws IllegalArgumentException if type is null
     */
    public static <T> JsonAdapter<T> of(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new JsonAdapter<>(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(type), null, null);
    }

    /**
     * Creates an adapter binding a generic type with a shared default mapper.
     *
     * @param type value type reference
     * @return adapter
     * @throws IllegalArgumentException if type is null
     */
    public static <T> JsonAdapter<T> of(TypeReference<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new JsonAdapter<>(DEFAULT_MAPPER, DEFAULT_MAPPER.constructType(type), null, null);
    }

    /**
     * Returns a copy using the given mapper.
     */
    public JsonAdapter<T> withMapper(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return new JsonAdapter<>(mapper, type, serializer, deserializer);
    }

    /**
     * Returns a copy that maps values before JSON encoding.
     */
    public JsonAdapter<T> withSerializer(Function<? super T, ?> serializer) {
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        return new JsonAdapter<>(mapper, type, serializer, deserializer);
    }

    /**
     * Returns a copy that rebuilds values from the decoded JSON tree.
     */
    public JsonAdapter<T> withDeserializer(Function<? super JsonNode, ? extends T> deserializer) {
        if (deserializer == null) {
            throw new IllegalArgumentException("deserializer cannot be null");
        }
        return new JsonAdapter<>(mapper, type, serializer, deserializer);
    }

    @Override
    public T read(KeyValueStore store, String key) {
        String json = store.getString(key);
        if (json == null) {
            return null;
        }
        try {
            if (deserializer != null) {
                return deserializer.apply(mapper.readTree(json));
            }
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JsonAdapterException(
                "Failed to deserialize value of key '" + key + "' to " + type.toCanonical(), e);
        }
    }

    @Override
    public CompletableFuture<Boolean> write(KeyValueStore store, String key, T value) {
        Object payload = serializer != null ? serializer.apply(value) : value;
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new JsonAdapterException(
                "Failed to serialize value of key '" + key + "' from " + type.toCanonical(), e);
        }
        return store.setString(key, json);
    }

    @Override
    public Class<?> valueType() {
        return type.getRawClass();
    }

    /**
     * Returns the Jackson type this adapter binds.
     */
    public JavaType javaType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JsonAdapter<?> that = (JsonAdapter<?>) o;
        return type.equals(that.type)
            && mapper == that.mapper
            && serializer == that.serializer
            && deserializer == that.deserializer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, System.identityHashCode(mapper),
            System.identityHashCode(serializer), System.identityHashCode(deserializer));
    }

    @Override
    public String toString() {
        return "JsonAdapter{" + type.toCanonical() + '}';
    }
}
