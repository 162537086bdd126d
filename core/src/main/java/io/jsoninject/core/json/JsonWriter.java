package io.jsoninject.core.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Objects;

/**
 * Incremental JSON builder used as the capture sink for procedural sources and for serializing
 * query rows. Backed by a Jackson {@link JsonGenerator} writing into memory.
 *
 * <p>Calls mirror the structure being built: {@code openObject()}, {@code write("k", "v")},
 * {@code closeObject()} produces {@code {"k":"v"}}. Misuse (closing the wrong container, writing a
 * property outside an object) raises {@link IllegalStateException}.
 *
 * <p>String values and property names are written HTML-safe (see {@link HtmlSafeCharacterEscapes});
 * {@link #writeRaw} content is embedded as given.
 *
 * <p>Not thread-safe. One instance captures one payload and must be closed afterwards.
 */
public final class JsonWriter implements AutoCloseable {

    // unclosed containers must stay visible to isBalanced()
    private static final JsonFactory FACTORY = new JsonFactoryBuilder()
            .disable(StreamWriteFeature.AUTO_CLOSE_CONTENT)
            .build();

    private final StringWriter buffer = new StringWriter();
    private final JsonGenerator generator;
    private final NullPolicy nullPolicy;
    private boolean closed;

    private JsonWriter(NullPolicy nullPolicy) {
        this.nullPolicy = Objects.requireNonNull(nullPolicy, "nullPolicy must not be null");
        try {
            this.generator = FACTORY.createGenerator(buffer);
            this.generator.setCharacterEscapes(HtmlSafeCharacterEscapes.INSTANCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create JSON generator", e);
        }
    }

    /** Creates an empty writer rendering nulls according to {@code nullPolicy}. */
    public static JsonWriter create(NullPolicy nullPolicy) {
        return new JsonWriter(nullPolicy);
    }

    /** Creates an empty writer rendering nulls as JSON {@code null}. */
    public static JsonWriter create() {
        return new JsonWriter(NullPolicy.JSON_NULL);
    }

    // Containers

    /** Opens an anonymous object (root value or array element). */
    public JsonWriter openObject() {
        return run(generator::writeStartObject);
    }

    /** Opens an object as the value of property {@code name}. */
    public JsonWriter openObject(String name) {
        return run(() -> {
            generator.writeFieldName(name);
            generator.writeStartObject();
        });
    }

    /** Closes the innermost object. */
    public JsonWriter closeObject() {
        return run(generator::writeEndObject);
    }

    /** Opens an anonymous array (root value or array element). */
    public JsonWriter openArray() {
        return run(generator::writeStartArray);
    }

    /** Opens an array as the value of property {@code name}. */
    public JsonWriter openArray(String name) {
        return run(() -> {
            generator.writeFieldName(name);
            generator.writeStartArray();
        });
    }

    /** Closes the innermost array. */
    public JsonWriter closeArray() {
        return run(generator::writeEndArray);
    }

    // Properties

    /** Writes a string property; {@code null} follows the null policy. */
    public JsonWriter write(String name, String value) {
        return writeValue(name, value);
    }

    /** Writes a numeric property; {@code null} follows the null policy. */
    public JsonWriter write(String name, Number value) {
        return writeValue(name, value);
    }

    /** Writes a boolean property. */
    public JsonWriter write(String name, boolean value) {
        return run(() -> generator.writeBooleanField(name, value));
    }

    /** Writes a property whose value follows the null policy. */
    public JsonWriter writeNull(String name) {
        return writeValue(name, null);
    }

    /**
     * Writes a property holding already-serialized JSON, embedded without escaping.
     *
     * @param name property name
     * @param json a complete JSON value (object, array or scalar)
     */
    public JsonWriter writeRaw(String name, String json) {
        return run(() -> {
            generator.writeFieldName(name);
            generator.writeRawValue(json);
        });
    }

    /**
     * Writes a property of any supported Java type. Numbers and booleans keep their JSON type,
     * temporal values are written as ISO-8601 text, {@code byte[]} as base64, anything else via
     * {@link Object#toString()}.
     */
    public JsonWriter writeValue(String name, Object value) {
        return run(() -> {
            generator.writeFieldName(name);
            writeScalar(value);
        });
    }

    // Array elements

    /** Writes a string array element; {@code null} follows the null policy. */
    public JsonWriter value(String value) {
        return value((Object) value);
    }

    /** Writes a numeric array element. */
    public JsonWriter value(Number value) {
        return value((Object) value);
    }

    /** Writes a boolean array element. */
    public JsonWriter value(boolean value) {
        return run(() -> generator.writeBoolean(value));
    }

    /** Writes an array element of any supported Java type (see {@link #writeValue}). */
    public JsonWriter value(Object value) {
        return run(() -> writeScalar(value));
    }

    /** Writes an array element following the null policy. */
    public JsonWriter nullValue() {
        return value((Object) null);
    }

    // Capture

    /** True once {@link #close()} has been called. */
    public boolean isClosed() {
        return closed;
    }

    /** True when no container is left open. */
    public boolean isBalanced() {
        return generator.getOutputContext().inRoot();
    }

    /** Number of complete or started root-level values written so far. */
    public int rootValueCount() {
        JsonStreamContext context = generator.getOutputContext();
        while (!context.inRoot()) {
            context = context.getParent();
        }
        return context.getEntryCount();
    }

    /** Flushes and returns everything written so far. */
    public String toJson() {
        run(generator::flush);
        return buffer.toString();
    }

    /** Releases the generator; the captured text is discarded. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            generator.close();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to release JSON generator", e);
        } finally {
            buffer.getBuffer().setLength(0);
        }
    }

    private void writeScalar(Object value) throws IOException {
        if (value == null) {
            if (nullPolicy == NullPolicy.EMPTY_STRING) {
                generator.writeString("");
            } else {
                generator.writeNull();
            }
        } else if (value instanceof CharSequence text) {
            generator.writeString(text.toString());
        } else if (value instanceof Boolean bool) {
            generator.writeBoolean(bool);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            generator.writeNumber(((Number) value).longValue());
        } else if (value instanceof BigDecimal decimal) {
            generator.writeNumber(decimal);
        } else if (value instanceof BigInteger integer) {
            generator.writeNumber(integer);
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            // JSON has no NaN/Infinity
            if (Double.isFinite(d)) {
                generator.writeNumber(d);
            } else {
                generator.writeString(Double.toString(d));
            }
        } else if (value instanceof Number number) {
            generator.writeNumber(number.toString());
        } else if (value instanceof java.sql.Timestamp timestamp) {
            generator.writeString(timestamp.toLocalDateTime().toString());
        } else if (value instanceof java.sql.Date date) {
            generator.writeString(date.toLocalDate().toString());
        } else if (value instanceof java.sql.Time time) {
            generator.writeString(time.toLocalTime().toString());
        } else if (value instanceof Date date) {
            generator.writeString(date.toInstant().toString());
        } else if (value instanceof TemporalAccessor temporal) {
            generator.writeString(temporal.toString());
        } else if (value instanceof byte[] bytes) {
            generator.writeBinary(bytes);
        } else if (value instanceof Character c) {
            generator.writeString(c.toString());
        } else if (value instanceof Enum<?> e) {
            generator.writeString(e.name());
        } else {
            generator.writeString(value.toString());
        }
    }

    private JsonWriter run(IoAction action) {
        if (closed) {
            throw new IllegalStateException("JsonWriter is closed");
        }
        try {
            action.run();
        } catch (IOException e) {
            throw new IllegalStateException("Invalid JSON write: " + e.getMessage(), e);
        }
        return this;
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}
