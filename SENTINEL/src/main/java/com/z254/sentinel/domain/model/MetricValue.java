package com.z254.sentinel.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Current value of a metric. Most metrics are numeric, but health-style metrics
 * report string states such as {@code "unhealthy"}.
 */
@JsonDeserialize(using = MetricValue.Deserializer.class)
public sealed interface MetricValue permits MetricValue.NumericValue, MetricValue.StringValue {

    static MetricValue of(double value) {
        return new NumericValue(value);
    }

    static MetricValue of(String value) {
        return new StringValue(value);
    }

    /**
     * Raw value as written on the wire.
     */
    @JsonValue
    Object raw();

    /**
     * String form used by the text operators.
     */
    String asText();

    record NumericValue(double value) implements MetricValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asText() {
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
    }

    record StringValue(String value) implements MetricValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    class Deserializer extends StdDeserializer<MetricValue> {

        public Deserializer() {
            super(MetricValue.class);
        }

        @Override
        public MetricValue deserialize(JsonParser parser, DeserializationContext ctx) throws IOException {
            JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                return new NumericValue(parser.getDoubleValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                return new StringValue(parser.getText());
            }
            return (MetricValue) ctx.handleUnexpectedToken(MetricValue.class, parser);
        }
    }
}
