/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.config;

import java.util.Properties;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.changestage.annotation.Immutable;

/**
 * A snapshot of string settings read through {@link Field} definitions. A key the snapshot lacks, or a value
 * that does not parse, falls back to the field's default.
 */
@Immutable
public final class Configuration {

    private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

    /**
     * Collects settings for a new {@link Configuration}.
     */
    public static final class Builder {
        private final Properties props = new Properties();

        private Builder() {
        }

        /**
         * Set the value of the field, or unset it if the value is null.
         */
        public Builder with(Field field, String value) {
            if (value == null) {
                props.remove(field.name());
            }
            else {
                props.setProperty(field.name(), value);
            }
            return this;
        }

        public Builder with(Field field, long value) {
            return with(field, Long.toString(value));
        }

        public Builder with(Field field, boolean value) {
            return with(field, Boolean.toString(value));
        }

        public Configuration build() {
            return from(props);
        }
    }

    public static Builder create() {
        return new Builder();
    }

    /**
     * Take a copy of the given properties; later changes to them are not seen.
     *
     * @param properties the settings; may be null
     */
    public static Configuration from(Properties properties) {
        Properties copy = new Properties();
        if (properties != null) {
            copy.putAll(properties);
        }
        return new Configuration(copy);
    }

    private final Properties props;

    private Configuration(Properties props) {
        this.props = props;
    }

    /**
     * @return the value of the field, its default if unset, or null if it has neither
     */
    public String getString(Field field) {
        String value = props.getProperty(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    /**
     * @throws NumberFormatException if neither the value nor the default of the field is a long
     */
    public long getLong(Field field) {
        String value = props.getProperty(field.name());
        if (value != null) {
            Long parsed = Field.parseLong(value);
            if (parsed != null) {
                return parsed;
            }
            LOGGER.warn("Value '{}' of '{}' is not a long, using the default {} instead", value, field, field.defaultValueAsString());
        }
        return Long.parseLong(field.defaultValueAsString());
    }

    public boolean getBoolean(Field field) {
        String value = props.getProperty(field.name());
        if (value != null) {
            String trimmed = value.trim();
            if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
                return Boolean.parseBoolean(trimmed);
            }
            LOGGER.warn("Value '{}' of '{}' is not a boolean, using the default {} instead", value, field, field.defaultValueAsString());
        }
        return Boolean.parseBoolean(field.defaultValueAsString());
    }

    /**
     * Validate the given fields, passing one readable message per problem to {@code problems}.
     *
     * @return {@code true} if every field is valid
     */
    public boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        boolean valid = true;
        for (Field field : fields) {
            valid &= field.validate(this, (f, value, problem) -> problems.accept(value == null
                    ? "The '" + f.name() + "' value is invalid: " + problem
                    : "The '" + f.name() + "' value '" + value + "' is invalid: " + problem));
        }
        return valid;
    }

    @Override
    public String toString() {
        return props.toString();
    }
}
