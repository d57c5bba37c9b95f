/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.changestage.annotation.Immutable;

/**
 * The definition of one cache setting: its key, its Kafka {@link ConfigDef} metadata, its default and the
 * checks its value must pass. Every {@code with...} method returns a modified copy.
 */
@Immutable
public final class Field {

    /**
     * Checks the value a {@link Configuration} holds for a field.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * @return the number of problems reported to {@code problems}, 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);
    }

    /**
     * Receives the problems found while validating.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        void accept(Field field, String value, String problemMessage);
    }

    /**
     * An ordered group of fields, validated together.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final List<Field> fields;

        private Set(List<Field> fields) {
            this.fields = fields;
        }

        @Override
        public Iterator<Field> iterator() {
            return fields.iterator();
        }
    }

    public static Set setOf(Field... fields) {
        return new Set(Collections.unmodifiableList(Arrays.asList(fields.clone())));
    }

    public static Field create(String name) {
        return new Field(name, null, null, Type.STRING, Width.NONE, Importance.MEDIUM, null, null);
    }

    /**
     * Define the given fields in a Kafka configuration definition, in the given order and under one group.
     *
     * @return the supplied definition
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        int orderInGroup = 0;
        for (Field field : fields) {
            configDef.define(field.name, field.type, field.defaultValue, null, field.importance, field.description,
                    groupName, ++orderInGroup, field.width, field.displayName, Collections.emptyList(), null);
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Width width;
    private final Importance importance;
    private final Object defaultValue;
    private final Validator validator;

    private Field(String name, String displayName, String description, Type type, Width width, Importance importance,
                  Object defaultValue, Validator validator) {
        this.name = Objects.requireNonNull(name, "The field name may not be null");
        this.displayName = displayName;
        this.description = description;
        this.type = type;
        this.width = width;
        this.importance = importance;
        this.defaultValue = defaultValue;
        this.validator = validator;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Type type() {
        return type;
    }

    /**
     * @return the default value as a string, or null if the field has none
     */
    public String defaultValueAsString() {
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDefault(long defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    public Field withDefault(boolean defaultValue) {
        return new Field(name, displayName, description, type, width, importance, defaultValue, validator);
    }

    /**
     * Add a check that runs after the checks this field already has.
     */
    public Field withValidation(Validator check) {
        Validator previous = validator;
        Validator combined = previous == null ? check
                : (config, field, problems) -> previous.validate(config, field, problems) + check.validate(config, field, problems);
        return new Field(name, displayName, description, type, width, importance, defaultValue, combined);
    }

    public Field required() {
        return withValidation(Field::isRequired);
    }

    /**
     * Check the value of this field against its type and its own checks. A value of the wrong type is reported
     * once and skips the remaining checks.
     *
     * @return {@code true} if no problem was reported
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        int errors = 0;
        if (type == Type.LONG) {
            errors = isLong(config, this, problems);
        }
        else if (type == Type.BOOLEAN) {
            errors = isBoolean(config, this, problems);
        }
        if (errors == 0 && validator != null) {
            errors = validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || value.trim().isEmpty()) {
            problems.accept(field, value, "A value is required");
            return 1;
        }
        return 0;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || "true".equalsIgnoreCase(value.trim()) || "false".equalsIgnoreCase(value.trim())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    public static int isLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || parseLong(value) != null) {
            return 0;
        }
        problems.accept(field, value, "A long value is expected");
        return 1;
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        Long parsed = parseLong(value);
        if (parsed != null && parsed > 0) {
            return 0;
        }
        problems.accept(field, value, "A positive, non-zero long value is expected");
        return 1;
    }

    /**
     * @return the parsed value, or null if the string is not a long
     */
    static Long parseLong(String value) {
        try {
            return Long.valueOf(value.trim());
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        return obj instanceof Field && name.equals(((Field) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
