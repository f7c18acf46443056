package me.wargame.mcp.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.wargame.mcp.domain.component.ToolComponent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed access to loosely-typed tool parameters. Invalid values raise
 * {@link IllegalArgumentException}, which tools report as invalid arguments.
 */
final class ToolArguments {

    private final Map<String, Object> parameters;

    ToolArguments(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : Map.of();
    }

    String optionalString(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(name + " must be a string");
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    String requiredString(String name) {
        String value = optionalString(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }

    int integer(String name, int fallback) {
        Integer value = optionalInteger(name);
        return value != null ? value : fallback;
    }

    int requiredInteger(String name) {
        Integer value = optionalInteger(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }

    double number(String name, double fallback) {
        Object value = parameters.get(name);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be a number", e);
            }
        }
        throw new IllegalArgumentException(name + " must be a number");
    }

    /**
     * Accepts a JSON array of strings or a single comma-separated string.
     *
     * @return null when absent
     */
    List<String> stringList(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        List<String> items = new ArrayList<>();
        if (value instanceof Collection<?> raw) {
            for (Object entry : raw) {
                if (!(entry instanceof String text)) {
                    throw new IllegalArgumentException(name + " must contain strings only");
                }
                if (!text.isBlank()) {
                    items.add(text.trim());
                }
            }
            return items;
        }
        if (value instanceof String text) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
            return items;
        }
        throw new IllegalArgumentException(name + " must be an array of strings");
    }

    String correlationId() {
        Object value = parameters.get(ToolComponent.PARAM_CORRELATION_ID);
        return value instanceof String text && !text.isBlank() ? text : null;
    }

    private Integer optionalInteger(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long l) {
            if (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) {
                throw new IllegalArgumentException(name + " is out of range");
            }
            return l.intValue();
        }
        if (value instanceof Number n) {
            if (n.doubleValue() != Math.rint(n.doubleValue())) {
                throw new IllegalArgumentException(name + " must be an integer");
            }
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer", e);
            }
        }
        throw new IllegalArgumentException(name + " must be an integer");
    }
}
