package com.feedrelay.subscription;

import com.feedrelay.domain.model.DataRecord;
import com.feedrelay.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches data records against a subscription's filter map.
 *
 * <p>Every entry must match (AND). An entry's value is either a scalar, compared for equality,
 * or a list of scalars, of which any one may match. Numbers compare numerically, so {@code 3}
 * and {@code 3.0} are equal; everything else compares by string form. A key naming a field the
 * record does not have never matches. An empty or absent map matches every record.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class RecordFilter {

    private static final Logger log = LoggerFactory.getLogger(RecordFilter.class);

    private static final Map<String, Function<DataRecord, Object>> FIELDS = Map.of(
            "id", DataRecord::getId,
            "type", DataRecord::getType,
            "symbol", DataRecord::getSymbol,
            "source", DataRecord::getSource,
            "status", DataRecord::getStatus,
            "strategy_id", DataRecord::getScopeId,
            "scope_id", DataRecord::getScopeId);

    public boolean matches(Map<String, Object> filters, DataRecord dataRecord) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            Function<DataRecord, Object> accessor = FIELDS.get(entry.getKey());
            if (accessor == null) {
                return false;
            }
            if (!valueMatches(entry.getValue(), accessor.apply(dataRecord))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks the structure of a filter map before it is stored.
     *
     * <p>Keys the record model does not know are accepted (they simply never match) but logged.
     *
     * @throws ValidationException for blank keys, nested maps, empty lists or lists holding
     *     non-scalar values
     */
    public void validate(Map<String, Object> filters) {
        if (filters == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null || key.isBlank()) {
                throw new ValidationException("Filter keys must not be blank");
            }
            if (value instanceof Map<?, ?>) {
                throw new ValidationException(
                        "Filter '" + key + "' must be a scalar or a list of scalars", Map.of("field", key));
            }
            if (value instanceof Collection<?> values) {
                if (values.isEmpty()) {
                    throw new ValidationException("Filter '" + key + "' must not be an empty list", Map.of("field", key));
                }
                for (Object member : values) {
                    if (!isScalar(member)) {
                        throw new ValidationException(
                                "Filter '" + key + "' list may only contain scalars", Map.of("field", key));
                    }
                }
            } else if (!isScalar(value)) {
                throw new ValidationException(
                        "Filter '" + key + "' must be a scalar or a list of scalars", Map.of("field", key));
            }
            if (!FIELDS.containsKey(key)) {
                log.warn("Filter key '{}' is not a record field; it will never match", key);
            }
        }
    }

    private static boolean valueMatches(Object expected, Object actual) {
        if (actual == null) {
            return false;
        }
        if (expected instanceof List<?> accepted) {
            return accepted.stream().anyMatch(candidate -> scalarEquals(candidate, actual));
        }
        return scalarEquals(expected, actual);
    }

    private static boolean scalarEquals(Object expected, Object actual) {
        if (expected == null) {
            return false;
        }
        if (expected instanceof Number || actual instanceof Number) {
            BigDecimal left = toDecimal(expected);
            BigDecimal right = toDecimal(actual);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
        }
        return String.valueOf(expected).equals(String.valueOf(actual));
    }

    private static BigDecimal toDecimal(Object value) {
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
