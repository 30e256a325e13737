package com.gridvault.core.event;

import com.gridvault.core.model.Address;

import java.math.BigInteger;
import java.util.Map;

/**
 * Event emitted by a vault. Fields keep their emission order.
 */
public record LedgerEvent(
        LedgerEventType type,
        Address emitter,
        long timestamp,
        Map<String, Object> fields
) {
    public LedgerEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (emitter == null) {
            throw new IllegalArgumentException("Emitter cannot be null");
        }
        fields = fields == null ? Map.of() : fields;
    }

    public Object get(String field) {
        if (!fields.containsKey(field)) {
            throw new IllegalArgumentException("Event " + type.eventName() + " has no field " + field);
        }
        return fields.get(field);
    }

    public BigInteger uint(String field) {
        return (BigInteger) get(field);
    }

    public Address address(String field) {
        return (Address) get(field);
    }
}
