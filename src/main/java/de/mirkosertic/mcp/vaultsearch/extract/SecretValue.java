package de.mirkosertic.mcp.vaultsearch.extract;

import java.util.List;
import java.util.Map;

/**
 * Decoded value of a secret field. Secret payloads are arbitrary nested documents,
 * so every node is one of a fixed set of variants.
 */
public sealed interface SecretValue permits SecretValue.Text, SecretValue.Numeric, SecretValue.Bool,
        SecretValue.Null, SecretValue.ListValue, SecretValue.MapValue {

    record Text(String value) implements SecretValue {
    }

    record Numeric(java.lang.Number value) implements SecretValue {
    }

    record Bool(boolean value) implements SecretValue {
    }

    record Null() implements SecretValue {
        public static final Null INSTANCE = new Null();
    }

    record ListValue(List<SecretValue> elements) implements SecretValue {
        public ListValue {
            elements = List.copyOf(elements);
        }
    }

    /**
     * String-keyed map. Entries keep their insertion order.
     */
    record MapValue(Map<String, SecretValue> entries) implements SecretValue {
        public MapValue {
            entries = java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(entries));
        }
    }
}
