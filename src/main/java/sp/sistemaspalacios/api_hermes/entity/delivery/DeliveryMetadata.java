package sp.sistemaspalacios.api_hermes.entity.delivery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunto clave/valor acotado para auditoría de un envío.
 */
public final class DeliveryMetadata {

    public static final int MAX_ENTRIES = 16;
    public static final int MAX_KEY_LENGTH = 64;
    public static final int MAX_VALUE_LENGTH = 512;

    private final Map<String, String> entries;

    private DeliveryMetadata(Map<String, String> entries) {
        this.entries = entries;
    }

    public static DeliveryMetadata empty() {
        return new DeliveryMetadata(new LinkedHashMap<>());
    }

    public static DeliveryMetadata of(Map<String, String> source) {
        DeliveryMetadata metadata = empty();
        if (source != null) {
            source.forEach(metadata::put);
        }
        return metadata;
    }

    public DeliveryMetadata put(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("La clave de metadata no puede estar vacía");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Clave de metadata demasiado larga: " + key);
        }
        if (value != null && value.length() > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Valor de metadata demasiado largo para la clave " + key);
        }
        if (!entries.containsKey(key) && entries.size() >= MAX_ENTRIES) {
            throw new IllegalArgumentException("Máximo " + MAX_ENTRIES + " entradas de metadata");
        }
        entries.put(key, value == null ? "" : value);
        return this;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public Map<String, String> copy() {
        return new LinkedHashMap<>(entries);
    }
}
