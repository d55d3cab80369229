package com.cx.anomaly.repository;

import java.util.Optional;

/**
 * Named JSON documents backing the model artifacts. Writes replace any previous content under the name.
 */
public interface ArtifactStore {

    void write(String name, String json);

    Optional<String> read(String name);

    /**
     * Human-readable location, used in logs and error messages.
     */
    String location();
}
