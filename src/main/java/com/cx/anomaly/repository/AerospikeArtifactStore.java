package com.cx.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.cx.anomaly.config.AerospikeConfig;
import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * One Aerospike record per artifact in set {@value AerospikeConfig#SET_ARTIFACTS}, keyed by artifact name.
 */
@Repository
@ConditionalOnProperty(name = "cx.artifacts.store", havingValue = "aerospike")
public class AerospikeArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeArtifactStore.class);

    static final String BIN_NAME = "name";
    static final String BIN_JSON = "json";
    static final String BIN_WRITTEN_AT = "writtenAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeArtifactStore(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public void write(String name, String json) {
        Key key = new Key(namespace, AerospikeConfig.SET_ARTIFACTS, name);
        try {
            client.put(writePolicy, key,
                    new Bin(BIN_NAME, name),
                    new Bin(BIN_JSON, json),
                    new Bin(BIN_WRITTEN_AT, System.currentTimeMillis()));
            log.debug("Saved artifact {} to {}.{}", name, namespace, AerospikeConfig.SET_ARTIFACTS);
        } catch (AerospikeException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_WRITE, "Failed to save artifact " + name, e);
        }
    }

    @Override
    public Optional<String> read(String name) {
        Key key = new Key(namespace, AerospikeConfig.SET_ARTIFACTS, name);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new DetectorException(ErrorKind.ARTIFACT_MALFORMED, "Failed to read artifact " + name, e);
        }
        if (record == null) return Optional.empty();
        return Optional.ofNullable(record.getString(BIN_JSON));
    }

    @Override
    public String location() {
        return "aerospike://" + namespace + "/" + AerospikeConfig.SET_ARTIFACTS;
    }
}
