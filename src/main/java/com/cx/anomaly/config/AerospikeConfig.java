package com.cx.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike connection for the artifact store. Only active with {@code cx.artifacts.store=aerospike}.
 *
 * Artifacts are few and large (a fitted LOF carries its training matrix), so writes get a longer
 * timeout than reads and always replace the whole record.
 */
@Configuration
@ConditionalOnProperty(name = "cx.artifacts.store", havingValue = "aerospike")
public class AerospikeConfig {

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    public static final String SET_ARTIFACTS = "cx_artifacts";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:cx}")
    private String namespace;

    @Value("${aerospike.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${aerospike.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Value("${aerospike.write-timeout-ms:10000}")
    private int writeTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.timeout = connectTimeoutMs;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();

        log.info("Connecting artifact store to Aerospike {}:{} namespace={} set={}",
                host, port, namespace, SET_ARTIFACTS);
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = writeTimeoutMs;
        policy.socketTimeout = writeTimeoutMs;
        policy.recordExistsAction = RecordExistsAction.REPLACE;
        policy.sendKey = true; // keep the artifact name readable on the server
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = readTimeoutMs;
        policy.socketTimeout = readTimeoutMs;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
