package com.logsense.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Aerospike connection for the run history. Full-context tests run under the "test" profile
 * and supply their own client.
 */
@Getter
@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_RUNS = "runs";
    public static final String SET_RUN_ANOMALIES = "run_anomalies";
    public static final String SET_SEQUENCES = "sequences";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:logsense}")
    private String namespace;

    @Value("${aerospike.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.timeout = connectTimeoutMs;
        // start even when the cluster is down; recording failures are reported per run
        clientPolicy.failIfNotConnected = false;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();
        clientPolicy.scanPolicyDefault = defaultScanPolicy();

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        // store user keys alongside digests so records stay readable from aql
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public ScanPolicy defaultScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
