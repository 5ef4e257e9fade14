package com.arbitration.award.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_DRAFT_AWARDS = "draft_awards";
    public static final String SET_REVISIONS = "draft_revisions";
    public static final String SET_REVISION_COUNTERS = "draft_rev_counters";
    public static final String SET_ESCALATIONS = "award_escalations";
    public static final String SET_AWARDS = "awards";
    public static final String SET_AWARD_DAY_COUNTERS = "award_day_counters";
    public static final String SET_AUDIT_LOG = "audit_log";
    public static final String SET_AUDIT_TAIL = "audit_tail";
    public static final String SET_CASES = "cases";
    public static final String SET_USERS = "users";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:arbitration}")
    private String namespace;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;

        // Read policy defaults
        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        // Write policy defaults
        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    /**
     * Insert-only writes. A second write to the same key fails with KEY_EXISTS_ERROR,
     * which is how per-case and per-version uniqueness is enforced.
     */
    @Bean
    public WritePolicy createOnlyWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public BatchPolicy defaultBatchPolicy() {
        BatchPolicy policy = new BatchPolicy();
        policy.totalTimeout = 5000;
        policy.socketTimeout = 2000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
