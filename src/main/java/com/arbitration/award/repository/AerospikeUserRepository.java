package com.arbitration.award.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.arbitration.award.config.AerospikeConfig;
import com.arbitration.award.model.ArbitratorProfile;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.model.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class AerospikeUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeUserRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;

    public AerospikeUserRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy,
                                   @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.batchPolicy = batchPolicy;
    }

    @Override
    public UserAccount findById(String userId) {
        Record record = client.get(readPolicy, key(userId));
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public Map<String, UserAccount> findByIds(Collection<String> userIds) {
        if (userIds.isEmpty()) return Collections.emptyMap();

        List<String> ids = new ArrayList<>(userIds);
        Key[] keys = new Key[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            keys[i] = key(ids.get(i));
        }

        Record[] records = client.get(batchPolicy, keys);
        Map<String, UserAccount> result = new HashMap<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                result.put(ids.get(i), mapRecord(records[i]));
            }
        }
        return result;
    }

    @Override
    public List<UserAccount> findArbitrators() {
        List<UserAccount> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_USERS,
                (key, record) -> {
                    try {
                        if (UserRole.ARBITRATOR.name().equals(record.getString("role"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read user record: {}", e.getMessage());
                    }
                });
        return results;
    }

    @Override
    public void save(UserAccount user) {
        ArbitratorProfile profile = user.getArbitratorProfile();
        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("userId", user.getUserId()));
        bins.add(new Bin("displayName", user.getDisplayName()));
        bins.add(new Bin("role", user.getRole().name()));
        bins.add(new Bin("phoneNumber", user.getPhoneNumber() != null ? user.getPhoneNumber() : ""));
        bins.add(new Bin("email", user.getEmail() != null ? user.getEmail() : ""));
        if (profile != null) {
            bins.add(new Bin("active", profile.isActive()));
            bins.add(new Bin("seniorReviewer", profile.isSeniorReviewer()));
            bins.add(new Bin("yearsExperience", profile.getYearsExperience()));
            bins.add(new Bin("casesCompleted", profile.getCasesCompleted()));
        }
        client.put(writePolicy, key(user.getUserId()), bins.toArray(new Bin[0]));
    }

    private Key key(String userId) {
        return new Key(namespace, AerospikeConfig.SET_USERS, userId);
    }

    private UserAccount mapRecord(Record record) {
        UserRole role = UserRole.valueOf(record.getString("role"));
        String phone = record.getString("phoneNumber");
        String email = record.getString("email");

        ArbitratorProfile profile = null;
        if (role == UserRole.ARBITRATOR) {
            profile = ArbitratorProfile.builder()
                    .active(record.getBoolean("active"))
                    .seniorReviewer(record.getBoolean("seniorReviewer"))
                    .yearsExperience(record.getInt("yearsExperience"))
                    .casesCompleted(record.getInt("casesCompleted"))
                    .build();
        }

        return UserAccount.builder()
                .userId(record.getString("userId"))
                .displayName(record.getString("displayName"))
                .role(role)
                .phoneNumber(phone != null && !phone.isEmpty() ? phone : null)
                .email(email != null && !email.isEmpty() ? email : null)
                .arbitratorProfile(profile)
                .build();
    }
}
