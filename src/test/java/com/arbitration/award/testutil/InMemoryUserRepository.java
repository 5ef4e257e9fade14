package com.arbitration.award.testutil;

import com.arbitration.award.model.UserAccount;
import com.arbitration.award.model.UserRole;
import com.arbitration.award.repository.UserRepository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryUserRepository implements UserRepository {

    private final ConcurrentMap<String, UserAccount> users = new ConcurrentHashMap<>();

    @Override
    public UserAccount findById(String userId) {
        return users.get(userId);
    }

    @Override
    public Map<String, UserAccount> findByIds(Collection<String> userIds) {
        Map<String, UserAccount> found = new HashMap<>();
        for (String id : userIds) {
            UserAccount user = users.get(id);
            if (user != null) {
                found.put(id, user);
            }
        }
        return found;
    }

    @Override
    public List<UserAccount> findArbitrators() {
        return users.values().stream().filter(u -> u.getRole() == UserRole.ARBITRATOR).toList();
    }

    @Override
    public void save(UserAccount user) {
        users.put(user.getUserId(), user);
    }
}
