package com.arbitration.award.repository;

import com.arbitration.award.model.UserAccount;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface UserRepository {

    UserAccount findById(String userId);

    Map<String, UserAccount> findByIds(Collection<String> userIds);

    List<UserAccount> findArbitrators();

    void save(UserAccount user);
}
