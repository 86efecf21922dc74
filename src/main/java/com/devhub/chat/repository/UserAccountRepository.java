package com.devhub.chat.repository;

import com.devhub.chat.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    Optional<UserAccount> findByAccessTokenAndActiveTrue(String accessToken);

    Optional<UserAccount> findByIdAndActiveTrue(Long id);
}
