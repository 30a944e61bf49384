package com.starscape.bracketflow.features.credits.infra;

import com.starscape.bracketflow.features.credits.domain.CreditAccount;
import com.starscape.bracketflow.features.credits.domain.CreditAccountRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaCreditAccountRepository extends JpaRepository<CreditAccount, String>, CreditAccountRepository {
    
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CreditAccount a WHERE a.userId = :userId")
    Optional<CreditAccount> findByIdForUpdate(@Param("userId") String userId);
}
