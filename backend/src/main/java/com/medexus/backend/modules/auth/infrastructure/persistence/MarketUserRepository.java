package com.medexus.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.medexus.backend.modules.auth.domain.MarketUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MarketUserRepository extends JpaRepository<MarketUser, UUID> {

    @Query("select mu from MarketUser mu where lower(mu.email) = lower(:email)")
    Optional<MarketUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(mu) > 0 then true else false end from MarketUser mu where lower(mu.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
