package com.pumpfun.indexer.repository;

import com.pumpfun.indexer.entity.Token;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TokenRepository extends JpaRepository<Token, Long> {

    Optional<Token> findByAddressIgnoreCase(String address);

    boolean existsByAddressIgnoreCase(String address);
}
