package com.pumpfun.indexer.repository;

import com.pumpfun.indexer.entity.DailyWinner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface DailyWinnerRepository extends JpaRepository<DailyWinner, Long> {

    Optional<DailyWinner> findByDay(LocalDate day);
}
