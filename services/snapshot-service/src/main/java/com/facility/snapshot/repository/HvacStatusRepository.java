package com.facility.snapshot.repository;

import com.facility.snapshot.model.HvacStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HvacStatusRepository extends JpaRepository<HvacStatus, Integer> {

    List<HvacStatus> findAllByOrderByIdAsc();

    boolean existsByCode(String code);
}
