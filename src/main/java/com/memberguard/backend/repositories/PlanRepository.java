package com.memberguard.backend.repositories;

import com.memberguard.backend.models.Plan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlanRepository extends JpaRepository<Plan, Long> {

    /**
     * Renewal options shown to users, shortest first
     */
    List<Plan> findByActiveTrueOrderByDurationDaysAsc();
}
