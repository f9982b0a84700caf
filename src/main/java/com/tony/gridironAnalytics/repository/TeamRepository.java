package com.tony.gridironAnalytics.repository;

import com.tony.gridironAnalytics.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, String> {
    List<Team> findAllByOrderByTeamAbbrAsc();
}
