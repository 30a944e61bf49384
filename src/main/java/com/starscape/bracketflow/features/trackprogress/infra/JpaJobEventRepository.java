package com.starscape.bracketflow.features.trackprogress.infra;

import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import com.starscape.bracketflow.features.trackprogress.domain.JobEventRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaJobEventRepository extends JpaRepository<JobEvent, String>, JobEventRepository {
}
