package org.nowstart.signalforge.repository;

import jakarta.persistence.QueryHint;
import java.time.Instant;
import java.util.List;
import org.nowstart.signalforge.data.entity.LabeledSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;

public interface LabeledSignalRepository extends JpaRepository<LabeledSignal, Long> {

    String FETCH_QUERY_TIMEOUT_MS = "30000";

    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = FETCH_QUERY_TIMEOUT_MS))
    List<LabeledSignal> findByLabeledAtGreaterThanEqualOrderByLabeledAtAsc(Instant from);
}
