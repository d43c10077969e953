package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.Workspace;
import com.conveyor.orchestrator.statemachine.WorkspaceState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkspaceRepository extends JpaRepository<Workspace, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Workspace w WHERE w.id = :id")
    Optional<Workspace> findForUpdate(@Param("id") String id);

    List<Workspace> findByStatusIn(Collection<WorkspaceState> states);
}
