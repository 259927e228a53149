package com.shiptivity.board.infrastructure.persistence.repository;

import com.shiptivity.board.infrastructure.persistence.dao.ClientDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for clients.
 */
@Repository
public interface ClientJpaRepository extends JpaRepository<ClientDao, Long> {

    List<ClientDao> findAllByOrderByIdAsc();

    /**
     * Finds the clients of one lane ordered by priority.
     */
    List<ClientDao> findByStatusOrderByPriorityAsc(String status);

    /**
     * Writes the lane and priority of a single client.
     *
     * @return the number of rows updated
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClientDao c SET c.status = :status, c.priority = :priority WHERE c.id = :id")
    int updatePlacement(
            @Param("id") Long id,
            @Param("status") String status,
            @Param("priority") int priority
    );
}
