package com.share_link_repair.repository;

import com.share_link_repair.entity.Share;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ShareRepository extends JpaRepository<Share, Integer> {

    /**
     * Bulk delete by id. Returns 0 when the row is already gone.
     */
    @Modifying
    @Query("DELETE FROM Share s WHERE s.id = :id")
    int deleteShareById(@Param("id") Integer id);
}
