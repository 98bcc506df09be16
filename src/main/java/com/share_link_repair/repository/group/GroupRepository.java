package com.share_link_repair.repository.group;

import com.share_link_repair.entity.group.Group;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GroupRepository extends JpaRepository<Group, Integer> {

    Optional<Group> findByName(String name);

    @Query("SELECT g FROM Group g LEFT JOIN FETCH g.members WHERE g.name = :name")
    Optional<Group> findByNameWithMembers(@Param("name") String name);
}
