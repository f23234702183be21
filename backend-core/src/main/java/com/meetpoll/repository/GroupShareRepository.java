package com.meetpoll.repository;

import com.meetpoll.domain.model.GroupShare;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface GroupShareRepository extends JpaRepository<GroupShare, UUID> {
    List<GroupShare> findByGroup_IdOrderByGranteeEmailAsc(UUID groupId);

    boolean existsByGroup_IdAndGranteeEmail(UUID groupId, String granteeEmail);

    @Modifying
    @Query("delete from GroupShare gs where gs.group.id = :groupId and gs.granteeEmail = :granteeEmail")
    int deleteShare(@Param("groupId") UUID groupId, @Param("granteeEmail") String granteeEmail);

    @Modifying
    @Query("delete from GroupShare gs where gs.group.id = :groupId")
    int deleteByGroupId(@Param("groupId") UUID groupId);
}
