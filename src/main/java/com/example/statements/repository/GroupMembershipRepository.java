package com.example.statements.repository;

import com.example.statements.domain.GroupMembership;
import com.example.statements.domain.Recipient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface GroupMembershipRepository extends JpaRepository<GroupMembership, Long> {

    Optional<GroupMembership> findByMember(Recipient member);

    @Query("SELECT gm FROM GroupMembership gm JOIN FETCH gm.member WHERE gm.group.id = :groupId")
    List<GroupMembership> findByGroupId(@Param("groupId") Long groupId);

    @Query("SELECT gm FROM GroupMembership gm JOIN FETCH gm.group JOIN FETCH gm.member")
    List<GroupMembership> findAllWithRecipients();

    @Query("SELECT DISTINCT gm.member.id FROM GroupMembership gm")
    Set<Long> findGroupedMemberIds();

    void deleteByGroup(Recipient group);

    void deleteByMember(Recipient member);
}
