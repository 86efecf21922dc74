package com.devhub.chat.repository;

import com.devhub.chat.model.RoomMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoomMembershipRepository extends JpaRepository<RoomMembership, Long> {

    Optional<RoomMembership> findByUserIdAndRoomId(Long userId, Long roomId);

    boolean existsByUserIdAndRoomIdAndActiveTrue(Long userId, Long roomId);

    /** Active members in join order. */
    List<RoomMembership> findByRoomIdAndActiveTrueOrderByJoinedAtAscIdAsc(Long roomId);

    long countByRoomIdAndActiveTrue(Long roomId);
}
