package com.devhub.chat.repository;

import com.devhub.chat.model.ChatRoom;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatRoomRepository extends JpaRepository<ChatRoom, Long> {

    Optional<ChatRoom> findByIdAndActiveTrue(Long id);

    /**
     * Row-locks the room for the rest of the transaction. Membership changes take
     * this lock so capacity checks stay serialized across application nodes.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ChatRoom r WHERE r.id = :id")
    Optional<ChatRoom> findByIdForUpdate(@Param("id") Long id);

    Optional<ChatRoom> findByDirectKey(String directKey);

    /**
     * Active rooms in which the user holds an active membership, most recently updated first.
     */
    @Query("SELECT r FROM ChatRoom r, RoomMembership m WHERE m.roomId = r.id AND m.userId = :userId "
            + "AND m.active = true AND r.active = true ORDER BY r.updatedAt DESC, r.id DESC")
    List<ChatRoom> findActiveRoomsOf(@Param("userId") Long userId);
}
