package com.devhub.chat.repository;

import com.devhub.chat.model.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * Latest visible messages of a room, newest first. Callers reverse the page.
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.roomId = :roomId AND m.deleted = false ORDER BY m.id DESC")
    List<ChatMessage> findLatest(@Param("roomId") Long roomId, Pageable pageable);

    /**
     * Visible messages older than {@code beforeId}, newest first.
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.roomId = :roomId AND m.deleted = false AND m.id < :beforeId ORDER BY m.id DESC")
    List<ChatMessage> findBefore(@Param("roomId") Long roomId,
                                 @Param("beforeId") Long beforeId,
                                 Pageable pageable);

    boolean existsByIdAndRoomId(Long id, Long roomId);

    long countByRoomId(Long roomId);
}
