package com.flagship.footy_marketplace.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, String> {

    long countByResult(WebhookResult result);

    @Modifying
    @Query("DELETE FROM WebhookEventEntity w WHERE w.receivedAt < :before")
    int deleteReceivedBefore(@Param("before") Instant before);
}
