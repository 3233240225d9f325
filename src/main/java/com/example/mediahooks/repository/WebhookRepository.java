package com.example.mediahooks.repository;

import com.example.mediahooks.model.TriggerType;
import com.example.mediahooks.model.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Webhook 仓储接口。
 */
@Repository
public interface WebhookRepository extends JpaRepository<Webhook, Long> {

    /**
     * 查询指定事件的启用 webhook。
     *
     * @param triggerType 触发类型
     * @param eventType   事件名
     * @return webhook 列表
     */
    List<Webhook> findByTriggerTypeAndEventTypeAndEnabledTrue(TriggerType triggerType, String eventType);

    List<Webhook> findByTriggerTypeAndEnabledTrue(TriggerType triggerType);

    Optional<Webhook> findByIdAndEnabledTrue(Long id);

    /**
     * 更新最近触发时间
     *
     * @param id          webhook ID
     * @param triggeredAt 触发时间
     * @return 更新记录数
     */
    @Modifying
    @Transactional
    @Query("UPDATE Webhook w SET w.lastTriggered = :triggeredAt WHERE w.id = :id")
    int touchLastTriggered(@Param("id") Long id, @Param("triggeredAt") LocalDateTime triggeredAt);
}
