package com.threadline.notificationservice.repository;

import com.threadline.notificationservice.dto.NotificationFilter;
import com.threadline.notificationservice.model.Notification;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.util.List;
import java.util.UUID;

public class NotificationQueryRepositoryImpl implements NotificationQueryRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Notification> findInbox(UUID userId, UUID tenantId, NotificationFilter filter) {
        String jpql = "SELECT n FROM Notification n" + whereClause(filter) + " ORDER BY n.createdAt DESC, n.id DESC";
        TypedQuery<Notification> query = entityManager.createQuery(jpql, Notification.class);
        bind(query, userId, tenantId, filter);
        return query
                .setFirstResult(filter.getOffset())
                .setMaxResults(filter.getLimit())
                .getResultList();
    }

    @Override
    public long countInbox(UUID userId, UUID tenantId, NotificationFilter filter) {
        String jpql = "SELECT COUNT(n) FROM Notification n" + whereClause(filter);
        TypedQuery<Long> query = entityManager.createQuery(jpql, Long.class);
        bind(query, userId, tenantId, filter);
        return query.getSingleResult();
    }

    private String whereClause(NotificationFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE n.userId = :userId AND n.tenantId = :tenantId");
        if (filter.getCategory() != null) {
            where.append(" AND n.category = :category");
        }
        if (filter.getIsRead() != null) {
            where.append(" AND n.isRead = :isRead");
        }
        if (filter.getPriority() != null) {
            where.append(" AND n.priority = :priority");
        }
        return where.toString();
    }

    private void bind(TypedQuery<?> query, UUID userId, UUID tenantId, NotificationFilter filter) {
        query.setParameter("userId", userId);
        query.setParameter("tenantId", tenantId);
        if (filter.getCategory() != null) {
            query.setParameter("category", filter.getCategory());
        }
        if (filter.getIsRead() != null) {
            query.setParameter("isRead", filter.getIsRead());
        }
        if (filter.getPriority() != null) {
            query.setParameter("priority", filter.getPriority());
        }
    }
}
