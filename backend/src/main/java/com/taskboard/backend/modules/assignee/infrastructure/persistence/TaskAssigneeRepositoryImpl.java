package com.taskboard.backend.modules.assignee.infrastructure.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class TaskAssigneeRepositoryImpl implements TaskAssigneeRepositoryCustom {

    private static final String BASE_JOIN = " FROM task_assignee ta "
            + " JOIN app_user u ON u.id = ta.user_id ";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public AssigneeSearchResult searchAssignees(AssigneeSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(condition.taskId(), "taskId must not be null");

        Map<String, Object> params = new HashMap<>();
        params.put("taskId", condition.taskId());
        String whereSql = " WHERE ta.task_id = :taskId";

        if (StringUtils.hasText(condition.keyword())) {
            whereSql += " AND lower(u.username) like :keyword escape '\\'";
            params.put("keyword", containsPattern(condition.keyword()));
        }

        String dataSql = "SELECT u.id, u.username, u.full_name, u.email, ta.created_at"
                + BASE_JOIN + whereSql
                + " ORDER BY lower(u.username), u.id LIMIT :limit OFFSET :offset";

        Query dataQuery = entityManager.createNativeQuery(dataSql);
        applyParameters(dataQuery, params);
        dataQuery.setParameter("limit", condition.limit());
        dataQuery.setParameter("offset", condition.offset());

        @SuppressWarnings("unchecked")
        List<Object[]> rawRows = dataQuery.getResultList();
        List<AssigneeUserView> rows = rawRows.stream()
                .map(TaskAssigneeRepositoryImpl::toView)
                .toList();

        Query countQuery = entityManager.createNativeQuery("SELECT COUNT(*)" + BASE_JOIN + whereSql);
        applyParameters(countQuery, params);
        Number total = (Number) countQuery.getSingleResult();

        return new AssigneeSearchResult(rows, total.longValue());
    }

    /**
     * Lower-cased LIKE pattern matching {@code keyword} literally anywhere in the value.
     * {@code %}, {@code _} and the escape character itself are escaped with a backslash.
     */
    static String containsPattern(String keyword) {
        String escaped = keyword.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static void applyParameters(Query query, Map<String, Object> params) {
        params.forEach(query::setParameter);
    }

    private static AssigneeUserView toView(Object[] row) {
        return new AssigneeUserView(
                ((Number) row[0]).longValue(),
                (String) row[1],
                (String) row[2],
                (String) row[3],
                toOffsetDateTime(row[4])
        );
    }

    private static OffsetDateTime toOffsetDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime;
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.atOffset(ZoneOffset.UTC);
        }
        return OffsetDateTime.parse(value.toString());
    }
}
