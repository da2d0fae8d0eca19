package com.bbthechange.mobilelogin.repository.impl;

import com.bbthechange.mobilelogin.exception.RepositoryException;
import com.bbthechange.mobilelogin.model.AuditEvent;
import com.bbthechange.mobilelogin.model.AuditEventKind;
import com.bbthechange.mobilelogin.repository.AuditEventRepository;
import com.bbthechange.mobilelogin.util.QueryPerformanceTracker;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.EnumMap;
import java.util.Map;

@Repository
public class AuditEventRepositoryImpl implements AuditEventRepository {

    private final Map<AuditEventKind, DynamoDbTable<AuditEvent>> tables = new EnumMap<>(AuditEventKind.class);
    private final QueryPerformanceTracker queryTracker;

    public AuditEventRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.queryTracker = queryTracker;
        TableSchema<AuditEvent> schema = TableSchema.fromBean(AuditEvent.class);
        for (AuditEventKind kind : AuditEventKind.values()) {
            tables.put(kind, dynamoDbEnhancedClient.table(kind.getTableName(), schema));
        }
    }

    @Override
    public void save(AuditEventKind kind, AuditEvent event) {
        queryTracker.trackCommand("PutItem", kind.getTableName(), () -> {
            try {
                tables.get(kind).putItem(event);
            } catch (DynamoDbException e) {
                throw new RepositoryException("Failed to write " + kind + " audit event", e);
            }
        });
    }
}
