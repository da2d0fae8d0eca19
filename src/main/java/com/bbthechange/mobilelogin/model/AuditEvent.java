package com.bbthechange.mobilelogin.model;

import com.bbthechange.mobilelogin.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.Map;

/**
 * Observability record of something that happened on a connection.
 * Never read back on a control path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class AuditEvent {
    private String eventId;
    private String socketId;
    private String eventType;
    private String mobileNumber;
    private String status;
    private Map<String, String> attributes;
    private Instant timestamp;

    @DynamoDbPartitionKey
    public String getEventId() {
        return eventId;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getTimestamp() {
        return timestamp;
    }
}
