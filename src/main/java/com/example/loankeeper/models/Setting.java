package com.example.loankeeper.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Admin-held override for one policy field. Values are stored as strings and parsed on read.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Setting {

    public static final String RETENTION_DAYS = "retention_days";
    public static final String REMINDER_DAYS = "reminder_days";
    public static final String EXTENSION_DAYS = "extension_days";
    public static final String EXTENSION_BASE_URL = "extension_base_url";

    @NonNull private String key;
    @NonNull private String value;
    @NonNull private Long updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("key")
    public String getKey() { return key; }

    @DynamoDbAttribute("value")
    public String getValue() { return value; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }
}
