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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Marks that a reminder went out for a loan in a particular reminder window. The window key
 * changes when the loan is extended, which allows one more reminder before the new deadline.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Reminder {

    @NonNull private Long requestId;
    @NonNull private String windowKey;
    @NonNull private Long sentAt;

    private String email;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("request_id")
    public Long getRequestId() { return requestId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("window_key")
    public String getWindowKey() { return windowKey; }

    @DynamoDbAttribute("sent_at")
    public Long getSentAt() { return sentAt; }

    @DynamoDbAttribute("email")
    public String getEmail() { return email; }
}
