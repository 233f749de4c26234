package com.example.loankeeper.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
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
 * A stored cron schedule for one job type. The id is "{createdMillis}_{random}" so ordering by
 * id is ordering by creation.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // required by DynamoDB Enhanced Client
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Schedule {

    @NonNull private String scheduleId;
    @NonNull private JobType jobType;
    @NonNull private String cronExpression;
    @NonNull private Boolean enabled;
    @NonNull private Long createdAt;
    @NonNull private Long updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("schedule_id")
    public String getScheduleId() { return scheduleId; }

    @DynamoDbAttribute("job_type")
    public JobType getJobType() { return jobType; }

    @DynamoDbAttribute("cron_expression")
    public String getCronExpression() { return cronExpression; }

    @DynamoDbAttribute("enabled")
    public Boolean getEnabled() { return enabled; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }
}
