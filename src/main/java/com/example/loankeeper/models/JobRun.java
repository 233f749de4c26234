package com.example.loankeeper.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * One finished execution of a job. Rows are written once and never updated; the sort key
 * starts with {@code finishedAt} so each partition reads back in completion order.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class JobRun {

    @NonNull private JobType jobType;    // PK
    @NonNull private String runId;       // SK "{finishedMillis}_{random}"
    @NonNull private String trigger;
    @NonNull private Long startedAt;
    @NonNull private Long finishedAt;
    @NonNull private Boolean success;

    private String errorMessage;
    private Map<String, Object> summary;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("job_type")
    public JobType getJobType() { return jobType; }

    @DynamoDbSortKey
    @DynamoDbAttribute("run_id")
    public String getRunId() { return runId; }

    @DynamoDbAttribute("trigger")
    public String getTrigger() { return trigger; }

    @DynamoDbAttribute("started_at")
    public Long getStartedAt() { return startedAt; }

    @DynamoDbAttribute("finished_at")
    public Long getFinishedAt() { return finishedAt; }

    @DynamoDbAttribute("success")
    public Boolean getSuccess() { return success; }

    @DynamoDbAttribute("error_message")
    public String getErrorMessage() { return errorMessage; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("summary")
    public Map<String, Object> getSummary() { return summary; }
}
