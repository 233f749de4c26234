package com.example.loankeeper.access;

import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoJobRunAccess implements JobRunAccess {

    public static final String TABLE_NAME = "job_runs";

    static final Comparator<JobRun> NEWEST_FIRST = Comparator
            .comparing(JobRun::getFinishedAt)
            .thenComparing(JobRun::getRunId)
            .reversed();

    private final DynamoDbTable<JobRun> table;

    public DynamoJobRunAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(JobRun.class));
    }

    @Override
    public void put(JobRun run) {
        table.putItem(run);
    }

    @Override
    public List<JobRun> findLatest(JobType jobType, int limit) {
        // Sort keys start with the finish time, so reading the partition backwards is newest first.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                                Key.builder().partitionValue(jobType.name()).build()))
                        .scanIndexForward(false)
                        .limit(limit))
                .items()
                .stream()
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<JobRun> findLatest(int limit) {
        List<JobRun> merged = new ArrayList<>();
        for (JobType type : JobType.values()) {
            merged.addAll(findLatest(type, limit));
        }
        return merged.stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }
}
