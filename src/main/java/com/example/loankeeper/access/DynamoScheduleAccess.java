package com.example.loankeeper.access;

import com.example.loankeeper.models.Schedule;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
public class DynamoScheduleAccess implements ScheduleAccess {

    public static final String TABLE_NAME = "schedules";

    private final DynamoDbTable<Schedule> table;

    public DynamoScheduleAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Schedule.class));
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(scheduleId)).consistentRead(true)));
    }

    @Override
    public List<Schedule> findAll() {
        // The table stays small (a handful of schedules), a scan is fine.
        return table.scan(r -> r.consistentRead(true))
                .items()
                .stream()
                .sorted(Comparator.comparing(Schedule::getScheduleId))
                .collect(Collectors.toList());
    }

    @Override
    public Schedule save(Schedule schedule) {
        table.putItem(r -> r.item(schedule)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(schedule_id)")
                        .build()));
        return schedule;
    }

    @Override
    public Optional<Schedule> update(Schedule schedule) {
        try {
            table.putItem(r -> r.item(schedule)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_exists(schedule_id)")
                            .build()));
            return Optional.of(schedule);
        } catch (ConditionalCheckFailedException ex) {
            return Optional.empty();
        }
    }

    @Override
    public boolean delete(String scheduleId) {
        return table.deleteItem(buildKey(scheduleId)) != null;
    }

    private Key buildKey(String scheduleId) {
        return Key.builder().partitionValue(scheduleId).build();
    }
}
