package com.example.loankeeper.access;

import com.example.loankeeper.models.Reminder;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoReminderAccess implements ReminderAccess {

    public static final String TABLE_NAME = "reminders";

    private final DynamoDbTable<Reminder> table;

    public DynamoReminderAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Reminder.class));
    }

    @Override
    public boolean exists(long requestId, String windowKey) {
        Key key = Key.builder()
                .partitionValue(requestId)
                .sortValue(windowKey)
                .build();
        return table.getItem(r -> r.key(key).consistentRead(true)) != null;
    }

    @Override
    public void put(Reminder reminder) {
        table.putItem(reminder);
    }

    @Override
    public void deleteAllForRequest(long requestId) {
        table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(requestId).build())))
                .items()
                .forEach(table::deleteItem);
    }
}
