package com.example.loankeeper.config;

import com.example.loankeeper.access.DynamoJobRunAccess;
import com.example.loankeeper.access.DynamoLoanRequestAccess;
import com.example.loankeeper.access.DynamoReminderAccess;
import com.example.loankeeper.access.DynamoScheduleAccess;
import com.example.loankeeper.access.DynamoSettingAccess;
import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.LoanRequest;
import com.example.loankeeper.models.Reminder;
import com.example.loankeeper.models.Schedule;
import com.example.loankeeper.models.Setting;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;

/**
 * Creates the service tables on startup for local stacks (LocalStack, DynamoDB Local).
 * Enable with loan.dynamo.create-tables=true. Existing tables are left untouched; attributes
 * added in later versions need no migration because missing attributes read back as null.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "loan.dynamo.create-tables", havingValue = "true")
public class DynamoTableBootstrap {

    private static final ProvisionedThroughput THROUGHPUT = ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();

    private final DynamoDbEnhancedClient enhancedClient;

    @PostConstruct
    public void createTables() {
        create(DynamoScheduleAccess.TABLE_NAME, TableSchema.fromBean(Schedule.class));
        create(DynamoJobRunAccess.TABLE_NAME, TableSchema.fromBean(JobRun.class));
        create(DynamoLoanRequestAccess.TABLE_NAME, TableSchema.fromBean(LoanRequest.class));
        create(DynamoReminderAccess.TABLE_NAME, TableSchema.fromBean(Reminder.class));
        create(DynamoSettingAccess.TABLE_NAME, TableSchema.fromBean(Setting.class));
    }

    private <T> void create(String tableName, TableSchema<T> schema) {
        try {
            enhancedClient.table(tableName, schema)
                    .createTable(r -> r.provisionedThroughput(THROUGHPUT));
            log.info("Created table {}", tableName);
        } catch (ResourceInUseException ex) {
            log.debug("Table {} already exists", tableName);
        }
    }
}
