package com.example.loankeeper.access;

import com.example.loankeeper.models.Setting;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoSettingAccess implements SettingAccess {

    public static final String TABLE_NAME = "settings";

    private final DynamoDbTable<Setting> table;

    public DynamoSettingAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Setting.class));
    }

    @Override
    public Optional<Setting> findByKey(String key) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder().partitionValue(key).build())));
    }

    @Override
    public void put(Setting setting) {
        table.putItem(setting);
    }
}
