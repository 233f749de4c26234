package com.example.loankeeper.access;

import com.example.loankeeper.models.LoanRequest;
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
public class DynamoLoanRequestAccess implements LoanRequestAccess {

    public static final String TABLE_NAME = "loan_requests";

    private final DynamoDbTable<LoanRequest> table;

    public DynamoLoanRequestAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(LoanRequest.class));
    }

    @Override
    public Optional<LoanRequest> findByRequestId(long requestId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(requestId)).consistentRead(true)));
    }

    @Override
    public List<LoanRequest> findAll() {
        return table.scan(r -> r.consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public void save(LoanRequest loan) {
        table.putItem(loan);
    }

    @Override
    public LoanRequest mergeCatalogFields(LoanRequest loan) {
        LoanRequest catalogOnly = loan.toBuilder()
                .extendedAt(null)
                .extendedBy(null)
                .extensionDays(null)
                .build();
        if (catalogOnly.getAvailableSince() == null) {
            return table.updateItem(r -> r.item(catalogOnly).ignoreNulls(true));
        }
        try {
            return table.updateItem(r -> r.item(catalogOnly).ignoreNulls(true)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_not_exists(available_since)")
                            .build()));
        } catch (ConditionalCheckFailedException ex) {
            // already stamped, keep the stored value
            LoanRequest unstamped = catalogOnly.toBuilder().availableSince(null).build();
            return table.updateItem(r -> r.item(unstamped).ignoreNulls(true));
        }
    }

    @Override
    public boolean saveExtension(LoanRequest extended) {
        try {
            table.putItem(r -> r.item(extended)
                    .conditionExpression(Expression.builder()
                            .expression("attribute_exists(request_id) AND attribute_not_exists(extended_at)")
                            .build()));
            return true;
        } catch (ConditionalCheckFailedException ex) {
            return false;
        }
    }

    @Override
    public void delete(long requestId) {
        table.deleteItem(buildKey(requestId));
    }

    private Key buildKey(long requestId) {
        return Key.builder().partitionValue(requestId).build();
    }
}
