package com.example.loankeeper.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A catalog request tracked as a loan. {@code availableSince} is written once, the first time
 * the catalog reports the media as fully available, and never changes afterwards.
 *
 * <p>The extension is stored as three attributes that are either all present or all absent;
 * {@link #extension()} exposes them as a single {@link ExtensionGrant}.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class LoanRequest {

    @NonNull private Long requestId;     // PK, the catalog's request id
    @NonNull private MediaType mediaType;
    @NonNull private Long mediaId;
    @NonNull private Long requestedAt;
    @NonNull private Long firstSeenAt;

    private Long externalServiceId;
    private String requestedBy;
    private String title;
    private Long availableSince;

    // extension, all-or-nothing
    private Long extendedAt;
    private String extendedBy;
    private Integer extensionDays;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("request_id")
    public Long getRequestId() { return requestId; }

    @DynamoDbAttribute("media_type")
    public MediaType getMediaType() { return mediaType; }

    @DynamoDbAttribute("media_id")
    public Long getMediaId() { return mediaId; }

    @DynamoDbAttribute("requested_at")
    public Long getRequestedAt() { return requestedAt; }

    @DynamoDbAttribute("first_seen_at")
    public Long getFirstSeenAt() { return firstSeenAt; }

    @DynamoDbAttribute("external_service_id")
    public Long getExternalServiceId() { return externalServiceId; }

    @DynamoDbAttribute("requested_by")
    public String getRequestedBy() { return requestedBy; }

    @DynamoDbAttribute("title")
    public String getTitle() { return title; }

    @DynamoDbAttribute("available_since")
    public Long getAvailableSince() { return availableSince; }

    @DynamoDbAttribute("extended_at")
    public Long getExtendedAt() { return extendedAt; }

    @DynamoDbAttribute("extended_by")
    public String getExtendedBy() { return extendedBy; }

    @DynamoDbAttribute("extension_days")
    public Integer getExtensionDays() { return extensionDays; }

    @DynamoDbIgnore
    public Optional<ExtensionGrant> extension() {
        if (extendedAt == null || extensionDays == null) {
            return Optional.empty();
        }
        return Optional.of(new ExtensionGrant(extendedAt,
                extendedBy == null ? "" : extendedBy, extensionDays));
    }

    @DynamoDbIgnore
    public boolean isExtended() {
        return extension().isPresent();
    }

    @DynamoDbIgnore
    public boolean isAvailable() {
        return availableSince != null;
    }

    /**
     * Copy of this loan carrying the given grant.
     */
    public LoanRequest withExtension(ExtensionGrant grant) {
        return toBuilder()
                .extendedAt(grant.grantedAt())
                .extendedBy(grant.grantedBy())
                .extensionDays(grant.days())
                .build();
    }
}
