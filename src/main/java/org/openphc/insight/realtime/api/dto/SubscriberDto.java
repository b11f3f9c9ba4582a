package org.openphc.insight.realtime.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openphc.insight.realtime.domain.model.AuthorizationSnapshot;
import org.openphc.insight.realtime.domain.model.Subscriber;
import org.openphc.insight.realtime.domain.model.enums.FieldClassification;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberDto {

    private String connectionId;
    private String userId;
    private String tenantId;
    private int authorizedPatientCount;
    private Set<String> entitlements;
    private Instant authorizationFetchedAt;
    private long cursor;
    private long acknowledged;

    public static SubscriberDto from(Subscriber subscriber) {
        AuthorizationSnapshot auth = subscriber.getAuthorization();
        return SubscriberDto.builder()
                .connectionId(subscriber.getConnectionId())
                .userId(subscriber.getUserId())
                .tenantId(subscriber.getTenantId())
                .authorizedPatientCount(auth.authorizedPatientIds().size())
                .entitlements(auth.entitlements().stream()
                        .map(FieldClassification::wireName)
                        .collect(Collectors.toCollection(TreeSet::new)))
                .authorizationFetchedAt(auth.fetchedAt())
                .cursor(subscriber.cursor())
                .acknowledged(subscriber.acknowledged())
                .build();
    }
}
