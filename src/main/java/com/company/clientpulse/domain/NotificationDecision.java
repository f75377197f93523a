package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.InstanceCategory;
import com.company.clientpulse.domain.enums.SuppressionReason;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of the decision engine: either suppressed with a reason, or send with a payload.
 */
@Getter
@ToString
public class NotificationDecision {
    private final boolean send;
    private final SuppressionReason suppressionReason;
    private final NotificationPayload payload;
    private final Map<InstanceCategory, List<Instance>> instances;

    private NotificationDecision(boolean send, SuppressionReason suppressionReason,
                                 NotificationPayload payload, Map<InstanceCategory, List<Instance>> instances) {
        this.send = send;
        this.suppressionReason = suppressionReason;
        this.payload = payload;
        this.instances = instances;
    }

    public static NotificationDecision suppress(SuppressionReason reason) {
        return new NotificationDecision(false, reason, null, Collections.emptyMap());
    }

    public static NotificationDecision suppress(SuppressionReason reason, Map<InstanceCategory, List<Instance>> instances) {
        return new NotificationDecision(false, reason, null, copyOf(instances));
    }

    public static NotificationDecision send(NotificationPayload payload, Map<InstanceCategory, List<Instance>> instances) {
        return new NotificationDecision(true, null, payload, copyOf(instances));
    }

    public boolean hasOnlyInfraOrUnrelatedIssues() {
        return suppressionReason == SuppressionReason.ONLY_INFRA_OR_UNRELATED;
    }

    private static Map<InstanceCategory, List<Instance>> copyOf(Map<InstanceCategory, List<Instance>> instances) {
        Map<InstanceCategory, List<Instance>> copy = new EnumMap<>(InstanceCategory.class);
        copy.putAll(instances);
        return copy;
    }

    public List<Instance> instancesIn(InstanceCategory category) {
        return instances.getOrDefault(category, List.of());
    }
}
