package com.company.clientpulse.domain;

import com.company.clientpulse.domain.enums.CheckCategory;
import com.company.clientpulse.domain.enums.CheckStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString
public class CheckResult {
    private final String name;
    private final CheckCategory category;
    private final CheckStatus status;
    private final String description;
    private final Instant timestamp;
    @Singular
    private final Map<String, DetailValue> details;
    @Singular
    private final List<String> affectedNodes;

    public boolean isFailing() {
        return status == CheckStatus.FAIL;
    }
}
