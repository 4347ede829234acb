package com.tradeingest.ingest;

import com.tradeingest.domain.enums.BrokerType;
import java.util.List;

/** Who and where a batch's rows are written for. */
public record ImportContext(String userId, String batchId, BrokerType brokerType, List<String> accountTags) {

    public ImportContext {
        accountTags = accountTags == null ? List.of() : List.copyOf(accountTags);
    }
}
