package com.tradeingest.ai;

import com.tradeingest.domain.model.MappingProposal;
import java.util.List;
import java.util.Map;

/**
 * Proposes a column-to-field mapping for an unrecognised layout. Called at most once per file.
 * Proposals are suggestions only; the ingestion core decides whether a human must confirm them.
 */
public interface AiMappingAdapter {

    /**
     * @param brokerNameHint broker the user says produced the file; may be null
     * @throws com.tradeingest.exception.AiMappingException when the service fails or times out
     */
    MappingProposal proposeMapping(List<String> headers, List<Map<String, String>> sampleRows, String brokerNameHint);
}
